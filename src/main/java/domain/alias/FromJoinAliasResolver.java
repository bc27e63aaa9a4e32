package domain.alias;

import domain.normalize.SqlTextNormalizer;
import domain.sql.SqlIdentifierUtil;
import domain.sql.SqlScan;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Best-effort resolver that collects alias -> table map from FROM/JOIN clauses.
 *
 * <p>Lightweight (no AST). Every FROM and JOIN occurrence is scanned, including those inside
 * subqueries, and comma-separated FROM lists are followed. When an alias is defined twice the
 * last definition wins.</p>
 */
public final class FromJoinAliasResolver {

    private static final Set<String> NOT_AN_ALIAS = Set.of(
            "where", "join", "left", "right", "inner", "outer", "full", "cross", "natural",
            "on", "using", "group", "order", "having", "limit", "offset", "union", "intersect",
            "except", "select", "from", "and", "or", "not", "as", "window", "set", "values"
    );

    private FromJoinAliasResolver() {
    }

    public static AliasMap resolve(String sql) {
        Map<String, String> aliasToTable = new LinkedHashMap<>();
        Set<String> tables = new LinkedHashSet<>();
        Set<String> derived = new LinkedHashSet<>();
        if (sql == null || sql.isEmpty()) return AliasMap.empty();

        scan(sql, aliasToTable, tables, derived);
        return new AliasMap(aliasToTable, tables, derived);
    }

    private static void scan(String sql, Map<String, String> aliasToTable, Set<String> tables, Set<String> derived) {
        SqlScan st = new SqlScan(sql);

        boolean expectTable = false;
        boolean inFromList = false;

        while (st.hasNext()) {
            if (st.peekIsLineComment() || st.peekIsBlockComment() || st.peekIsSingleQuotedString()) {
                st.readOpaque();
                continue;
            }

            if (st.peekWord("FROM")) {
                st.readWord();
                expectTable = true;
                inFromList = true;
                continue;
            }

            // join type: LEFT/RIGHT/INNER/FULL/CROSS/NATURAL ... JOIN
            if (st.peekWord("JOIN")) {
                st.readWord();
                expectTable = true;
                inFromList = false;
                continue;
            }

            if (expectTable) {
                if (Character.isWhitespace(st.peek())) {
                    st.readSpaces();
                    continue;
                }

                // derived table: FROM (SELECT ...) alias
                if (st.peek() == '(') {
                    String block = st.readParenBlock();
                    scan(block.substring(1, Math.max(1, block.length() - 1)), aliasToTable, tables, derived);
                    String alias = readAliasIfPresent(st);
                    if (alias != null) {
                        aliasToTable.remove(alias);
                        derived.add(alias);
                    }
                    expectTable = continuesFromList(st, inFromList);
                    continue;
                }

                String tableToken = readTableToken(st);
                if (tableToken.isEmpty()) {
                    // unexpected token, stop expecting
                    expectTable = false;
                    st.read();
                    continue;
                }

                String table = key(tableToken);
                tables.add(table);

                String alias = readAliasIfPresent(st);
                if (alias != null) {
                    derived.remove(alias);
                    aliasToTable.put(alias, table);
                }

                expectTable = continuesFromList(st, inFromList);
                continue;
            }

            if (SqlScan.isWordChar(st.peek())) {
                st.readWord();
                continue;
            }
            st.read();
        }
    }

    private static String readTableToken(SqlScan st) {
        if (st.peekIsDoubleQuotedString() || st.peekIsBacktickQuoted()) {
            return SqlIdentifierUtil.unquote(st.readOpaque());
        }
        if (!SqlIdentifierUtil.isIdentStart(st.peek())) return "";

        StringBuilder sb = new StringBuilder(st.readWord());
        // schema.table
        while (st.peek() == '.') {
            st.read();
            sb.append('.').append(st.readWord());
        }
        return sb.toString();
    }

    private static String readAliasIfPresent(SqlScan st) {
        int save = st.pos();
        st.readSpaces();
        boolean explicitAs = false;
        if (st.peekWord("AS")) {
            st.readWord();
            st.readSpaces();
            explicitAs = true;
        }

        String alias = null;
        if (st.peekIsDoubleQuotedString() || st.peekIsBacktickQuoted()) {
            alias = SqlIdentifierUtil.unquote(st.readOpaque());
        } else if (SqlIdentifierUtil.isIdentStart(st.peek())) {
            int wordStart = st.pos();
            String w = st.readWord();
            if (!explicitAs && NOT_AN_ALIAS.contains(key(w))) {
                st.seek(wordStart);
                w = null;
            }
            alias = w;
        }

        if (alias == null || alias.isBlank()) {
            if (!explicitAs) st.seek(save);
            return null;
        }
        return key(alias);
    }

    private static boolean continuesFromList(SqlScan st, boolean inFromList) {
        if (!inFromList) return false;
        int save = st.pos();
        st.readSpaces();
        if (st.peek() == ',') {
            st.read();
            return true;
        }
        st.seek(save);
        return false;
    }

    private static String key(String token) {
        return SqlTextNormalizer.normalizeQuery(token);
    }
}
