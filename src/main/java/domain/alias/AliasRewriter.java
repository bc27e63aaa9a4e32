package domain.alias;

import domain.model.EvaluationWarning;
import domain.model.EvaluationWarningSink;
import domain.model.QueryContext;
import domain.model.WarningCode;
import domain.normalize.SqlTextNormalizer;
import domain.sql.SqlIdentifierUtil;
import domain.sql.SqlScan;

import java.util.Set;

/**
 * Rewrites {@code alias.column} references to {@code table.column}.
 *
 * <p>Only whole identifier tokens directly followed by {@code .} are considered, so an alias
 * {@code t} never touches {@code st.x} or {@code t1.x}. Literals and comments are preserved.
 * A qualifier that is neither an alias, a derived-table alias nor a known table is reported as
 * {@link WarningCode#ALIAS_UNRESOLVED} and left as-is.</p>
 */
public final class AliasRewriter {

    private AliasRewriter() {
    }

    /** Rewrite without schema knowledge or warning collection. */
    public static String rewrite(String sql, AliasMap aliases) {
        return rewrite(sql, aliases, Set.of(), QueryContext.standalone(), EvaluationWarningSink.none());
    }

    /**
     * @param knownTableKeys schema table names in {@link SqlTextNormalizer#identifierKey} form
     */
    public static String rewrite(String sql,
                                 AliasMap aliases,
                                 Set<String> knownTableKeys,
                                 QueryContext ctx,
                                 EvaluationWarningSink sink) {
        if (sql == null || sql.isEmpty()) return sql == null ? "" : sql;
        AliasMap map = (aliases == null) ? AliasMap.empty() : aliases;
        Set<String> known = (knownTableKeys == null) ? Set.of() : knownTableKeys;
        EvaluationWarningSink warnSink = (sink == null) ? EvaluationWarningSink.none() : sink;

        StringBuilder out = new StringBuilder(sql.length() + 32);
        SqlScan st = new SqlScan(sql);

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { out.append(st.readOpaque()); continue; }

            char ch = st.peek();
            if (!SqlScan.isWordChar(ch)) {
                out.append(st.read());
                continue;
            }

            String word = st.readWord();
            if (st.peek() != '.' || !SqlIdentifierUtil.isIdentStart(word.charAt(0)) || !qualifiesSomething(st)) {
                out.append(word);
                continue;
            }

            String qualifier = SqlTextNormalizer.normalizeQuery(word);
            String table = map.tableFor(qualifier);
            if (table != null) {
                out.append(table);
                continue;
            }

            if (!map.isDerivedAlias(qualifier)
                    && !map.tables().contains(qualifier)
                    && !known.contains(SqlTextNormalizer.identifierKey(word))) {
                warnSink.warn(EvaluationWarning.of(
                        WarningCode.ALIAS_UNRESOLVED,
                        ctx,
                        "alias prefix could not be resolved to a table",
                        word
                ));
            }
            out.append(word);
        }

        return out.toString();
    }

    /** Cursor sits on '.', true when an identifier or '*' follows it. */
    private static boolean qualifiesSomething(SqlScan st) {
        String s = st.text();
        int next = st.pos() + 1;
        if (next >= s.length()) return false;
        char c = s.charAt(next);
        return SqlScan.isWordChar(c) || c == '*' || c == '"' || c == '`';
    }
}
