package domain.schema;

import domain.model.EvaluationWarning;
import domain.model.EvaluationWarningSink;
import domain.model.QueryContext;
import domain.model.WarningCode;
import domain.normalize.SqlTextNormalizer;
import domain.sql.SqlIdentifierUtil;
import domain.sql.SqlScan;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Binds column references to fully qualified {@code table.column} identifiers of one schema.
 *
 * <p>Rules:
 * <ul>
 *   <li>{@code table.column} with a known table and column: kept, normalized.</li>
 *   <li>{@code x.column} where {@code x} is not a known table (an unresolved alias) and
 *   {@code column} alone: bound only when exactly one candidate table has the column.
 *   Candidates are first narrowed to the tables the query references; if none of those has
 *   the column, every schema table is considered.</li>
 *   <li>More than one candidate: left unbound and reported as
 *   {@link WarningCode#AMBIGUOUS_COLUMN}.</li>
 * </ul>
 * Names are compared in {@link SqlTextNormalizer#identifierKey} form, so {@code ten_hoc_sinh}
 * and {@code ten hoc sinh} are the same column. Immutable after construction and safe to share
 * across threads.</p>
 */
public final class SchemaBinder {

    private static final Set<String> NOT_A_COLUMN = Set.of(
            "and", "or", "not", "null", "is", "in", "like", "between", "exists", "distinct", "as",
            "asc", "desc", "case", "when", "then", "else", "end", "true", "false", "select", "from",
            "where", "group", "order", "by", "having", "limit", "offset", "union", "intersect",
            "except", "join", "on", "all", "any", "some", "escape", "glob", "collate", "cast"
    );

    private final String dbId;
    private final Set<String> tableKeys = new LinkedHashSet<>();
    private final Set<String> qualifiedKeys = new HashSet<>();
    private final Map<String, List<String>> tablesByColumn = new HashMap<>();

    public SchemaBinder(SchemaRecord schema) {
        this.dbId = schema.getDbId();
        for (String t : schema.getTableNames()) {
            tableKeys.add(key(t));
        }
        for (SchemaColumn c : schema.getColumns()) {
            if (c.isWildcard()) continue;
            String col = key(c.name);
            if (col.isEmpty()) continue;
            String table = key(schema.tableOf(c));
            if (qualifiedKeys.add(table + "." + col)) {
                tablesByColumn.computeIfAbsent(col, k -> new ArrayList<>(2)).add(table);
            }
        }
    }

    private static String key(String s) {
        return SqlTextNormalizer.identifierKey(SqlIdentifierUtil.unquote(s));
    }

    public String getDbId() {
        return dbId;
    }

    public Set<String> tableKeys() {
        return Collections.unmodifiableSet(tableKeys);
    }

    public boolean isKnownTable(String table) {
        return table != null && tableKeys.contains(key(table));
    }

    public boolean hasColumn(String table, String column) {
        return qualifiedKeys.contains(key(table) + "." + key(column));
    }

    /** Column present in more than one table. */
    public boolean isAmbiguousColumn(String column) {
        List<String> c = tablesByColumn.get(key(column));
        return c != null && c.size() > 1;
    }

    /**
     * Resolve a single column reference.
     *
     * @param qualifier     table or alias before the dot, or null for a bare column
     * @param scopeTableKeys tables referenced by the query, in identifier-key form
     * @return {@code table.column} in identifier-key form, or null when unknown or ambiguous
     */
    public String resolve(String qualifier, String column, Set<String> scopeTableKeys) {
        String col = key(column);
        if (qualifier != null) {
            String q = key(qualifier);
            if (tableKeys.contains(q)) {
                return qualifiedKeys.contains(q + "." + col) ? q + "." + col : null;
            }
        }
        List<String> pool = candidates(col, scopeTableKeys);
        return pool.size() == 1 ? pool.get(0) + "." + col : null;
    }

    private List<String> candidates(String col, Set<String> scopeTableKeys) {
        List<String> all = tablesByColumn.get(col);
        if (all == null) return List.of();
        if (scopeTableKeys == null || scopeTableKeys.isEmpty() || all.size() == 1) return all;

        List<String> scoped = new ArrayList<>(all.size());
        for (String t : all) {
            if (scopeTableKeys.contains(t)) scoped.add(t);
        }
        return scoped.isEmpty() ? all : scoped;
    }

    /**
     * Rewrites every column reference inside an expression or condition fragment to its bound
     * form. Literals, function names, keywords and unknown identifiers are left untouched.
     */
    public String bindExpression(String expr,
                                 Set<String> scopeTableKeys,
                                 QueryContext ctx,
                                 EvaluationWarningSink sink) {
        if (expr == null || expr.isEmpty()) return expr == null ? "" : expr;
        EvaluationWarningSink warnSink = (sink == null) ? EvaluationWarningSink.none() : sink;

        StringBuilder out = new StringBuilder(expr.length() + 16);
        SqlScan st = new SqlScan(expr);

        while (st.hasNext()) {
            if (st.peekIsOpaque()) { out.append(st.readOpaque()); continue; }

            char ch = st.peek();
            if (!SqlScan.isWordChar(ch)) {
                out.append(st.read());
                continue;
            }

            String word = st.readWord();
            if (!SqlIdentifierUtil.isIdentStart(word.charAt(0))) {
                out.append(word);
                continue;
            }

            String qualifier = null;
            String column = word;
            int afterWord = st.pos();
            if (st.peek() == '.') {
                st.read();
                if (st.peek() == '*') {
                    st.read();
                    out.append(isKnownTable(word) ? key(word) : word).append(".*");
                    continue;
                }
                if (!SqlIdentifierUtil.isIdentStart(st.peek())) {
                    st.seek(afterWord);
                    out.append(word);
                    continue;
                }
                qualifier = word;
                column = st.readWord();
            }

            if (isFunctionCall(st) || (qualifier == null && NOT_A_COLUMN.contains(key(word)))) {
                out.append(qualifier == null ? column : qualifier + "." + column);
                continue;
            }

            String bound = resolve(qualifier, column, scopeTableKeys);
            if (bound != null) {
                out.append(bound);
                continue;
            }

            if (candidates(key(column), scopeTableKeys).size() > 1
                    && (qualifier == null || !isKnownTable(qualifier))) {
                warnSink.warn(EvaluationWarning.of(
                        WarningCode.AMBIGUOUS_COLUMN,
                        ctx,
                        "column matches more than one table in '" + dbId + "'",
                        qualifier == null ? column : qualifier + "." + column
                ));
            }
            out.append(qualifier == null ? column : qualifier + "." + column);
        }

        return out.toString();
    }

    private static boolean isFunctionCall(SqlScan st) {
        String s = st.text();
        int p = st.pos();
        while (p < s.length() && s.charAt(p) == ' ') p++;
        return p < s.length() && s.charAt(p) == '(';
    }
}
