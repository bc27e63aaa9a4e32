package domain.clause;

import domain.model.EvaluationWarningSink;
import domain.model.QueryContext;
import domain.normalize.SqlTextNormalizer;
import domain.schema.SchemaBinder;
import domain.sql.SqlIdentifierUtil;
import domain.sql.SqlScan;
import domain.sql.SqlTopLevelSplitter;

import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decomposes clause texts into sets of normalized atomic components.
 *
 * <ul>
 *   <li>SELECT: top-level items, {@code AS alias} removed, aggregate calls unwrapped to their
 *   argument so a wrong aggregate over the right column still earns credit.</li>
 *   <li>FROM: one table reference per JOIN / comma fragment (first token; a derived table
 *   is kept whole).</li>
 *   <li>WHERE: top-level AND / OR fragments, kept whole.</li>
 *   <li>HAVING: fragments with an aggregate kept whole, otherwise the left-hand column.</li>
 *   <li>GROUP BY / ORDER BY: top-level items, ORDER BY without ASC / DESC.</li>
 *   <li>KEYWORDS: vocabulary keywords seen in the whole query.</li>
 * </ul>
 *
 * <p>Column references go through the {@link SchemaBinder} when one is given, then every token
 * is passed through {@link SqlTextNormalizer#normalize(String)}. A trailing
 * {@code LIMIT n [OFFSET m]} and anything after a top-level set operator are not decomposed.</p>
 */
public final class ComponentExtractor {

    private static final Pattern AGGREGATE_CALL = Pattern.compile(
            "^(count_distinct|count|min|max|sum|avg)\\(", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern CONTAINS_AGGREGATE = Pattern.compile(
            "\\b(count_distinct|count|min|max|sum|avg)\\s*\\(", Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern LIMIT_TAIL = Pattern.compile(
            "limit\\s+[^\\s,]+(?:\\s*,\\s*[^\\s,]+)?(?:\\s+offset\\s+\\S+)?\\s*",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern HAVING_LHS = Pattern.compile(
            "^\\s*(?:not\\s+)?([^\\s()=<>!]+)\\s*(?:=|!=|<>|<=|>=|<|>|\\bnot\\s+like\\b|\\blike\\b"
                    + "|\\bnot\\s+in\\b|\\bin\\b|\\bnot\\s+between\\b|\\bbetween\\b|\\bis\\b)",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern ORDER_DIRECTION = Pattern.compile(
            "\\s+(asc|desc)\\s*$", Pattern.CASE_INSENSITIVE);

    private static final Pattern LEADING_DISTINCT = Pattern.compile(
            "^\\s*distinct\\b\\s*", Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    private ComponentExtractor() {
    }

    /** Schema-less extraction: column references are only normalized. */
    public static ComponentSet extract(ExtractedClauses clauses, String query) {
        return extract(clauses, query, null, Set.of(), QueryContext.standalone(), EvaluationWarningSink.none());
    }

    /**
     * @param clauses        clause texts of the alias-resolved query
     * @param query          full query text, source of the KEYWORDS component
     * @param binder         schema binder of the query's db_id, or null
     * @param scopeTableKeys tables referenced by the query, in identifier-key form
     */
    public static ComponentSet extract(ExtractedClauses clauses,
                                       String query,
                                       SchemaBinder binder,
                                       Set<String> scopeTableKeys,
                                       QueryContext ctx,
                                       EvaluationWarningSink sink) {
        Binding b = new Binding(binder, scopeTableKeys, ctx, sink);
        Map<SqlClause, Set<String>> out = new EnumMap<>(SqlClause.class);

        for (Map.Entry<SqlClause, String> e : clauses.asMap().entrySet()) {
            String body = stripTail(e.getValue());
            Set<String> tokens;
            switch (e.getKey()) {
                case SELECT:
                    tokens = selectComponents(body, b);
                    break;
                case FROM:
                    tokens = fromComponents(body);
                    break;
                case WHERE:
                    tokens = whereComponents(body, b);
                    break;
                case HAVING:
                    tokens = havingComponents(body, b);
                    break;
                case GROUP_BY:
                    tokens = listComponents(body, b, false);
                    break;
                case ORDER_BY:
                    tokens = listComponents(body, b, true);
                    break;
                default:
                    continue;
            }
            out.put(e.getKey(), tokens);
        }

        Set<String> keywords = SqlKeywordVocabulary.keywordsIn(query);
        if (!keywords.isEmpty()) out.put(SqlClause.KEYWORDS, keywords);

        return new ComponentSet(out);
    }

    private static Set<String> selectComponents(String body, Binding b) {
        Set<String> out = new LinkedHashSet<>();
        String items = LEADING_DISTINCT.matcher(body).replaceFirst("");

        for (String raw : SqlTopLevelSplitter.splitTopLevelByComma(items)) {
            String item = stripAlias(raw.trim());
            item = unwrapAggregate(item);
            add(out, b.bind(item));
        }
        return out;
    }

    private static Set<String> fromComponents(String body) {
        Set<String> out = new LinkedHashSet<>();
        for (String joinFrag : SqlTopLevelSplitter.splitTopLevelByJoin(body)) {
            for (String frag : SqlTopLevelSplitter.splitTopLevelByComma(joinFrag)) {
                String ref = firstTableReference(frag.trim());
                if (ref.startsWith("(")) add(out, ref);
                else add(out, SqlTextNormalizer.identifierKey(SqlIdentifierUtil.unquote(ref)));
            }
        }
        return out;
    }

    private static Set<String> whereComponents(String body, Binding b) {
        Set<String> out = new LinkedHashSet<>();
        for (String frag : SqlTopLevelSplitter.splitTopLevelByLogical(body)) {
            add(out, b.bind(frag.trim()));
        }
        return out;
    }

    private static Set<String> havingComponents(String body, Binding b) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : SqlTopLevelSplitter.splitTopLevelByLogical(body)) {
            String frag = raw.trim();
            if (frag.isEmpty()) continue;

            if (CONTAINS_AGGREGATE.matcher(frag).find()) {
                add(out, b.bind(frag));
                continue;
            }
            Matcher m = HAVING_LHS.matcher(frag);
            add(out, b.bind(m.find() ? m.group(1) : frag));
        }
        return out;
    }

    private static Set<String> listComponents(String body, Binding b, boolean stripDirection) {
        Set<String> out = new LinkedHashSet<>();
        for (String raw : SqlTopLevelSplitter.splitTopLevelByComma(body)) {
            String item = raw.trim();
            if (stripDirection) item = ORDER_DIRECTION.matcher(item).replaceFirst("");
            add(out, b.bind(item));
        }
        return out;
    }

    private static void add(Set<String> out, String token) {
        String n = SqlTextNormalizer.normalize(token);
        if (!n.isEmpty()) out.add(n);
    }

    /** Cuts a set-operator tail, then a trailing LIMIT / OFFSET. */
    static String stripTail(String body) {
        if (body == null) return "";
        String t = body;

        int setOp = SqlTopLevelSplitter.indexOfTopLevelWord(t, "UNION", "INTERSECT", "EXCEPT");
        if (setOp >= 0) t = t.substring(0, setOp);

        int limit = SqlTopLevelSplitter.lastIndexOfTopLevelWord(t, "LIMIT");
        if (limit >= 0 && LIMIT_TAIL.matcher(t.substring(limit)).matches()) t = t.substring(0, limit);

        return t.trim();
    }

    /** {@code expr AS name} becomes {@code expr}; {@code CAST(x AS int)} is untouched. */
    static String stripAlias(String item) {
        int as = SqlTopLevelSplitter.lastIndexOfTopLevelWord(item, "AS");
        if (as <= 0) return item;

        String name = item.substring(as + 2).trim();
        if (name.isEmpty() || name.indexOf(' ') >= 0 || name.indexOf('(') >= 0) return item;
        return item.substring(0, as).trim();
    }

    /** {@code count(distinct x)} becomes {@code x}; anything else is returned as is. */
    static String unwrapAggregate(String item) {
        String lower = item.toLowerCase(Locale.ROOT);
        Matcher m = AGGREGATE_CALL.matcher(lower);
        if (!m.find()) return item;

        int open = m.end() - 1;
        SqlScan st = new SqlScan(item);
        st.seek(open);
        String block = st.readParenBlock();
        if (open + block.length() != item.length() || !block.endsWith(")")) return item;

        String inner = block.substring(1, block.length() - 1).trim();
        return LEADING_DISTINCT.matcher(inner).replaceFirst("").trim();
    }

    private static String firstTableReference(String frag) {
        if (frag.isEmpty()) return "";
        SqlScan st = new SqlScan(frag);
        if (st.peek() == '(') return st.readParenBlock();
        if (st.peekIsDoubleQuotedString() || st.peekIsBacktickQuoted()) return st.readOpaque();

        int end = 0;
        while (end < frag.length()) {
            char c = frag.charAt(end);
            if (Character.isWhitespace(c) || c == '(' || c == ')') break;
            end++;
        }
        return frag.substring(0, end);
    }

    private static final class Binding {
        final SchemaBinder binder;
        final Set<String> scope;
        final QueryContext ctx;
        final EvaluationWarningSink sink;

        Binding(SchemaBinder binder, Set<String> scope, QueryContext ctx, EvaluationWarningSink sink) {
            this.binder = binder;
            this.scope = scope == null ? Set.of() : scope;
            this.ctx = ctx == null ? QueryContext.standalone() : ctx;
            this.sink = sink == null ? EvaluationWarningSink.none() : sink;
        }

        String bind(String fragment) {
            if (binder == null || fragment.isEmpty()) return fragment;
            return binder.bindExpression(fragment, scope, ctx, sink);
        }
    }
}
