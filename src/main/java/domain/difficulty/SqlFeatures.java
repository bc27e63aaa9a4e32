package domain.difficulty;

import domain.sql.SqlTopLevelSplitter;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Boolean structural features of a query. Detection runs on the lower-cased query with string
 * literals masked, using word boundaries, so {@code 'Union Street'} is not a set operation.
 */
public final class SqlFeatures {

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    private static final Pattern JOIN = Pattern.compile("\\bjoin\\b", FLAGS);
    private static final Pattern SET_OP = Pattern.compile("\\b(union|intersect|except)\\b", FLAGS);
    private static final Pattern WINDOW = Pattern.compile("\\bover\\s*\\(", FLAGS);
    private static final Pattern CTE = Pattern.compile("\\bwith\\b", FLAGS);
    private static final Pattern AGGREGATE = Pattern.compile("\\b(count|sum|avg|max|min)\\s*\\(", FLAGS);
    private static final Pattern GROUP_BY = Pattern.compile("\\bgroup\\s+by\\b", FLAGS);
    private static final Pattern ORDER_BY = Pattern.compile("\\border\\s+by\\b", FLAGS);
    private static final Pattern HAVING = Pattern.compile("\\bhaving\\b", FLAGS);
    private static final Pattern WHERE = Pattern.compile("\\bwhere\\b", FLAGS);

    private static final List<Pattern> WHERE_OPERATORS = List.of(
            Pattern.compile("\\band\\b", FLAGS),
            Pattern.compile("\\bor\\b", FLAGS),
            Pattern.compile("\\bin\\b", FLAGS),
            Pattern.compile("\\bnot\\s+in\\b", FLAGS),
            Pattern.compile("\\bexists\\b", FLAGS),
            Pattern.compile("\\bnot\\s+exists\\b", FLAGS),
            Pattern.compile("\\blike\\b", FLAGS),
            Pattern.compile("\\bbetween\\b", FLAGS)
    );

    private final boolean join;
    private final boolean subquery;
    private final boolean setOperation;
    private final boolean window;
    private final boolean cte;
    private final boolean aggregation;
    private final boolean groupBy;
    private final boolean having;
    private final boolean orderBy;
    private final boolean complexWhere;

    private SqlFeatures(boolean join, boolean subquery, boolean setOperation, boolean window, boolean cte,
                        boolean aggregation, boolean groupBy, boolean having, boolean orderBy,
                        boolean complexWhere) {
        this.join = join;
        this.subquery = subquery;
        this.setOperation = setOperation;
        this.window = window;
        this.cte = cte;
        this.aggregation = aggregation;
        this.groupBy = groupBy;
        this.having = having;
        this.orderBy = orderBy;
        this.complexWhere = complexWhere;
    }

    public static SqlFeatures detect(String sql) {
        String t = SqlTopLevelSplitter.maskLiterals(sql == null ? "" : sql).toLowerCase(Locale.ROOT);

        boolean where = WHERE.matcher(t).find();
        int operators = 0;
        for (Pattern p : WHERE_OPERATORS) {
            if (p.matcher(t).find()) operators++;
        }

        return new SqlFeatures(
                JOIN.matcher(t).find(),
                SqlTopLevelSplitter.hasNestedSelect(t),
                SET_OP.matcher(t).find(),
                WINDOW.matcher(t).find(),
                CTE.matcher(t).find(),
                AGGREGATE.matcher(t).find(),
                GROUP_BY.matcher(t).find(),
                HAVING.matcher(t).find(),
                ORDER_BY.matcher(t).find(),
                where && operators >= 2
        );
    }

    public boolean hasJoin() {
        return join;
    }

    public boolean hasSubquery() {
        return subquery;
    }

    public boolean hasSetOperation() {
        return setOperation;
    }

    public boolean hasWindow() {
        return window;
    }

    public boolean hasCte() {
        return cte;
    }

    public boolean hasAggregation() {
        return aggregation;
    }

    public boolean hasGroupBy() {
        return groupBy;
    }

    public boolean hasHaving() {
        return having;
    }

    public boolean hasOrderBy() {
        return orderBy;
    }

    /** WHERE present with at least two distinct operator keywords. */
    public boolean hasComplexWhere() {
        return complexWhere;
    }
}
