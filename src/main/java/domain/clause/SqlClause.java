package domain.clause;

/**
 * Clause names scored by the component scorer. {@link #KEYWORDS} is not a syntactic clause:
 * it holds the SQL keywords seen anywhere in the query.
 */
public enum SqlClause {
    SELECT("SELECT"),
    FROM("FROM"),
    WHERE("WHERE"),
    GROUP_BY("GROUP BY"),
    ORDER_BY("ORDER BY"),
    HAVING("HAVING"),
    KEYWORDS("KEYWORDS");

    private final String label;

    SqlClause(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean isSyntactic() {
        return this != KEYWORDS;
    }

    public static SqlClause fromLabel(String label) {
        if (label == null) return null;
        String t = label.trim().replace('_', ' ');
        for (SqlClause c : values()) {
            if (c.label.equalsIgnoreCase(t)) return c;
        }
        return null;
    }
}
