package domain.model;

/**
 * Per-query context used for warning attribution.
 *
 * <p>Immutable and small: a stable key of pair index + db_id + side.</p>
 */
public final class QueryContext {

    private final int pairIndex;
    private final String dbId;
    private final QuerySide side;

    public QueryContext(int pairIndex, String dbId, QuerySide side) {
        this.pairIndex = pairIndex;
        this.dbId = dbId == null ? "" : dbId;
        this.side = side;
    }

    public static QueryContext standalone() {
        return new QueryContext(-1, "", null);
    }

    public int getPairIndex() {
        return pairIndex;
    }

    public String getDbId() {
        return dbId;
    }

    public QuerySide getSide() {
        return side;
    }
}
