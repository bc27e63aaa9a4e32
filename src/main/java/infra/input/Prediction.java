package infra.input;

/** One predicted query; {@code dbId} is empty when the file does not carry it. */
public final class Prediction {

    private final String sql;
    private final String dbId;

    public Prediction(String sql, String dbId) {
        this.sql = sql == null ? "" : sql;
        this.dbId = dbId == null ? "" : dbId.trim();
    }

    public String getSql() {
        return sql;
    }

    public String getDbId() {
        return dbId;
    }
}
