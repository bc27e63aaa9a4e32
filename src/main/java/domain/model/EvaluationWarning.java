package domain.model;

/**
 * A single warning emitted while analyzing or executing one query of a pair.
 *
 * <p>Warnings are not fatal; they mark comparisons whose scores may be degraded.</p>
 */
public final class EvaluationWarning {

    private final WarningCode code;
    private final int pairIndex;
    private final String dbId;
    private final QuerySide side;
    private final String message;
    private final String detail;

    public EvaluationWarning(
            WarningCode code,
            int pairIndex,
            String dbId,
            QuerySide side,
            String message,
            String detail
    ) {
        this.code = code == null ? WarningCode.PARSE_DEGRADED : code;
        this.pairIndex = pairIndex;
        this.dbId = nullToEmpty(dbId);
        this.side = side;
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static EvaluationWarning of(WarningCode code, QueryContext ctx, String message, String detail) {
        if (ctx == null) return new EvaluationWarning(code, -1, "", null, message, detail);
        return new EvaluationWarning(code, ctx.getPairIndex(), ctx.getDbId(), ctx.getSide(), message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
    }

    public int getPairIndex() {
        return pairIndex;
    }

    public String getDbId() {
        return dbId;
    }

    /** May be null for pair-level warnings. */
    public QuerySide getSide() {
        return side;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return code + "[" + pairIndex + (side == null ? "" : "/" + side) + "] " + message
                + (detail.isEmpty() ? "" : " (" + detail + ")");
    }
}
