package domain.exec;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of running one query against one database. Failures are values, never thrown.
 */
public final class ExecutionResult {

    private final boolean success;
    private final List<ResultRow> rows;
    private final ExecutionErrorType errorType;
    private final String error;
    private final long elapsedMillis;

    private ExecutionResult(boolean success, List<ResultRow> rows, ExecutionErrorType errorType,
                            String error, long elapsedMillis) {
        this.success = success;
        this.rows = rows;
        this.errorType = errorType;
        this.error = error;
        this.elapsedMillis = elapsedMillis;
    }

    public static ExecutionResult success(List<ResultRow> rows, long elapsedMillis) {
        List<ResultRow> r = rows == null ? List.of() : Collections.unmodifiableList(rows);
        return new ExecutionResult(true, r, null, null, elapsedMillis);
    }

    public static ExecutionResult failure(ExecutionErrorType type, String error, long elapsedMillis) {
        return new ExecutionResult(false, List.of(),
                type == null ? ExecutionErrorType.EXECUTION_ERROR : type,
                error == null ? "" : error, elapsedMillis);
    }

    public boolean isSuccess() {
        return success;
    }

    /** Rows in the order the database returned them; empty on failure. */
    public List<ResultRow> getRows() {
        return rows;
    }

    /** null on success */
    public ExecutionErrorType getErrorType() {
        return errorType;
    }

    /** null on success */
    public String getError() {
        return error;
    }

    public long getElapsedMillis() {
        return elapsedMillis;
    }

    @Override
    public String toString() {
        return success
                ? "ExecutionResult{rows=" + rows.size() + ", " + elapsedMillis + "ms}"
                : "ExecutionResult{" + errorType + ": " + error + "}";
    }
}
