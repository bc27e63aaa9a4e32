package domain.exec;

/**
 * Failure category of a query execution, used for the error histogram.
 */
public enum ExecutionErrorType {
    /** The database rejected the statement text. */
    SYNTAX_ERROR,
    /** Unknown table or column. */
    MISSING_OBJECT,
    /** Ran longer than the configured timeout. */
    TIMEOUT,
    /** No materialized database for the db_id. */
    DATABASE_NOT_FOUND,
    /** Write or DDL statement refused before execution. */
    READ_ONLY_VIOLATION,
    CONNECTION_ERROR,
    EXECUTION_ERROR
}
