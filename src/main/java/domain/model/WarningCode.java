package domain.model;

/**
 * Standard warning codes for per-query evaluation problems.
 *
 * <p>Warnings never abort a batch. They are counted in the summary so a reader can tell
 * a genuinely wrong prediction from one that could not be analyzed.</p>
 */
public enum WarningCode {

    /**
     * An {@code alias.column} prefix has no alias entry and is not a known table.
     */
    ALIAS_UNRESOLVED,

    /**
     * An unqualified column matches more than one table and was left unbound.
     */
    AMBIGUOUS_COLUMN,

    /**
     * The clause heuristics could not find an expected clause (e.g. no SELECT keyword).
     */
    PARSE_DEGRADED,

    /**
     * The pair's db_id is not in the schema catalog; binding was skipped.
     */
    UNKNOWN_DB_ID,

    /**
     * The predicted query failed to execute.
     */
    EXECUTION_FAILED,

    /**
     * The gold query failed to execute (the pair is excluded from execution accuracy).
     */
    GOLD_EXECUTION_FAILED,

    /**
     * Execution took longer than the configured slow threshold but finished.
     */
    SLOW_QUERY
}
