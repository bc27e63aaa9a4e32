package domain.exec;

/**
 * Runs a read-only query against the materialized database of a db_id.
 *
 * <p>Implementations must capture every failure in the returned {@link ExecutionResult},
 * open a fresh connection per call and bound each call by a timeout.</p>
 */
public interface QueryExecutor {

    ExecutionResult execute(String sql, String dbId);
}
