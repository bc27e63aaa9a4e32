package infra.exec;

import domain.exec.ExecutionErrorType;
import domain.exec.ExecutionResult;
import domain.exec.QueryExecutor;
import domain.exec.ReadOnlyGuard;
import domain.exec.ResultRow;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteErrorCode;
import org.sqlite.SQLiteException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs queries against materialized SQLite databases under one directory.
 *
 * <p>Database lookup for a db_id, first existing wins:
 * {@code <dir>/<db_id>.db}, {@code <dir>/<db_id>.sqlite}, {@code <dir>/<db_id>/<db_id>.sqlite}.
 * Each call opens its own read-only connection and closes it before returning. Write and DDL
 * statements are refused without connecting.</p>
 */
public final class SqliteQueryExecutor implements QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(SqliteQueryExecutor.class);

    private final Path dbDir;
    private final int timeoutSeconds;

    public SqliteQueryExecutor(Path dbDir, int timeoutSeconds) {
        if (dbDir == null) throw new IllegalArgumentException("dbDir is null");
        this.dbDir = dbDir;
        this.timeoutSeconds = Math.max(1, timeoutSeconds);
    }

    /** @return database file for the db_id, or null when none exists */
    public Path resolveDatabase(String dbId) {
        if (dbId == null || dbId.isBlank()) return null;
        String id = dbId.trim();
        Path[] candidates = {
                dbDir.resolve(id + ".db"),
                dbDir.resolve(id + ".sqlite"),
                dbDir.resolve(id).resolve(id + ".sqlite")
        };
        for (Path p : candidates) {
            if (Files.isRegularFile(p)) return p;
        }
        return null;
    }

    @Override
    public ExecutionResult execute(String sql, String dbId) {
        if (sql == null || sql.isBlank()) {
            return ExecutionResult.failure(ExecutionErrorType.SYNTAX_ERROR, "empty query", 0L);
        }
        String write = ReadOnlyGuard.findWriteKeyword(sql);
        if (write != null) {
            return ExecutionResult.failure(ExecutionErrorType.READ_ONLY_VIOLATION,
                    "write keyword not allowed: " + write, 0L);
        }
        Path db = resolveDatabase(dbId);
        if (db == null) {
            return ExecutionResult.failure(ExecutionErrorType.DATABASE_NOT_FOUND,
                    "database " + dbId + " not found under " + dbDir, 0L);
        }

        Connection conn;
        try {
            conn = open(db);
        } catch (SQLException e) {
            log.debug("[EXEC] connection failed db={} : {}", db, e.getMessage());
            return ExecutionResult.failure(ExecutionErrorType.CONNECTION_ERROR, e.getMessage(), 0L);
        }

        long start = System.nanoTime();
        try (Connection c = conn; Statement st = c.createStatement()) {
            st.setQueryTimeout(timeoutSeconds);
            List<ResultRow> rows = new ArrayList<>();
            try (ResultSet rs = st.executeQuery(sql)) {
                ResultSetMetaData md = rs.getMetaData();
                int n = md.getColumnCount();
                while (rs.next()) {
                    List<Object> values = new ArrayList<>(n);
                    for (int i = 1; i <= n; i++) values.add(rs.getObject(i));
                    rows.add(new ResultRow(values));
                }
            }
            long elapsed = elapsedMillis(start);
            if (elapsed > timeoutSeconds * 1000L) {
                return ExecutionResult.failure(ExecutionErrorType.TIMEOUT,
                        "query timeout after " + elapsed + "ms", elapsed);
            }
            return ExecutionResult.success(rows, elapsed);
        } catch (SQLException e) {
            long elapsed = elapsedMillis(start);
            ExecutionErrorType type = classify(e, elapsed);
            log.debug("[EXEC] {} db={} : {}", type, dbId, e.getMessage());
            return ExecutionResult.failure(type, e.getMessage(), elapsed);
        }
    }

    private static Connection open(Path db) throws SQLException {
        SQLiteConfig cfg = new SQLiteConfig();
        cfg.setReadOnly(true);
        return DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath(), cfg.toProperties());
    }

    private ExecutionErrorType classify(SQLException e, long elapsed) {
        if (e instanceof SQLiteException) {
            SQLiteErrorCode code = ((SQLiteException) e).getResultCode();
            if (code == SQLiteErrorCode.SQLITE_INTERRUPT) return ExecutionErrorType.TIMEOUT;
            if (code == SQLiteErrorCode.SQLITE_READONLY) return ExecutionErrorType.READ_ONLY_VIOLATION;
        }
        String msg = e.getMessage() == null ? "" : e.getMessage().toLowerCase(Locale.ROOT);
        if (msg.contains("no such table") || msg.contains("no such column") || msg.contains("no such function")) {
            return ExecutionErrorType.MISSING_OBJECT;
        }
        if (msg.contains("syntax error") || msg.contains("incomplete input") || msg.contains("unrecognized token")) {
            return ExecutionErrorType.SYNTAX_ERROR;
        }
        if (msg.contains("interrupt") || msg.contains("timeout") || elapsed > timeoutSeconds * 1000L) {
            return ExecutionErrorType.TIMEOUT;
        }
        return ExecutionErrorType.EXECUTION_ERROR;
    }

    private static long elapsedMillis(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }
}
