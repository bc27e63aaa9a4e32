package infra.exec;

import domain.exec.ExecutionComparator;
import domain.exec.ExecutionErrorType;
import domain.exec.ExecutionResult;
import domain.exec.ResultRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqliteQueryExecutorTest {

    @TempDir
    Path tempDir;

    private SqliteQueryExecutor executor;

    @BeforeEach
    void setUp() throws Exception {
        Path db = tempDir.resolve("shop.sqlite");
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
             Statement st = c.createStatement()) {
            st.executeUpdate("CREATE TABLE t (id INTEGER PRIMARY KEY, name TEXT, price REAL)");
            st.executeUpdate("INSERT INTO t VALUES (1, 'a', 1.5), (2, 'b', 2.0), (3, 'c', 2.5), "
                    + "(4, 'd', 3.0), (5, 'e', 3.5)");
        }
        executor = new SqliteQueryExecutor(tempDir, 5);
    }

    @Test
    void execute_shouldReturnRows_andMatchEquivalentQuery() {
        ExecutionResult pred = executor.execute("SELECT COUNT(*) FROM t", "shop");
        ExecutionResult gold = executor.execute("SELECT COUNT(id) FROM t", "shop");

        assertTrue(pred.isSuccess(), pred.getError());
        assertEquals(List.of(ResultRow.of(5L)), pred.getRows());
        assertTrue(ExecutionComparator.compare(pred, gold).isExactMatch());
    }

    @Test
    void execute_shouldCompareRowsAsSets() {
        ExecutionResult asc = executor.execute("SELECT name FROM t WHERE id <= 3 ORDER BY id", "shop");
        ExecutionResult desc = executor.execute("SELECT name FROM t WHERE id IN (1, 2, 3) ORDER BY id DESC", "shop");

        assertTrue(ExecutionComparator.compare(asc, desc).isExactMatch());
    }

    @Test
    void execute_shouldNormalizeIntegralReals() {
        ExecutionResult r = executor.execute("SELECT price FROM t WHERE id = 2", "shop");

        assertEquals(List.of(ResultRow.of(2L)), r.getRows());
    }

    @Test
    void execute_shouldClassifyMissingTable() {
        ExecutionResult r = executor.execute("SELECT * FROM nope", "shop");

        assertFalse(r.isSuccess());
        assertEquals(ExecutionErrorType.MISSING_OBJECT, r.getErrorType());
        assertTrue(r.getRows().isEmpty());
    }

    @Test
    void execute_shouldClassifySyntaxError() {
        ExecutionResult r = executor.execute("SELECT FROM WHERE", "shop");

        assertEquals(ExecutionErrorType.SYNTAX_ERROR, r.getErrorType());
    }

    @Test
    void execute_shouldRefuseWriteStatementsWithoutTouchingData() {
        ExecutionResult r = executor.execute("DELETE FROM t", "shop");

        assertEquals(ExecutionErrorType.READ_ONLY_VIOLATION, r.getErrorType());
        assertEquals(List.of(ResultRow.of(5L)), executor.execute("SELECT COUNT(*) FROM t", "shop").getRows());
    }

    @Test
    void execute_shouldReportUnknownDatabase() {
        ExecutionResult r = executor.execute("SELECT 1", "other");

        assertEquals(ExecutionErrorType.DATABASE_NOT_FOUND, r.getErrorType());
    }

    @Test
    void resolveDatabase_shouldFindNestedLayout() throws Exception {
        Path nested = Files.createDirectories(tempDir.resolve("zoo")).resolve("zoo.sqlite");
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + nested.toAbsolutePath());
             Statement st = c.createStatement()) {
            st.executeUpdate("CREATE TABLE animal (name TEXT)");
        }

        assertEquals(nested, executor.resolveDatabase("zoo"));
        assertEquals(tempDir.resolve("shop.sqlite"), executor.resolveDatabase(" shop "));
        assertNull(executor.resolveDatabase(""));
        assertTrue(executor.execute("SELECT name FROM animal", "zoo").isSuccess());
    }
}
