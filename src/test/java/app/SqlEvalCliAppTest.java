package app;

import cli.CliPathResolver;
import cli.EvalConfig;
import domain.eval.EvaluationSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SqlEvalCliAppTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty(CliPathResolver.PROP_BASE_DIR);
    }

    private void writeInputs() throws Exception {
        Files.writeString(tempDir.resolve("dev.json"), "[\n"
                + "  {\"question\": \"How many items?\", \"query\": \"SELECT COUNT(*) FROM t\", \"db_id\": \"shop\"},\n"
                + "  {\"question\": \"Name of item 1?\", \"query\": \"SELECT name FROM t WHERE id = 1\", \"db_id\": \"shop\"}\n"
                + "]");
        Files.writeString(tempDir.resolve("pred.txt"), "SELECT COUNT(id) FROM t\nselect NAME from T where ID = 1;\n");
        Files.writeString(tempDir.resolve("tables.json"), "[{\"db_id\": \"shop\", \"table_names\": [\"t\"], "
                + "\"column_names\": [[-1, \"*\"], [0, \"id\"], [0, \"name\"]], \"column_types\": [\"text\", \"number\", \"text\"], "
                + "\"foreign_keys\": [], \"primary_keys\": [1]}]");

        Path dbDir = Files.createDirectories(tempDir.resolve("dbs"));
        try (Connection c = DriverManager.getConnection("jdbc:sqlite:" + dbDir.resolve("shop.sqlite").toAbsolutePath());
             Statement st = c.createStatement()) {
            st.executeUpdate("CREATE TABLE t (id INTEGER PRIMARY KEY, name TEXT)");
            st.executeUpdate("INSERT INTO t VALUES (1, 'pen'), (2, 'ink'), (3, 'cup')");
        }
    }

    private Map<String, String> argv() {
        Map<String, String> argv = new HashMap<>();
        argv.put("baseDir", tempDir.toString());
        argv.put("dataset", "dev.json");
        argv.put("pred", "pred.txt");
        argv.put("tables", "tables.json");
        argv.put("dbDir", "dbs");
        argv.put("out", "out/summary.json");
        argv.put("report", "out/report.xlsx");
        return argv;
    }

    @Test
    void run_shouldEvaluateExecuteAndWriteOutputs() throws Exception {
        writeInputs();
        Map<String, String> argv = argv();
        argv.put("execute", "");
        argv.put("threads", "2");

        EvaluationSummary summary = SqlEvalCliApp.run(EvalConfig.resolve(argv));

        assertEquals(2, summary.getTotal());
        assertEquals(1, summary.getExactMatches());
        assertNotNull(summary.getExecution());
        assertEquals(1.0, summary.getExecution().getExecutionAccuracy(), 1e-9);
        assertEquals(0, summary.getDegradedPairs());
        assertTrue(Files.exists(tempDir.resolve("out/summary.json")));
        assertTrue(Files.exists(tempDir.resolve("out/report.xlsx")));
    }

    @Test
    void run_shouldSkipExecutionAndReport_whenNotRequested() throws Exception {
        writeInputs();
        Map<String, String> argv = argv();
        argv.put("noReport", "");

        EvaluationSummary summary = SqlEvalCliApp.run(EvalConfig.resolve(argv));

        assertNull(summary.getExecution());
        assertTrue(Files.exists(tempDir.resolve("out/summary.json")));
        assertFalse(Files.exists(tempDir.resolve("out/report.xlsx")));
    }

    @Test
    void run_shouldFail_whenDatasetMissing() {
        Map<String, String> argv = argv();
        argv.put("dataset", "nope.json");

        assertThrows(IllegalArgumentException.class, () -> SqlEvalCliApp.run(EvalConfig.resolve(argv)));
    }
}
