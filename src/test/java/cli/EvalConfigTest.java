package cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EvalConfigTest {

    @TempDir
    Path tempDir;

    @AfterEach
    void clearProperties() {
        System.clearProperty(CliPathResolver.PROP_BASE_DIR);
        System.clearProperty(EvalConfig.PROP_PREFIX + "threads");
        System.clearProperty(EvalConfig.PROP_PREFIX + "execute");
    }

    @Test
    void resolve_shouldApplyDefaults() {
        Map<String, String> argv = new HashMap<>();
        argv.put("baseDir", tempDir.toString());

        EvalConfig cfg = EvalConfig.resolve(argv);

        assertEquals(tempDir.toAbsolutePath().normalize(), cfg.getBaseDir());
        assertNull(cfg.getDataset());
        assertNull(cfg.getTables());
        assertEquals(tempDir.resolve("sqlite_dbs").toAbsolutePath().normalize(), cfg.getDbDir());
        assertEquals(tempDir.resolve("output/eval-summary.json").toAbsolutePath().normalize(), cfg.getSummaryOut());
        assertFalse(cfg.isExecute());
        assertTrue(cfg.isWriteReport());
        assertEquals(30, cfg.getTimeoutSeconds());
        assertEquals(5000L, cfg.getSlowMillis());
        assertEquals(1, cfg.getThreads());
        assertEquals(-1, cfg.getMax());
        assertEquals(100, cfg.getLogEvery());
    }

    @Test
    void resolve_shouldPreferCommandLineOverSystemProperty() {
        System.setProperty(EvalConfig.PROP_PREFIX + "threads", "8");
        System.setProperty(EvalConfig.PROP_PREFIX + "execute", "true");
        Map<String, String> argv = new HashMap<>();
        argv.put("baseDir", tempDir.toString());
        argv.put("dataset", "data/dev.json");

        EvalConfig fromProps = EvalConfig.resolve(argv);
        assertEquals(8, fromProps.getThreads());
        assertTrue(fromProps.isExecute());
        assertEquals(tempDir.resolve("data/dev.json").toAbsolutePath().normalize(), fromProps.getDataset());

        argv.put("threads", "2");
        argv.put("execute", "false");
        argv.put("noReport", "");
        EvalConfig fromArgs = EvalConfig.resolve(argv);
        assertEquals(2, fromArgs.getThreads());
        assertFalse(fromArgs.isExecute());
        assertFalse(fromArgs.isWriteReport());
    }

    @Test
    void resolve_shouldClampNonPositiveThreadsAndTimeout() {
        Map<String, String> argv = new HashMap<>();
        argv.put("baseDir", tempDir.toString());
        argv.put("threads", "0");
        argv.put("timeoutSec", "-3");

        EvalConfig cfg = EvalConfig.resolve(argv);

        assertEquals(1, cfg.getThreads());
        assertEquals(1, cfg.getTimeoutSeconds());
    }
}
