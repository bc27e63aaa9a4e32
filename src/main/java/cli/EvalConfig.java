package cli;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Resolved run configuration. Each key is taken from the command line ({@code --key=value}),
 * then the system property {@code sqleval.<key>}, then the default.
 */
public final class EvalConfig {

    public static final String PROP_PREFIX = "sqleval.";

    static final Set<String> OPTIONS = Set.of(
            "baseDir", "dataset", "pred", "tables", "dbDir", "out", "report",
            "execute", "noReport", "timeoutSec", "slowMs", "threads", "max", "logEvery");

    private final Path baseDir;
    private final Path dataset;
    private final Path predictions;
    private final Path tables;
    private final Path dbDir;
    private final Path summaryOut;
    private final Path reportOut;
    private final boolean execute;
    private final boolean writeReport;
    private final int timeoutSeconds;
    private final long slowMillis;
    private final int threads;
    private final int max;
    private final int logEvery;

    private EvalConfig(Path baseDir, Path dataset, Path predictions, Path tables, Path dbDir,
                       Path summaryOut, Path reportOut, boolean execute, boolean writeReport,
                       int timeoutSeconds, long slowMillis, int threads, int max, int logEvery) {
        this.baseDir = baseDir;
        this.dataset = dataset;
        this.predictions = predictions;
        this.tables = tables;
        this.dbDir = dbDir;
        this.summaryOut = summaryOut;
        this.reportOut = reportOut;
        this.execute = execute;
        this.writeReport = writeReport;
        this.timeoutSeconds = timeoutSeconds;
        this.slowMillis = slowMillis;
        this.threads = threads;
        this.max = max;
        this.logEvery = logEvery;
    }

    public static EvalConfig resolve(Map<String, String> argv) {
        CliArgParser.warnUnknown(argv, OPTIONS);
        CliPathResolver.applyBaseDirPropertyIfPresent(argv);
        Path baseDir = CliPathResolver.resolveBaseDir();

        boolean execute = argv.containsKey("execute")
                ? CliArgParser.flag(argv, "execute")
                : CliArgParser.parseBoolean(System.getProperty(PROP_PREFIX + "execute"), false);
        boolean noReport = argv.containsKey("noReport")
                ? CliArgParser.flag(argv, "noReport")
                : CliArgParser.parseBoolean(System.getProperty(PROP_PREFIX + "noReport"), false);

        return new EvalConfig(
                baseDir,
                CliPathResolver.resolvePath(baseDir, value(argv, "dataset", null)),
                CliPathResolver.resolvePath(baseDir, value(argv, "pred", null)),
                CliPathResolver.resolvePath(baseDir, value(argv, "tables", null)),
                CliPathResolver.resolvePath(baseDir, value(argv, "dbDir", "sqlite_dbs")),
                CliPathResolver.resolvePath(baseDir, value(argv, "out", "output/eval-summary.json")),
                CliPathResolver.resolvePath(baseDir, value(argv, "report", "output/eval-report.xlsx")),
                execute,
                !noReport,
                Math.max(1, CliArgParser.parseInt(value(argv, "timeoutSec", null), 30)),
                CliArgParser.parseLong(value(argv, "slowMs", null), 5000L),
                Math.max(1, CliArgParser.parseInt(value(argv, "threads", null), 1)),
                CliArgParser.parseInt(value(argv, "max", null), -1),
                Math.max(1, CliArgParser.parseInt(value(argv, "logEvery", null), 100))
        );
    }

    private static String value(Map<String, String> argv, String key, String def) {
        String v = (argv == null) ? null : CliPathResolver.trimToNull(argv.get(key));
        if (v != null) return v;
        v = CliPathResolver.trimToNull(System.getProperty(PROP_PREFIX + key));
        return v != null ? v : def;
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path getDataset() {
        return dataset;
    }

    public Path getPredictions() {
        return predictions;
    }

    /** null when no schema catalog was given; columns are then compared unbound */
    public Path getTables() {
        return tables;
    }

    public Path getDbDir() {
        return dbDir;
    }

    public Path getSummaryOut() {
        return summaryOut;
    }

    public Path getReportOut() {
        return reportOut;
    }

    public boolean isExecute() {
        return execute;
    }

    public boolean isWriteReport() {
        return writeReport;
    }

    public int getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public long getSlowMillis() {
        return slowMillis;
    }

    public int getThreads() {
        return threads;
    }

    public int getMax() {
        return max;
    }

    public int getLogEvery() {
        return logEvery;
    }
}
