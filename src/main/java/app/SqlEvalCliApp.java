package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.ConsoleSummaryFormatter;
import cli.EvalConfig;
import cli.SqlEvalCli;
import domain.eval.BatchEvaluator;
import domain.eval.EvaluationPair;
import domain.eval.EvaluationSummary;
import domain.eval.PairResult;
import domain.exec.QueryExecutor;
import domain.report.ReportWriter;
import domain.schema.SchemaCatalog;
import infra.input.EvaluationPairAssembler;
import infra.input.GoldExample;
import infra.input.Prediction;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** CLI entry (invoked by {@link SqlEvalCli}). */
public final class SqlEvalCliApp {

    private static final Logger log = LoggerFactory.getLogger(SqlEvalCliApp.class);

    private SqlEvalCliApp() {}

    public static void main(String[] args) {
        Map<String, String> argv = CliArgParser.parseArgs(args);
        EvalConfig cfg = EvalConfig.resolve(argv);
        EvaluationSummary summary = run(cfg);
        System.out.println(ConsoleSummaryFormatter.format(summary));
    }

    public static EvaluationSummary run(EvalConfig cfg) {
        long t0 = System.nanoTime();

        log.info("==================================================");
        log.info("[START] SQL evaluation");
        log.info("[CONF] baseDir    = {}", cfg.getBaseDir());
        log.info("[CONF] dataset    = {}", cfg.getDataset());
        log.info("[CONF] pred       = {}", cfg.getPredictions());
        log.info("[CONF] tables     = {}", cfg.getTables() == null ? "(none, columns unbound)" : cfg.getTables());
        log.info("[CONF] execute    = {} (use --execute)", cfg.isExecute());
        log.info("[CONF] dbDir      = {}", cfg.getDbDir());
        log.info("[CONF] timeoutSec = {}", cfg.getTimeoutSeconds());
        log.info("[CONF] slowMs     = {}", cfg.getSlowMillis());
        log.info("[CONF] threads    = {}", cfg.getThreads());
        log.info("[CONF] max        = {}", cfg.getMax());
        log.info("[CONF] logEvery   = {}", cfg.getLogEvery());
        log.info("[CONF] out        = {}", cfg.getSummaryOut());
        log.info("[CONF] report     = {} (enabled={}, use --noReport)", cfg.getReportOut(), cfg.isWriteReport());
        log.info("==================================================");

        CliPathResolver.validateFileExists(cfg.getDataset(), "gold dataset (--dataset)");
        CliPathResolver.validateFileExists(cfg.getPredictions(), "predictions (--pred)");
        if (cfg.getTables() != null) CliPathResolver.validateFileExists(cfg.getTables(), "schema catalog (--tables)");
        if (cfg.isExecute()) CliPathResolver.validateDirExists(cfg.getDbDir(), "sqlite db dir (--dbDir)");

        SqlEvalComponentsFactory factory = new SqlEvalComponentsFactory();

        long tLoad0 = System.nanoTime();
        SchemaCatalog catalog = factory.loadCatalog(cfg.getTables());
        List<GoldExample> gold = factory.loadGold(cfg.getDataset());
        List<Prediction> predictions = factory.loadPredictions(cfg.getPredictions());
        List<EvaluationPair> pairs = EvaluationPairAssembler.assemble(gold, predictions, cfg.getMax());
        log.info("[LOAD] schemas={} gold={} predictions={} pairs={} elapsed={}ms",
                catalog.size(), gold.size(), predictions.size(), pairs.size(), ms(tLoad0));

        QueryExecutor executor = factory.createExecutor(cfg);
        CliProgressMonitor monitor = new CliProgressMonitor(cfg.getLogEvery());
        monitor.startHeartbeat(pairs.size());
        BatchEvaluator batch = factory.createBatchEvaluator(cfg, catalog, executor, monitor);

        long tLoop0 = System.nanoTime();
        log.info("[EXEC] evaluating start. total={}", pairs.size());
        List<PairResult> results = batch.evaluate(pairs);
        EvaluationSummary summary = EvaluationSummary.of(results);
        log.info("[EXEC] evaluating done. elapsed={}ms", ms(tLoop0));
        log.info("[STAT] exact={} degraded={} failedExecutions={}",
                summary.getExactMatches(), summary.getDegradedPairs(), summary.getFailedExecutionPairs());

        ReportWriter summaryWriter = factory.createSummaryWriter();
        summaryWriter.write(cfg.getSummaryOut(), summary, results);
        log.info("[DONE] summary json written: {}", cfg.getSummaryOut());

        ReportWriter reportWriter = factory.createReportWriter(cfg.isWriteReport());
        long tXlsx0 = System.nanoTime();
        reportWriter.write(cfg.getReportOut(), summary, results);
        if (cfg.isWriteReport()) {
            log.info("[DONE] report xlsx written: {} elapsed={}ms", cfg.getReportOut(), ms(tXlsx0));
        } else {
            log.info("[DONE] report xlsx skipped (--noReport). rows={}", results.size());
        }

        log.info("[DONE] totalElapsed={}ms", ms(t0));
        return summary;
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }
}
