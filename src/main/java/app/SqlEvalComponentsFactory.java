package app;

import cli.EvalConfig;
import domain.eval.BatchEvaluator;
import domain.eval.BatchProgressListener;
import domain.eval.PairEvaluator;
import domain.eval.QueryAnalyzer;
import domain.exec.QueryExecutor;
import domain.report.ReportWriter;
import domain.schema.SchemaCatalog;
import infra.exec.SqliteQueryExecutor;
import infra.input.GoldDatasetJsonLoader;
import infra.input.GoldExample;
import infra.input.Prediction;
import infra.input.PredictionFileLoader;
import infra.output.JsonSummaryWriter;
import infra.output.NullReportWriter;
import infra.output.XlsxEvaluationReportWriter;
import infra.schema.SchemaCatalogJsonLoader;

import java.nio.file.Path;
import java.util.List;

/**
 * Object-assembly factory for {@link SqlEvalCliApp}.
 * <p>
 * Keeps the CLI app focused on orchestration and logging; object creation lives here.
 */
final class SqlEvalComponentsFactory {

    SchemaCatalog loadCatalog(Path tables) {
        if (tables == null) return SchemaCatalog.empty();
        return new SchemaCatalogJsonLoader().load(tables);
    }

    List<GoldExample> loadGold(Path dataset) {
        return new GoldDatasetJsonLoader().load(dataset);
    }

    List<Prediction> loadPredictions(Path predictions) {
        return new PredictionFileLoader().load(predictions);
    }

    QueryExecutor createExecutor(EvalConfig cfg) {
        if (!cfg.isExecute()) return null;
        return new SqliteQueryExecutor(cfg.getDbDir(), cfg.getTimeoutSeconds());
    }

    BatchEvaluator createBatchEvaluator(EvalConfig cfg, SchemaCatalog catalog, QueryExecutor executor,
                                        BatchProgressListener listener) {
        PairEvaluator pairEvaluator = new PairEvaluator(new QueryAnalyzer(catalog), executor, cfg.getSlowMillis());
        return new BatchEvaluator(pairEvaluator, cfg.getThreads(), listener);
    }

    ReportWriter createSummaryWriter() {
        return new JsonSummaryWriter();
    }

    ReportWriter createReportWriter(boolean enable) {
        if (!enable) return new NullReportWriter();
        return new XlsxEvaluationReportWriter();
    }
}
