package domain.eval;

import domain.clause.SqlClause;
import domain.clause.SqlKeywordVocabulary;
import domain.difficulty.DifficultyClassifier;
import domain.difficulty.DifficultyLabel;
import domain.exec.ExecutionComparator;
import domain.exec.ExecutionResult;
import domain.exec.QueryExecutor;
import domain.exec.ResultComparison;
import domain.model.EvaluationWarning;
import domain.model.EvaluationWarningSink;
import domain.model.ListEvaluationWarningSink;
import domain.model.QueryContext;
import domain.model.QuerySide;
import domain.model.WarningCode;
import domain.score.ClauseScore;
import domain.score.ComponentScorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a single pair. Thread-safe as long as the executor is.
 */
public final class PairEvaluator {

    private static final Logger log = LoggerFactory.getLogger(PairEvaluator.class);

    private final QueryAnalyzer analyzer;
    private final QueryExecutor executor;
    private final long slowQueryMillis;

    /**
     * @param executor        null to skip execution comparison
     * @param slowQueryMillis successful executions slower than this are reported; 0 or less disables it
     */
    public PairEvaluator(QueryAnalyzer analyzer, QueryExecutor executor, long slowQueryMillis) {
        this.analyzer = analyzer;
        this.executor = executor;
        this.slowQueryMillis = slowQueryMillis;
    }

    public PairResult evaluate(EvaluationPair pair) {
        List<EvaluationWarning> warnings = new ArrayList<>();
        EvaluationWarningSink sink = new ListEvaluationWarningSink(warnings);

        QueryContext predCtx = new QueryContext(pair.getIndex(), pair.getDbId(), QuerySide.PREDICTED);
        QueryContext goldCtx = new QueryContext(pair.getIndex(), pair.getDbId(), QuerySide.GOLD);

        AnalyzedQuery predicted = analyzer.analyze(pair.getPredictedSql(), predCtx, sink);
        AnalyzedQuery gold = analyzer.analyze(pair.getGoldSql(), goldCtx, sink);

        boolean exactMatch = predicted.getNormalized().equals(gold.getNormalized());
        Map<SqlClause, ClauseScore> scores = ComponentScorer.scorePair(predicted.getComponents(), gold.getComponents());
        DifficultyLabel difficulty = DifficultyClassifier.classify(pair.getGoldSql());

        List<String> missing = List.of();
        List<String> extra = List.of();
        if (!exactMatch) {
            Set<String> predKw = predicted.getComponents().get(SqlClause.KEYWORDS);
            Set<String> goldKw = gold.getComponents().get(SqlClause.KEYWORDS);
            missing = SqlKeywordVocabulary.missing(goldKw, predKw);
            extra = SqlKeywordVocabulary.missing(predKw, goldKw);
        }

        ExecutionResult predExec = null;
        ExecutionResult goldExec = null;
        ResultComparison comparison = null;
        if (executor != null) {
            predExec = run(pair.getPredictedSql(), predCtx, sink);
            goldExec = run(pair.getGoldSql(), goldCtx, sink);
            comparison = ExecutionComparator.compare(predExec, goldExec);
        }

        for (EvaluationWarning w : warnings) {
            log.debug("[WARN] {}", w);
        }

        return new PairResult(pair, predicted, gold, exactMatch, scores, ComponentScorer.averageF1(scores),
                difficulty, missing, extra, predExec, goldExec, comparison, warnings);
    }

    private ExecutionResult run(String sql, QueryContext ctx, EvaluationWarningSink sink) {
        ExecutionResult r = executor.execute(sql, ctx.getDbId());
        if (!r.isSuccess()) {
            WarningCode code = ctx.getSide() == QuerySide.GOLD
                    ? WarningCode.GOLD_EXECUTION_FAILED
                    : WarningCode.EXECUTION_FAILED;
            sink.warn(EvaluationWarning.of(code, ctx, r.getErrorType().name(), r.getError()));
        } else if (slowQueryMillis > 0 && r.getElapsedMillis() > slowQueryMillis) {
            sink.warn(EvaluationWarning.of(WarningCode.SLOW_QUERY, ctx,
                    "execution took " + r.getElapsedMillis() + "ms", null));
        }
        return r;
    }
}
