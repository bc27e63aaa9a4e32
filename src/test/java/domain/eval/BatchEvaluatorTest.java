package domain.eval;

import domain.clause.SqlClause;
import domain.exec.ExecutionErrorType;
import domain.exec.ExecutionResult;
import domain.exec.QueryExecutor;
import domain.exec.ResultRow;
import domain.difficulty.DifficultyLabel;
import domain.model.InvalidEvaluationInputException;
import domain.model.WarningCode;
import domain.schema.SchemaCatalog;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class BatchEvaluatorTest {

    private static final double EPS = 1e-9;

    @Test
    void evaluate_shouldKeepInputOrder_whenRunningOnThreads() {
        List<String> pred = new ArrayList<>();
        List<String> gold = new ArrayList<>();
        List<String> dbIds = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            pred.add("SELECT c" + i + " FROM t");
            gold.add("SELECT c" + i + " FROM t WHERE x = " + i);
            dbIds.add("db");
        }
        AtomicInteger notified = new AtomicInteger();
        BatchEvaluator batch = new BatchEvaluator(new PairEvaluator(new QueryAnalyzer(null), null, 0), 4,
                (done, total, last) -> {
                    notified.incrementAndGet();
                    assertEquals(40, total);
                    assertEquals(done - 1, last.getPair().getIndex());
                });

        List<PairResult> results = batch.evaluate(BatchEvaluator.pairs(pred, gold, dbIds));

        assertEquals(40, results.size());
        assertEquals(40, notified.get());
        for (int i = 0; i < results.size(); i++) {
            assertEquals(i, results.get(i).getPair().getIndex());
            assertEquals("SELECT c" + i + " FROM t", results.get(i).getPair().getPredictedSql());
        }
    }

    @Test
    void evaluate_shouldReturnEmpty_whenNoPairs() {
        BatchEvaluator batch = new BatchEvaluator(new PairEvaluator(new QueryAnalyzer(null), null, 0), 2, null);
        assertTrue(batch.evaluate(List.of()).isEmpty());
    }

    @Test
    void pairs_shouldRejectLengthMismatch() {
        assertThrows(InvalidEvaluationInputException.class,
                () -> BatchEvaluator.pairs(List.of("SELECT 1"), List.of(), List.of()));
    }

    @Test
    void scoreComponents_shouldReturnPerClauseF1() {
        Map<SqlClause, Double> f1 = BatchEvaluator.scoreComponents(
                List.of("SELECT a FROM t", "SELECT b FROM u WHERE y = 2"),
                List.of("SELECT a FROM t WHERE x = 1", "SELECT b FROM u WHERE y = 2"),
                List.of("db", "db"),
                SchemaCatalog.empty());

        assertEquals(1.0, f1.get(SqlClause.SELECT), EPS);
        assertEquals(1.0, f1.get(SqlClause.FROM), EPS);
        // tp=1 fp=0 fn=1
        assertEquals(2.0 / 3, f1.get(SqlClause.WHERE), EPS);
        assertEquals(1.0, f1.get(SqlClause.HAVING), EPS);
    }

    @Test
    void summary_shouldAggregateAccuracyDifficultyAndWarnings() {
        BatchEvaluator batch = new BatchEvaluator(new PairEvaluator(new QueryAnalyzer(null), null, 0), 1, null);
        List<PairResult> results = batch.evaluate(BatchEvaluator.pairs(
                List.of("SELECT a FROM t", "SELECT x.b FROM t", "SELECT COUNT(*) FROM t GROUP BY c"),
                List.of("SELECT a FROM t", "SELECT b FROM t", "SELECT COUNT(*) FROM t GROUP BY c"),
                List.of("db", "db", "db")));

        EvaluationSummary s = EvaluationSummary.of(results);

        assertEquals(3, s.getTotal());
        assertEquals(2, s.getExactMatches());
        assertEquals(2.0 / 3, s.getExactMatchAccuracy(), EPS);
        assertEquals(1.0, s.getSyntaxValidity(), EPS);
        assertEquals(1, s.getDegradedPairs());
        assertEquals(1, s.getWarningCounts().get(WarningCode.ALIAS_UNRESOLVED));
        assertNull(s.getExecution());

        DifficultyBreakdown easy = s.getDifficulty().get(DifficultyLabel.EASY);
        assertEquals(2, easy.getCount());
        assertEquals(0.5, easy.getExactMatchAccuracy(), EPS);
        assertNull(easy.getExecutionAccuracy());
        assertEquals(1, s.getDifficulty().get(DifficultyLabel.MEDIUM).getCount());
        assertFalse(s.getDifficulty().containsKey(DifficultyLabel.EXTRA));
    }

    @Test
    void summary_shouldCountExecutionOnlyForPairsWhereBothRan() {
        QueryExecutor executor = (sql, dbId) -> sql.contains("missing")
                ? ExecutionResult.failure(ExecutionErrorType.MISSING_OBJECT, "no such table: missing", 0)
                : ExecutionResult.success(List.of(ResultRow.of(sql.contains("a") ? 1L : 2L)), 1);
        BatchEvaluator batch = new BatchEvaluator(new PairEvaluator(new QueryAnalyzer(null), executor, 0), 1, null);

        List<PairResult> results = batch.evaluate(BatchEvaluator.pairs(
                List.of("SELECT a FROM t", "SELECT b FROM t", "SELECT a FROM missing"),
                List.of("SELECT a FROM t", "SELECT a FROM t", "SELECT a FROM t"),
                List.of("db", "db", "db")));
        EvaluationSummary s = EvaluationSummary.of(results);

        assertNotNull(s.getExecution());
        assertEquals(2, s.getExecution().getBothSuccessful());
        assertEquals(0.5, s.getExecution().getExecutionAccuracy(), EPS);
        assertEquals(1, s.getFailedExecutionPairs());
        assertEquals(0.5, s.getDifficulty().get(DifficultyLabel.EASY).getExecutionAccuracy(), EPS);
    }
}
