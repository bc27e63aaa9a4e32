package cli;

import domain.eval.BatchEvaluator;
import domain.eval.EvaluationSummary;
import domain.eval.PairEvaluator;
import domain.eval.QueryAnalyzer;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsoleSummaryFormatterTest {

    @Test
    void format_shouldListTotalsComponentsAndDifficulty() {
        BatchEvaluator batch = new BatchEvaluator(new PairEvaluator(new QueryAnalyzer(null), null, 0), 1, null);
        EvaluationSummary summary = EvaluationSummary.of(batch.evaluate(BatchEvaluator.pairs(
                List.of("SELECT a FROM t", "SELECT COUNT(*) FROM t GROUP BY b"),
                List.of("SELECT a FROM t", "SELECT COUNT(*) FROM t GROUP BY c"),
                List.of("db", "db"))));

        String text = ConsoleSummaryFormatter.format(summary);

        assertTrue(text.contains("SQL Evaluation Results"));
        assertTrue(text.contains("Total queries: 2"));
        assertTrue(text.contains("Exact match accuracy: 0.5000 (1/2)"));
        assertTrue(text.contains("Component-wise Accuracy:"));
        assertTrue(text.contains("Difficulty Breakdown:"));
        assertTrue(text.contains("easy"));
        assertTrue(text.contains("medium"));
        assertFalse(text.contains("Execution:"));
    }
}
