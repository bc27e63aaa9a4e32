package cli;

import domain.clause.SqlClause;
import domain.difficulty.DifficultyLabel;
import domain.eval.DifficultyBreakdown;
import domain.eval.EvaluationSummary;
import domain.exec.ExecutionErrorType;
import domain.exec.ExecutionStats;
import domain.model.WarningCode;
import domain.score.ClauseScore;

import java.util.Locale;
import java.util.Map;

/** Human-readable end-of-run summary. */
public final class ConsoleSummaryFormatter {

    private static final String RULE = "==================================================";

    private ConsoleSummaryFormatter() {
    }

    public static String format(EvaluationSummary s) {
        StringBuilder sb = new StringBuilder(1024);
        sb.append(RULE).append('\n');
        sb.append("SQL Evaluation Results").append('\n');
        sb.append(RULE).append('\n');
        line(sb, "Total queries: %d", s.getTotal());
        line(sb, "Exact match accuracy: %.4f (%d/%d)", s.getExactMatchAccuracy(), s.getExactMatches(), s.getTotal());
        line(sb, "Syntax validity: %.4f", s.getSyntaxValidity());
        line(sb, "Average component F1: %.4f", s.getAverageComponentF1());

        sb.append('\n').append("Component F1 (micro-averaged):").append('\n');
        for (Map.Entry<SqlClause, ClauseScore> e : s.getClauseScores().entrySet()) {
            ClauseScore c = e.getValue();
            line(sb, "  %-9s P=%.4f R=%.4f F1=%.4f", e.getKey().label(), c.getPrecision(), c.getRecall(), c.getF1());
        }

        sb.append('\n').append("Component-wise Accuracy:").append('\n');
        for (Map.Entry<SqlClause, Double> e : s.getComponentWiseAccuracy().entrySet()) {
            line(sb, "  %-9s %.4f", e.getKey().label(), e.getValue());
        }

        sb.append('\n').append("Difficulty Breakdown:").append('\n');
        for (Map.Entry<DifficultyLabel, DifficultyBreakdown> e : s.getDifficulty().entrySet()) {
            DifficultyBreakdown b = e.getValue();
            String exec = b.getExecutionAccuracy() == null ? ""
                    : String.format(Locale.ROOT, " exec=%.4f", b.getExecutionAccuracy());
            line(sb, "  %-6s n=%d (%.1f%%) exact=%.4f f1=%.4f%s", e.getKey().label(), b.getCount(),
                    b.getShare() * 100.0, b.getExactMatchAccuracy(), b.getAverageComponentF1(), exec);
        }

        ExecutionStats ex = s.getExecution();
        if (ex != null) {
            sb.append('\n').append("Execution:").append('\n');
            line(sb, "  execution accuracy: %.4f (%d/%d both successful)",
                    ex.getExecutionAccuracy(), ex.getExactMatches(), ex.getBothSuccessful());
            line(sb, "  row P/R/F1: %.4f / %.4f / %.4f",
                    ex.getAveragePrecision(), ex.getAverageRecall(), ex.getAverageF1());
            line(sb, "  predicted success: %d/%d, gold success: %d/%d",
                    ex.getPredicted().getSuccessful(), ex.getPredicted().getTotal(),
                    ex.getGold().getSuccessful(), ex.getGold().getTotal());
            for (Map.Entry<ExecutionErrorType, Integer> e : ex.getPredicted().getErrors().entrySet()) {
                line(sb, "  predicted %s: %d", e.getKey().name(), e.getValue());
            }
        }

        sb.append('\n');
        line(sb, "Degraded comparisons: %d, failed executions: %d", s.getDegradedPairs(), s.getFailedExecutionPairs());
        for (Map.Entry<WarningCode, Integer> e : s.getWarningCounts().entrySet()) {
            line(sb, "  %s: %d", e.getKey().name(), e.getValue());
        }
        sb.append(RULE);
        return sb.toString();
    }

    private static void line(StringBuilder sb, String fmt, Object... args) {
        sb.append(String.format(Locale.ROOT, fmt, args)).append('\n');
    }
}
