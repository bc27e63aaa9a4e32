package domain.exec;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Order-independent comparison of two result sets. Duplicate rows collapse.
 *
 * <ul>
 *   <li>both empty: exact match, every metric 1.0</li>
 *   <li>exactly one empty, or either execution failed: every metric 0.0</li>
 *   <li>otherwise set precision / recall / F1 over rows</li>
 * </ul>
 */
public final class ExecutionComparator {

    private ExecutionComparator() {
    }

    public static ResultComparison compare(ExecutionResult predicted, ExecutionResult gold) {
        if (predicted == null || gold == null || !predicted.isSuccess() || !gold.isSuccess()) {
            return ResultComparison.NONE;
        }

        Set<ResultRow> p = new LinkedHashSet<>(predicted.getRows());
        Set<ResultRow> g = new LinkedHashSet<>(gold.getRows());

        if (p.isEmpty() && g.isEmpty()) return ResultComparison.VACUOUS;
        if (p.isEmpty() || g.isEmpty()) return ResultComparison.NONE;

        int inter = 0;
        for (ResultRow r : p) {
            if (g.contains(r)) inter++;
        }
        double precision = (double) inter / p.size();
        double recall = (double) inter / g.size();
        double f1 = (precision + recall) == 0 ? 0.0 : 2 * precision * recall / (precision + recall);
        return new ResultComparison(p.equals(g), precision, recall, f1);
    }
}
