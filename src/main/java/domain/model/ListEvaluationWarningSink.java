package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with best-effort de-duplication.
 *
 * <p>We deduplicate by (code|pair|side|message|detail) so that the same unresolved alias
 * referenced several times in one query yields a single row. Not thread-safe: the batch
 * evaluator gives each pair its own sink.</p>
 */
public final class ListEvaluationWarningSink implements EvaluationWarningSink {

    private final List<EvaluationWarning> target;
    private final Set<String> seen = new HashSet<>(64);

    public ListEvaluationWarningSink(List<EvaluationWarning> target) {
        this.target = target;
    }

    private static String key(EvaluationWarning w) {
        return w.getCode().name() + "|"
                + w.getPairIndex() + "|"
                + (w.getSide() == null ? "" : w.getSide().name()) + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(EvaluationWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
