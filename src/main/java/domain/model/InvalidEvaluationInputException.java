package domain.model;

/**
 * Batch-level contract violation: mismatched batch lengths, malformed schema records,
 * unreadable input documents.
 *
 * <p>Unlike per-query problems (which become {@link EvaluationWarning}s), this is fatal
 * to the call and is never silently coerced.</p>
 */
public class InvalidEvaluationInputException extends IllegalArgumentException {

    public InvalidEvaluationInputException(String message) {
        super(message);
    }

    public InvalidEvaluationInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
