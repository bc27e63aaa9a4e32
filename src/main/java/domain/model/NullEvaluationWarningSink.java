package domain.model;
/** No-op warning sink. */
final class NullEvaluationWarningSink implements EvaluationWarningSink {

    static final NullEvaluationWarningSink INSTANCE = new NullEvaluationWarningSink();

    private NullEvaluationWarningSink() {
    }

    @Override
    public void warn(EvaluationWarning warning) {
        // no-op
    }
}
