package domain.model;

/**
 * Sink for evaluation warnings.
 *
 * <p>Warnings are produced by the alias resolver, the schema binder, the clause extractor and
 * the executor. A sink lets them be collected without coupling those components to the
 * batch driver or the report writers.</p>
 */
public interface EvaluationWarningSink {

    static EvaluationWarningSink none() {
        return NullEvaluationWarningSink.INSTANCE;
    }

    void warn(EvaluationWarning warning);
}
