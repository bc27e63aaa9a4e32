package domain.report;

import domain.eval.EvaluationSummary;
import domain.eval.PairResult;

import java.nio.file.Path;
import java.util.List;

/** Persists the outcome of one evaluation run. */
public interface ReportWriter {

    void write(Path out, EvaluationSummary summary, List<PairResult> results);
}
