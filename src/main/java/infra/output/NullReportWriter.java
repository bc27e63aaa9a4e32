package infra.output;

import domain.eval.EvaluationSummary;
import domain.eval.PairResult;
import domain.report.ReportWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation (feature toggle).
 */
public final class NullReportWriter implements ReportWriter {
    @Override
    public void write(Path out, EvaluationSummary summary, List<PairResult> results) {
        // report disabled
    }
}
