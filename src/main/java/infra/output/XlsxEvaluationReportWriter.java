package infra.output;

import domain.clause.SqlClause;
import domain.difficulty.DifficultyLabel;
import domain.eval.DifficultyBreakdown;
import domain.eval.EvaluationSummary;
import domain.eval.PairResult;
import domain.exec.ExecutionResult;
import domain.exec.ExecutionStats;
import domain.model.EvaluationWarning;
import domain.report.ReportWriter;
import domain.score.ClauseScore;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>summary: batch metrics, per-clause scores, difficulty breakdown</li>
 *   <li>pairs: one row per pair</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class XlsxEvaluationReportWriter implements ReportWriter {

    /** Excel refuses longer cell text. */
    private static final int MAX_CELL = 32_000;

    private static void writeSummarySheet(Workbook wb, EvaluationSummary s) {
        Sheet sh = wb.createSheet("summary");
        int[] r = {0};

        metric(sh, r, "total_queries", s.getTotal());
        metric(sh, r, "exact_match_accuracy", s.getExactMatchAccuracy());
        metric(sh, r, "syntax_validity", s.getSyntaxValidity());
        metric(sh, r, "average_component_f1", s.getAverageComponentF1());
        metric(sh, r, "degraded_pairs", s.getDegradedPairs());

        ExecutionStats ex = s.getExecution();
        if (ex != null) {
            metric(sh, r, "execution_accuracy", ex.getExecutionAccuracy());
            metric(sh, r, "execution_both_successful", ex.getBothSuccessful());
            metric(sh, r, "execution_failed_pairs", s.getFailedExecutionPairs());
            metric(sh, r, "execution_avg_f1", ex.getAverageF1());
            metric(sh, r, "predicted_success_rate", ex.getPredicted().getSuccessRate());
            metric(sh, r, "gold_success_rate", ex.getGold().getSuccessRate());
        }
        r[0]++;

        Row header = sh.createRow(r[0]++);
        header.createCell(0)
                .setCellValue("clause");
        header.createCell(1)
                .setCellValue("precision");
        header.createCell(2)
                .setCellValue("recall");
        header.createCell(3)
                .setCellValue("f1");
        header.createCell(4)
                .setCellValue("tp");
        header.createCell(5)
                .setCellValue("fp");
        header.createCell(6)
                .setCellValue("fn");
        header.createCell(7)
                .setCellValue("componentWiseAccuracy");

        for (Map.Entry<SqlClause, ClauseScore> e : s.getClauseScores().entrySet()) {
            ClauseScore c = e.getValue();
            Row row = sh.createRow(r[0]++);
            row.createCell(0)
                    .setCellValue(e.getKey().label());
            row.createCell(1)
                    .setCellValue(c.getPrecision());
            row.createCell(2)
                    .setCellValue(c.getRecall());
            row.createCell(3)
                    .setCellValue(c.getF1());
            row.createCell(4)
                    .setCellValue(c.getTruePositive());
            row.createCell(5)
                    .setCellValue(c.getFalsePositive());
            row.createCell(6)
                    .setCellValue(c.getFalseNegative());
            Double acc = s.getComponentWiseAccuracy().get(e.getKey());
            if (acc != null) row.createCell(7)
                    .setCellValue(acc);
        }
        r[0]++;

        Row dh = sh.createRow(r[0]++);
        dh.createCell(0)
                .setCellValue("difficulty");
        dh.createCell(1)
                .setCellValue("count");
        dh.createCell(2)
                .setCellValue("share");
        dh.createCell(3)
                .setCellValue("exactMatchAccuracy");
        dh.createCell(4)
                .setCellValue("averageComponentF1");
        dh.createCell(5)
                .setCellValue("executionAccuracy");

        for (Map.Entry<DifficultyLabel, DifficultyBreakdown> e : s.getDifficulty().entrySet()) {
            DifficultyBreakdown b = e.getValue();
            Row row = sh.createRow(r[0]++);
            row.createCell(0)
                    .setCellValue(e.getKey().label());
            row.createCell(1)
                    .setCellValue(b.getCount());
            row.createCell(2)
                    .setCellValue(b.getShare());
            row.createCell(3)
                    .setCellValue(b.getExactMatchAccuracy());
            row.createCell(4)
                    .setCellValue(b.getAverageComponentF1());
            if (b.getExecutionAccuracy() != null) row.createCell(5)
                    .setCellValue(b.getExecutionAccuracy());
        }
    }

    private static void metric(Sheet sh, int[] r, String name, double value) {
        Row row = sh.createRow(r[0]++);
        row.createCell(0)
                .setCellValue(name);
        row.createCell(1)
                .setCellValue(value);
    }

    private static void writePairsSheet(Workbook wb, List<PairResult> results) {
        Sheet sh = wb.createSheet("pairs");
        int r = 0;
        Row header = sh.createRow(r++);
        String[] cols = {"index", "questionId", "dbId", "difficulty", "exactMatch", "componentF1",
                "selectF1", "whereF1", "executionMatch", "predictedError", "goldError",
                "missingKeywords", "extraKeywords", "predictedSql", "goldSql"};
        for (int i = 0; i < cols.length; i++) {
            header.createCell(i)
                    .setCellValue(cols[i]);
        }

        for (PairResult it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getPair().getIndex());
            row.createCell(1)
                    .setCellValue(nullToEmpty(it.getPair().getQuestionId()));
            row.createCell(2)
                    .setCellValue(nullToEmpty(it.getPair().getDbId()));
            row.createCell(3)
                    .setCellValue(it.getDifficulty().label());
            row.createCell(4)
                    .setCellValue(it.isExactMatch());
            row.createCell(5)
                    .setCellValue(it.getComponentF1());
            row.createCell(6)
                    .setCellValue(it.getClauseScores().get(SqlClause.SELECT).getF1());
            row.createCell(7)
                    .setCellValue(it.getClauseScores().get(SqlClause.WHERE).getF1());
            if (it.isExecuted()) {
                row.createCell(8)
                        .setCellValue(it.isExecutionMatch());
                row.createCell(9)
                        .setCellValue(errorOf(it.getPredictedExecution()));
                row.createCell(10)
                        .setCellValue(errorOf(it.getGoldExecution()));
            }
            row.createCell(11)
                    .setCellValue(String.join(", ", it.getMissingKeywords()));
            row.createCell(12)
                    .setCellValue(String.join(", ", it.getExtraKeywords()));
            row.createCell(13)
                    .setCellValue(clip(it.getPair().getPredictedSql()));
            row.createCell(14)
                    .setCellValue(clip(it.getPair().getGoldSql()));
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<PairResult> results) {
        Sheet sh = wb.createSheet("warnings");
        int r = 0;
        Row header = sh.createRow(r++);
        header.createCell(0)
                .setCellValue("code");
        header.createCell(1)
                .setCellValue("pairIndex");
        header.createCell(2)
                .setCellValue("dbId");
        header.createCell(3)
                .setCellValue("side");
        header.createCell(4)
                .setCellValue("message");
        header.createCell(5)
                .setCellValue("detail");

        for (PairResult pr : results) {
            for (EvaluationWarning w : pr.getWarnings()) {
                Row row = sh.createRow(r++);
                row.createCell(0)
                        .setCellValue(w.getCode().name());
                row.createCell(1)
                        .setCellValue(w.getPairIndex());
                row.createCell(2)
                        .setCellValue(nullToEmpty(w.getDbId()));
                row.createCell(3)
                        .setCellValue(w.getSide() == null ? "" : w.getSide().name());
                row.createCell(4)
                        .setCellValue(nullToEmpty(w.getMessage()));
                row.createCell(5)
                        .setCellValue(clip(w.getDetail()));
            }
        }
    }

    private static String errorOf(ExecutionResult r) {
        if (r == null || r.isSuccess()) return "";
        return r.getErrorType().name() + ": " + clip(r.getError());
    }

    private static String clip(String s) {
        String t = nullToEmpty(s);
        return t.length() <= MAX_CELL ? t : t.substring(0, MAX_CELL);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    @Override
    public void write(Path out, EvaluationSummary summary, List<PairResult> results) {
        if (out == null) throw new IllegalArgumentException("report path is null");
        if (summary == null) throw new IllegalArgumentException("summary is null");
        if (results == null) throw new IllegalArgumentException("results is null");

        try {
            Path parent = out.toAbsolutePath()
                    .normalize()
                    .getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create report parent dir: " + out, e);
        }

        try (Workbook wb = new XSSFWorkbook()) {
            writeSummarySheet(wb, summary);
            writePairsSheet(wb, results);
            writeWarningsSheet(wb, results);

            try (OutputStream os = Files.newOutputStream(out)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + out, e);
        }
    }
}
