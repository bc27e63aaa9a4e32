package infra.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import domain.clause.SqlClause;
import domain.difficulty.DifficultyLabel;
import domain.eval.DifficultyBreakdown;
import domain.eval.EvaluationSummary;
import domain.eval.PairResult;
import domain.exec.ExecutionErrorType;
import domain.exec.ExecutionStats;
import domain.model.WarningCode;
import domain.report.ReportWriter;
import domain.score.ClauseScore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pretty-printed JSON summary. Field names are snake_case; non-ASCII text is written as is.
 */
public final class JsonSummaryWriter implements ReportWriter {

    private final ObjectMapper mapper;

    public JsonSummaryWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public JsonSummaryWriter(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void write(Path out, EvaluationSummary summary, List<PairResult> results) {
        if (out == null) throw new IllegalArgumentException("summary path is null");
        if (summary == null) throw new IllegalArgumentException("summary is null");

        try {
            Path parent = out.toAbsolutePath().normalize().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to create summary parent dir: " + out, e);
        }

        try {
            mapper.writeValue(out.toFile(), toDocument(summary, results == null ? List.of() : results));
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write summary json: " + out, e);
        }
    }

    public Map<String, Object> toDocument(EvaluationSummary s, List<PairResult> results) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("total_queries", s.getTotal());
        doc.put("exact_match_accuracy", s.getExactMatchAccuracy());
        doc.put("syntax_validity", s.getSyntaxValidity());
        doc.put("average_component_f1", s.getAverageComponentF1());

        Map<String, Object> clauses = new LinkedHashMap<>();
        for (Map.Entry<SqlClause, ClauseScore> e : s.getClauseScores().entrySet()) {
            ClauseScore c = e.getValue();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("precision", c.getPrecision());
            m.put("recall", c.getRecall());
            m.put("f1", c.getF1());
            m.put("tp", c.getTruePositive());
            m.put("fp", c.getFalsePositive());
            m.put("fn", c.getFalseNegative());
            clauses.put(e.getKey().label(), m);
        }
        doc.put("component_scores", clauses);

        Map<String, Object> cwa = new LinkedHashMap<>();
        for (Map.Entry<SqlClause, Double> e : s.getComponentWiseAccuracy().entrySet()) {
            cwa.put(e.getKey().label(), e.getValue());
        }
        doc.put("component_wise_accuracy", cwa);

        Map<String, Object> diff = new LinkedHashMap<>();
        for (Map.Entry<DifficultyLabel, DifficultyBreakdown> e : s.getDifficulty().entrySet()) {
            DifficultyBreakdown b = e.getValue();
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("count", b.getCount());
            m.put("percentage_of_total", b.getShare() * 100.0);
            m.put("exact_match_accuracy", b.getExactMatchAccuracy());
            m.put("average_component_f1", b.getAverageComponentF1());
            if (b.getExecutionAccuracy() != null) m.put("execution_accuracy", b.getExecutionAccuracy());
            diff.put(e.getKey().label(), m);
        }
        doc.put("difficulty_breakdown", diff);

        Map<String, Object> warnings = new LinkedHashMap<>();
        for (Map.Entry<WarningCode, Integer> e : s.getWarningCounts().entrySet()) {
            warnings.put(e.getKey().name(), e.getValue());
        }
        doc.put("degraded_pairs", s.getDegradedPairs());
        doc.put("warning_counts", warnings);

        ExecutionStats ex = s.getExecution();
        if (ex != null) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("execution_accuracy", ex.getExecutionAccuracy());
            m.put("both_successful", ex.getBothSuccessful());
            m.put("failed_pairs", s.getFailedExecutionPairs());
            m.put("avg_precision", ex.getAveragePrecision());
            m.put("avg_recall", ex.getAverageRecall());
            m.put("avg_f1", ex.getAverageF1());
            m.put("predicted", side(ex.getPredicted()));
            m.put("gold", side(ex.getGold()));
            doc.put("execution", m);
        }

        List<Object> pairs = new ArrayList<>(results.size());
        for (PairResult r : results) pairs.add(pair(r));
        doc.put("pairs", pairs);
        return doc;
    }

    private static Map<String, Object> side(ExecutionStats.Side s) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("total", s.getTotal());
        m.put("successful", s.getSuccessful());
        m.put("success_rate", s.getSuccessRate());
        m.put("avg_elapsed_ms", s.getAverageElapsedMillis());
        m.put("min_elapsed_ms", s.getMinElapsedMillis());
        m.put("max_elapsed_ms", s.getMaxElapsedMillis());
        Map<String, Object> errors = new LinkedHashMap<>();
        for (Map.Entry<ExecutionErrorType, Integer> e : s.getErrors().entrySet()) {
            errors.put(e.getKey().name(), e.getValue());
        }
        m.put("error_types", errors);
        return m;
    }

    private static Map<String, Object> pair(PairResult r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("index", r.getPair().getIndex());
        m.put("question_id", r.getPair().getQuestionId());
        m.put("db_id", r.getPair().getDbId());
        m.put("difficulty", r.getDifficulty().label());
        m.put("exact_match", r.isExactMatch());
        m.put("component_f1", r.getComponentF1());
        if (r.isExecuted()) m.put("execution_match", r.isExecutionMatch());
        if (!r.getMissingKeywords().isEmpty()) m.put("missing_keywords", r.getMissingKeywords());
        if (!r.getExtraKeywords().isEmpty()) m.put("extra_keywords", r.getExtraKeywords());
        m.put("warnings", r.getWarnings().size());
        return m;
    }
}
