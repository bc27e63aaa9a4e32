package domain.eval;

import domain.clause.ComponentSet;
import domain.clause.SqlClause;
import domain.difficulty.DifficultyLabel;
import domain.exec.ExecutionStats;
import domain.model.EvaluationWarning;
import domain.model.WarningCode;
import domain.score.ClauseScore;
import domain.score.ClauseStats;
import domain.score.ComponentScorer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batch-level numbers. Degraded and failed comparisons are counted next to the scores so a
 * low score can be told apart from a batch where nothing could be analyzed or executed.
 */
public final class EvaluationSummary {

    private static final Set<WarningCode> DEGRADING = EnumSet.of(
            WarningCode.ALIAS_UNRESOLVED, WarningCode.AMBIGUOUS_COLUMN,
            WarningCode.PARSE_DEGRADED, WarningCode.UNKNOWN_DB_ID);

    private final int total;
    private final int exactMatches;
    private final int syntaxValid;
    private final Map<SqlClause, ClauseScore> clauseScores;
    private final Map<SqlClause, Double> componentWiseAccuracy;
    private final double averageComponentF1;
    private final Map<DifficultyLabel, DifficultyBreakdown> difficulty;
    private final Map<WarningCode, Integer> warningCounts;
    private final int degradedPairs;
    private final int failedExecutionPairs;
    private final ExecutionStats execution;

    private EvaluationSummary(int total, int exactMatches, int syntaxValid,
                              Map<SqlClause, ClauseScore> clauseScores,
                              Map<SqlClause, Double> componentWiseAccuracy,
                              Map<DifficultyLabel, DifficultyBreakdown> difficulty,
                              Map<WarningCode, Integer> warningCounts,
                              int degradedPairs, int failedExecutionPairs, ExecutionStats execution) {
        this.total = total;
        this.exactMatches = exactMatches;
        this.syntaxValid = syntaxValid;
        this.clauseScores = Collections.unmodifiableMap(clauseScores);
        this.componentWiseAccuracy = Collections.unmodifiableMap(componentWiseAccuracy);
        this.averageComponentF1 = ComponentScorer.averageF1(clauseScores);
        this.difficulty = Collections.unmodifiableMap(difficulty);
        this.warningCounts = Collections.unmodifiableMap(warningCounts);
        this.degradedPairs = degradedPairs;
        this.failedExecutionPairs = failedExecutionPairs;
        this.execution = execution;
    }

    public static EvaluationSummary of(List<PairResult> results) {
        int exact = 0;
        int valid = 0;
        int degraded = 0;
        int failed = 0;
        boolean executed = false;

        Map<SqlClause, ClauseStats> stats = ComponentScorer.newStats();
        List<ComponentSet> predicted = new ArrayList<>(results.size());
        List<ComponentSet> gold = new ArrayList<>(results.size());
        Map<WarningCode, Integer> warnings = new EnumMap<>(WarningCode.class);
        ExecutionStats exec = new ExecutionStats();

        for (PairResult r : results) {
            if (r.isExactMatch()) exact++;
            if (r.getPredicted().isSyntaxValid()) valid++;

            ComponentScorer.accumulate(stats, r.getPredicted().getComponents(), r.getGold().getComponents());
            predicted.add(r.getPredicted().getComponents());
            gold.add(r.getGold().getComponents());

            boolean pairDegraded = false;
            for (EvaluationWarning w : r.getWarnings()) {
                warnings.merge(w.getCode(), 1, Integer::sum);
                if (DEGRADING.contains(w.getCode())) pairDegraded = true;
            }
            if (pairDegraded) degraded++;

            if (r.isExecuted()) {
                executed = true;
                exec.record(r.getPredictedExecution(), r.getGoldExecution(), r.getComparison());
                if (!r.getPredictedExecution().isSuccess() || !r.getGoldExecution().isSuccess()) failed++;
            }
        }

        return new EvaluationSummary(results.size(), exact, valid,
                ComponentScorer.toScores(stats),
                ComponentScorer.componentWiseAccuracy(predicted, gold),
                breakdown(results, executed),
                warnings, degraded, failed, executed ? exec : null);
    }

    private static Map<DifficultyLabel, DifficultyBreakdown> breakdown(List<PairResult> results, boolean executed) {
        Map<DifficultyLabel, List<PairResult>> groups = new EnumMap<>(DifficultyLabel.class);
        for (PairResult r : results) {
            groups.computeIfAbsent(r.getDifficulty(), k -> new ArrayList<>()).add(r);
        }

        Map<DifficultyLabel, DifficultyBreakdown> out = new EnumMap<>(DifficultyLabel.class);
        for (Map.Entry<DifficultyLabel, List<PairResult>> e : groups.entrySet()) {
            List<PairResult> g = e.getValue();
            int exact = 0;
            double f1 = 0.0;
            int ran = 0;
            int execMatch = 0;
            for (PairResult r : g) {
                if (r.isExactMatch()) exact++;
                f1 += r.getComponentF1();
                if (r.isExecuted() && r.getPredictedExecution().isSuccess() && r.getGoldExecution().isSuccess()) {
                    ran++;
                    if (r.isExecutionMatch()) execMatch++;
                }
            }
            Double execAcc = executed ? (ran == 0 ? 0.0 : (double) execMatch / ran) : null;
            out.put(e.getKey(), new DifficultyBreakdown(g.size(), (double) g.size() / results.size(),
                    (double) exact / g.size(), f1 / g.size(), execAcc));
        }
        return out;
    }

    public int getTotal() {
        return total;
    }

    public int getExactMatches() {
        return exactMatches;
    }

    public double getExactMatchAccuracy() {
        return total == 0 ? 0.0 : (double) exactMatches / total;
    }

    public int getSyntaxValid() {
        return syntaxValid;
    }

    /** Share of predicted queries that pass the well-formedness check. */
    public double getSyntaxValidity() {
        return total == 0 ? 0.0 : (double) syntaxValid / total;
    }

    public Map<SqlClause, ClauseScore> getClauseScores() {
        return clauseScores;
    }

    public Map<SqlClause, Double> getComponentWiseAccuracy() {
        return componentWiseAccuracy;
    }

    public double getAverageComponentF1() {
        return averageComponentF1;
    }

    public Map<DifficultyLabel, DifficultyBreakdown> getDifficulty() {
        return difficulty;
    }

    public Map<WarningCode, Integer> getWarningCounts() {
        return warningCounts;
    }

    /** Pairs with at least one alias, binding, parse or db_id warning. */
    public int getDegradedPairs() {
        return degradedPairs;
    }

    /** Pairs where at least one side failed to execute. */
    public int getFailedExecutionPairs() {
        return failedExecutionPairs;
    }

    /** null when execution comparison was not requested */
    public ExecutionStats getExecution() {
        return execution;
    }
}
