package domain.score;

import domain.clause.ComponentSet;
import domain.clause.SqlClause;
import domain.model.InvalidEvaluationInputException;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Set-based component scoring.
 *
 * <p>Batch scores are micro-averaged: tp / fp / fn are summed over every pair before the
 * ratios are taken. A clause absent from both queries of a pair adds nothing to the counts.</p>
 */
public final class ComponentScorer {

    private ComponentScorer() {
    }

    /** Empty per-clause counters, one per {@link SqlClause}. */
    public static Map<SqlClause, ClauseStats> newStats() {
        Map<SqlClause, ClauseStats> stats = new EnumMap<>(SqlClause.class);
        for (SqlClause c : SqlClause.values()) stats.put(c, new ClauseStats());
        return stats;
    }

    public static void accumulate(Map<SqlClause, ClauseStats> stats, ComponentSet predicted, ComponentSet gold) {
        for (SqlClause c : SqlClause.values()) {
            stats.computeIfAbsent(c, k -> new ClauseStats()).accumulate(predicted.get(c), gold.get(c));
        }
    }

    public static Map<SqlClause, ClauseScore> score(List<ComponentSet> predicted, List<ComponentSet> gold) {
        requireSameSize(predicted, gold);
        Map<SqlClause, ClauseStats> stats = newStats();
        for (int i = 0; i < predicted.size(); i++) {
            accumulate(stats, predicted.get(i), gold.get(i));
        }
        return toScores(stats);
    }

    public static Map<SqlClause, ClauseScore> toScores(Map<SqlClause, ClauseStats> stats) {
        Map<SqlClause, ClauseScore> out = new EnumMap<>(SqlClause.class);
        for (SqlClause c : SqlClause.values()) {
            ClauseStats s = stats.get(c);
            out.put(c, s == null ? ClauseScore.of(0, 0, 0) : s.toScore());
        }
        return out;
    }

    public static Map<SqlClause, ClauseScore> scorePair(ComponentSet predicted, ComponentSet gold) {
        Map<SqlClause, ClauseStats> stats = newStats();
        accumulate(stats, predicted, gold);
        return toScores(stats);
    }

    /** Mean F1 over every clause, KEYWORDS included. */
    public static double averageF1(Map<SqlClause, ClauseScore> scores) {
        if (scores.isEmpty()) return 0.0;
        double sum = 0.0;
        for (ClauseScore s : scores.values()) sum += s.getF1();
        return sum / scores.size();
    }

    /**
     * Per syntactic clause: share of gold queries having the clause whose predicted
     * component set is identical. 1.0 for a clause no gold query has.
     */
    public static Map<SqlClause, Double> componentWiseAccuracy(List<ComponentSet> predicted, List<ComponentSet> gold) {
        requireSameSize(predicted, gold);
        Map<SqlClause, Double> out = new EnumMap<>(SqlClause.class);

        for (SqlClause c : SqlClause.values()) {
            if (!c.isSyntactic()) continue;
            int total = 0;
            int matched = 0;
            for (int i = 0; i < gold.size(); i++) {
                ComponentSet g = gold.get(i);
                if (!g.has(c)) continue;
                total++;
                ComponentSet p = predicted.get(i);
                if (p.has(c) && p.get(c).equals(g.get(c))) matched++;
            }
            out.put(c, total == 0 ? 1.0 : (double) matched / total);
        }
        return out;
    }

    static void requireSameSize(List<?> predicted, List<?> gold) {
        if (predicted == null || gold == null) {
            throw new InvalidEvaluationInputException("predicted and gold batches are required");
        }
        if (predicted.size() != gold.size()) {
            throw new InvalidEvaluationInputException(
                    "batch length mismatch: predicted=" + predicted.size() + ", gold=" + gold.size());
        }
    }
}
