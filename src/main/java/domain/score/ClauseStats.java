package domain.score;

import java.util.Set;

/**
 * Running true-positive / false-positive / false-negative counters of one clause.
 * Batch-scoped and not thread-safe; one instance per clause per evaluation run.
 */
public final class ClauseStats {

    private long truePositive;
    private long falsePositive;
    private long falseNegative;
    private int vacuousPairs;

    /** Adds one pair's contribution. Two empty sets count as a vacuous agreement. */
    public void accumulate(Set<String> predicted, Set<String> gold) {
        if (predicted.isEmpty() && gold.isEmpty()) {
            vacuousPairs++;
            return;
        }
        int inter = 0;
        for (String p : predicted) {
            if (gold.contains(p)) inter++;
        }
        truePositive += inter;
        falsePositive += predicted.size() - inter;
        falseNegative += gold.size() - inter;
    }

    public void merge(ClauseStats other) {
        truePositive += other.truePositive;
        falsePositive += other.falsePositive;
        falseNegative += other.falseNegative;
        vacuousPairs += other.vacuousPairs;
    }

    public long getTruePositive() {
        return truePositive;
    }

    public long getFalsePositive() {
        return falsePositive;
    }

    public long getFalseNegative() {
        return falseNegative;
    }

    /** Pairs where both sides had nothing for this clause. */
    public int getVacuousPairs() {
        return vacuousPairs;
    }

    public ClauseScore toScore() {
        return ClauseScore.of(truePositive, falsePositive, falseNegative);
    }
}
