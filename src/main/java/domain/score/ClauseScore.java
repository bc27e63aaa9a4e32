package domain.score;

import java.util.Locale;

/**
 * Precision / recall / F1 of one clause.
 *
 * <p>When {@code tp + fp + fn == 0} every metric is 1.0: nothing was expected and nothing
 * was produced. Otherwise a zero denominator gives 0.</p>
 */
public final class ClauseScore {

    private static final ClauseScore VACUOUS = new ClauseScore(0, 0, 0, 1.0, 1.0, 1.0);

    private final long truePositive;
    private final long falsePositive;
    private final long falseNegative;
    private final double precision;
    private final double recall;
    private final double f1;

    private ClauseScore(long tp, long fp, long fn, double precision, double recall, double f1) {
        this.truePositive = tp;
        this.falsePositive = fp;
        this.falseNegative = fn;
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
    }

    public static ClauseScore of(long tp, long fp, long fn) {
        if (tp + fp + fn == 0) return VACUOUS;
        double p = (tp + fp) == 0 ? 0.0 : (double) tp / (tp + fp);
        double r = (tp + fn) == 0 ? 0.0 : (double) tp / (tp + fn);
        double f = (p + r) == 0 ? 0.0 : 2 * p * r / (p + r);
        return new ClauseScore(tp, fp, fn, p, r, f);
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

    public double getPrecision() {
        return precision;
    }

    public double getRecall() {
        return recall;
    }

    public double getF1() {
        return f1;
    }

    public boolean isVacuous() {
        return truePositive + falsePositive + falseNegative == 0;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "P=%.4f R=%.4f F1=%.4f (tp=%d fp=%d fn=%d)",
                precision, recall, f1, truePositive, falsePositive, falseNegative);
    }
}
