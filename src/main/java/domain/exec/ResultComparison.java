package domain.exec;

/**
 * Row-set agreement between a predicted and a gold execution.
 */
public final class ResultComparison {

    static final ResultComparison VACUOUS = new ResultComparison(true, 1.0, 1.0, 1.0);
    static final ResultComparison NONE = new ResultComparison(false, 0.0, 0.0, 0.0);

    private final boolean exactMatch;
    private final double precision;
    private final double recall;
    private final double f1;

    public ResultComparison(boolean exactMatch, double precision, double recall, double f1) {
        this.exactMatch = exactMatch;
        this.precision = precision;
        this.recall = recall;
        this.f1 = f1;
    }

    public boolean isExactMatch() {
        return exactMatch;
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

    @Override
    public String toString() {
        return "ResultComparison{exact=" + exactMatch + ", p=" + precision + ", r=" + recall + ", f1=" + f1 + "}";
    }
}
