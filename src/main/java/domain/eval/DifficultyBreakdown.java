package domain.eval;

/**
 * Metrics of the pairs sharing one difficulty label.
 */
public final class DifficultyBreakdown {

    private final int count;
    private final double share;
    private final double exactMatchAccuracy;
    private final double averageComponentF1;
    private final Double executionAccuracy;

    DifficultyBreakdown(int count, double share, double exactMatchAccuracy,
                        double averageComponentF1, Double executionAccuracy) {
        this.count = count;
        this.share = share;
        this.exactMatchAccuracy = exactMatchAccuracy;
        this.averageComponentF1 = averageComponentF1;
        this.executionAccuracy = executionAccuracy;
    }

    public int getCount() {
        return count;
    }

    /** Fraction of the batch, 0..1 */
    public double getShare() {
        return share;
    }

    public double getExactMatchAccuracy() {
        return exactMatchAccuracy;
    }

    public double getAverageComponentF1() {
        return averageComponentF1;
    }

    /** null when execution did not run */
    public Double getExecutionAccuracy() {
        return executionAccuracy;
    }
}
