package domain.exec;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Batch execution counters.
 *
 * <p>Execution accuracy and the row-level averages only count pairs where both queries ran;
 * a pair with a failed side is visible in the success and error counts instead.
 * Not thread-safe: feed it from one thread in pair order.</p>
 */
public final class ExecutionStats {

    /** Counters for one side (predicted or gold). */
    public static final class Side {
        private int total;
        private int successful;
        private long elapsedSum;
        private long elapsedMin = Long.MAX_VALUE;
        private long elapsedMax;
        private final Map<ExecutionErrorType, Integer> errors = new EnumMap<>(ExecutionErrorType.class);

        void record(ExecutionResult r) {
            total++;
            if (r.isSuccess()) {
                successful++;
                long t = r.getElapsedMillis();
                elapsedSum += t;
                elapsedMin = Math.min(elapsedMin, t);
                elapsedMax = Math.max(elapsedMax, t);
            } else {
                errors.merge(r.getErrorType(), 1, Integer::sum);
            }
        }

        public int getTotal() {
            return total;
        }

        public int getSuccessful() {
            return successful;
        }

        public int getFailed() {
            return total - successful;
        }

        public double getSuccessRate() {
            return total == 0 ? 0.0 : (double) successful / total;
        }

        public double getAverageElapsedMillis() {
            return successful == 0 ? 0.0 : (double) elapsedSum / successful;
        }

        public long getMinElapsedMillis() {
            return successful == 0 ? 0L : elapsedMin;
        }

        public long getMaxElapsedMillis() {
            return elapsedMax;
        }

        public Map<ExecutionErrorType, Integer> getErrors() {
            return Collections.unmodifiableMap(errors);
        }
    }

    private final Side predicted = new Side();
    private final Side gold = new Side();
    private int bothSuccessful;
    private int exactMatches;
    private double precisionSum;
    private double recallSum;
    private double f1Sum;

    public void record(ExecutionResult predictedResult, ExecutionResult goldResult, ResultComparison comparison) {
        predicted.record(predictedResult);
        gold.record(goldResult);
        if (!predictedResult.isSuccess() || !goldResult.isSuccess()) return;

        bothSuccessful++;
        if (comparison.isExactMatch()) exactMatches++;
        precisionSum += comparison.getPrecision();
        recallSum += comparison.getRecall();
        f1Sum += comparison.getF1();
    }

    public Side getPredicted() {
        return predicted;
    }

    public Side getGold() {
        return gold;
    }

    public int getBothSuccessful() {
        return bothSuccessful;
    }

    public int getExactMatches() {
        return exactMatches;
    }

    public double getExecutionAccuracy() {
        return bothSuccessful == 0 ? 0.0 : (double) exactMatches / bothSuccessful;
    }

    public double getAveragePrecision() {
        return bothSuccessful == 0 ? 0.0 : precisionSum / bothSuccessful;
    }

    public double getAverageRecall() {
        return bothSuccessful == 0 ? 0.0 : recallSum / bothSuccessful;
    }

    public double getAverageF1() {
        return bothSuccessful == 0 ? 0.0 : f1Sum / bothSuccessful;
    }
}
