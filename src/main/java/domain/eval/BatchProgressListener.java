package domain.eval;

/**
 * Notified after each pair, in input order.
 */
public interface BatchProgressListener {

    void onPairDone(int done, int total, PairResult last);

    static BatchProgressListener none() {
        return (done, total, last) -> { };
    }
}
