package domain.eval;

import domain.clause.SqlClause;
import domain.model.InvalidEvaluationInputException;
import domain.schema.SchemaCatalog;
import domain.score.ClauseScore;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a batch of pairs, optionally on a fixed thread pool. Pairs are independent;
 * results always come back in input order.
 */
public final class BatchEvaluator {

    private static final Logger log = LoggerFactory.getLogger(BatchEvaluator.class);

    private final PairEvaluator evaluator;
    private final int threads;
    private final BatchProgressListener listener;

    public BatchEvaluator(PairEvaluator evaluator, int threads, BatchProgressListener listener) {
        this.evaluator = evaluator;
        this.threads = Math.max(1, threads);
        this.listener = listener == null ? BatchProgressListener.none() : listener;
    }

    /**
     * Builds pairs from parallel lists.
     *
     * @throws InvalidEvaluationInputException when the lists differ in length
     */
    public static List<EvaluationPair> pairs(List<String> predicted, List<String> gold, List<String> dbIds) {
        if (predicted == null || gold == null || dbIds == null) {
            throw new InvalidEvaluationInputException("predicted, gold and db_id lists are required");
        }
        if (predicted.size() != gold.size() || gold.size() != dbIds.size()) {
            throw new InvalidEvaluationInputException("batch length mismatch: predicted=" + predicted.size()
                    + ", gold=" + gold.size() + ", db_ids=" + dbIds.size());
        }
        List<EvaluationPair> out = new ArrayList<>(predicted.size());
        for (int i = 0; i < predicted.size(); i++) {
            out.add(EvaluationPair.of(i, predicted.get(i), gold.get(i), dbIds.get(i)));
        }
        return out;
    }

    /**
     * Per-clause F1 over a batch, without execution.
     */
    public static Map<SqlClause, Double> scoreComponents(List<String> predicted,
                                                         List<String> gold,
                                                         List<String> dbIds,
                                                         SchemaCatalog catalog) {
        List<EvaluationPair> pairs = pairs(predicted, gold, dbIds);
        BatchEvaluator batch = new BatchEvaluator(
                new PairEvaluator(new QueryAnalyzer(catalog), null, 0), 1, null);
        EvaluationSummary summary = EvaluationSummary.of(batch.evaluate(pairs));

        Map<SqlClause, Double> out = new EnumMap<>(SqlClause.class);
        for (Map.Entry<SqlClause, ClauseScore> e : summary.getClauseScores().entrySet()) {
            out.put(e.getKey(), e.getValue().getF1());
        }
        return out;
    }

    public List<PairResult> evaluate(List<EvaluationPair> pairs) {
        int total = pairs.size();
        List<PairResult> out = new ArrayList<>(total);
        if (total == 0) return out;

        if (threads == 1 || total == 1) {
            for (EvaluationPair p : pairs) {
                PairResult r = evaluator.evaluate(p);
                out.add(r);
                listener.onPairDone(out.size(), total, r);
            }
            return out;
        }

        log.debug("[EXEC] evaluating {} pairs on {} threads", total, threads);
        AtomicInteger seq = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(threads, r -> {
            Thread t = new Thread(r, "sql-eval-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try {
            List<Future<PairResult>> futures = new ArrayList<>(total);
            for (EvaluationPair p : pairs) {
                futures.add(pool.submit(() -> evaluator.evaluate(p)));
            }
            for (Future<PairResult> f : futures) {
                PairResult r = await(f);
                out.add(r);
                listener.onPairDone(out.size(), total, r);
            }
            return out;
        } finally {
            pool.shutdownNow();
        }
    }

    private static PairResult await(Future<PairResult> f) {
        try {
            return f.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("batch evaluation interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new IllegalStateException("pair evaluation failed", cause);
        }
    }
}
