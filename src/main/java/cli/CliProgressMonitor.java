package cli;

import domain.eval.BatchProgressListener;
import domain.eval.PairResult;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;
import java.lang.management.MemoryUsage;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Progress / heartbeat logger for long-running evaluation runs.
 */
public final class CliProgressMonitor implements BatchProgressListener {

    private static final Logger log = LoggerFactory.getLogger(CliProgressMonitor.class);

    private final int logEvery;
    private final long loopStartNs;
    private final AtomicInteger done = new AtomicInteger(0);
    private final AtomicInteger exact = new AtomicInteger(0);
    private final AtomicInteger warned = new AtomicInteger(0);
    private volatile String lastKey = "";

    public CliProgressMonitor(int logEvery) {
        this.logEvery = Math.max(1, logEvery);
        this.loopStartNs = System.nanoTime();
    }

    @Override
    public void onPairDone(int doneCount, int total, PairResult last) {
        done.set(doneCount);
        if (last.isExactMatch()) exact.incrementAndGet();
        if (!last.getWarnings().isEmpty()) warned.incrementAndGet();
        lastKey = "#" + last.getPair().getIndex() + " " + last.getPair().getDbId();

        if (doneCount % logEvery == 0 || doneCount == total) {
            logProgress(doneCount, total);
        }
    }

    public void startHeartbeat(int total) {
        Thread t = new Thread(() -> {
            try {
                while (true) {
                    Thread.sleep(30_000L);
                    log.info("[HEARTBEAT] running... {}/{} last={}", done.get(), total, lastKey);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "sql-eval-heartbeat");
        t.setDaemon(true);
        t.start();
    }

    private void logProgress(int doneCount, int total) {
        long elapsed = (System.nanoTime() - loopStartNs) / 1_000_000L;

        MemoryMXBean mem = ManagementFactory.getMemoryMXBean();
        MemoryUsage heap = mem.getHeapMemoryUsage();
        long usedMb = heap.getUsed() / (1024 * 1024);
        long maxMb = heap.getMax() / (1024 * 1024);

        log.info("[PROGRESS] {}/{} exact={} warned={} elapsed={}ms heap={}/{}MB last={}",
                doneCount, total, exact.get(), warned.get(), elapsed, usedMb, maxMb, lastKey);
    }
}
