package minikv.server;

import minikv.db.Database;
import minikv.utils.Log;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Background expiry. Every tick samples a batch of keys and keeps sampling while
 * a large share of the batch turned out to be expired.
 */
public class Janitor {
    static final int SAMPLE_SIZE = 20;
    static final int REPEAT_THRESHOLD = 5; // 25% of SAMPLE_SIZE
    static final int MAX_LOOPS = 10;
    private static final long SUMMARY_INTERVAL_MS = 30000;

    private final Database db;
    private final long intervalMs;
    private ScheduledExecutorService executor;

    private long lastSummary = System.currentTimeMillis();
    private long removedSinceSummary = 0;

    public Janitor(Database db, long intervalMs) {
        this.db = db;
        this.intervalMs = intervalMs;
    }

    public synchronized void start() {
        if (executor != null) return;
        executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Janitor");
            t.setDaemon(true);
            return t;
        });
        executor.scheduleAtFixedRate(this::tick, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
    }

    private void tick() {
        try {
            removedSinceSummary += runCycle();
            long now = System.currentTimeMillis();
            if (now - lastSummary > SUMMARY_INTERVAL_MS) {
                if (removedSinceSummary > 0) {
                    Log.info("[Janitor] Removed " + removedSinceSummary + " expired keys. Database size: " + db.size());
                }
                removedSinceSummary = 0;
                lastSummary = now;
            }
        } catch (RuntimeException e) {
            Log.error("[Janitor] Error: " + e.getMessage(), e);
        }
    }

    /**
     * One adaptive sweep.
     *
     * @return number of keys removed
     */
    public int runCycle() {
        int total = 0;
        for (int loop = 0; loop < MAX_LOOPS; loop++) {
            int expired = db.sweepExpired(SAMPLE_SIZE);
            total += expired;
            // If we didn't find many expired keys, stop early
            if (expired <= REPEAT_THRESHOLD) break;
        }
        return total;
    }

    public synchronized void stop() {
        if (executor == null) return;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                Log.warn("[Janitor] Did not stop within 1s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
    }
}
