package space.ketterling.agriweather.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

/**
 * Tracks success/failure counts for calls into the persistence backend, per
 * operation.
 *
 * <p>
 * Uses a rolling 60-minute window to compute basic health status.
 * </p>
 */
public final class BackendCallMetrics {
    private static final int WINDOW_MINUTES = 60;

    private final Map<String, OperationBuckets> operations = new ConcurrentHashMap<>();
    private final LongSupplier nowMillis;

    public BackendCallMetrics() {
        this(System::currentTimeMillis);
    }

    /**
     * Test hook: supply the wall clock in epoch millis.
     */
    public BackendCallMetrics(LongSupplier nowMillis) {
        this.nowMillis = nowMillis;
    }

    /**
     * Records one call outcome for a named backend operation.
     */
    public void record(String operation, boolean success) {
        if (operation == null || operation.isBlank())
            return;
        operations.computeIfAbsent(operation, k -> new OperationBuckets()).record(nowMillis.getAsLong(), success);
    }

    /**
     * Returns a snapshot of call counts and failure rates by operation.
     */
    public Map<String, OperationSnapshot> snapshot() {
        long now = nowMillis.getAsLong();
        Map<String, OperationSnapshot> out = new TreeMap<>();
        for (var e : operations.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(now));
        }
        return out;
    }

    /**
     * Worst status across all operations ("no-data" when nothing was called).
     */
    public String overallStatus() {
        String worst = "no-data";
        for (OperationSnapshot s : snapshot().values()) {
            if (rank(s.status()) > rank(worst))
                worst = s.status();
        }
        return worst;
    }

    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    private static int rank(String status) {
        switch (status) {
            case "down":
                return 3;
            case "degraded":
                return 2;
            case "ok":
                return 1;
            default:
                return 0;
        }
    }

    /**
     * Summary metrics for a single backend operation.
     */
    public record OperationSnapshot(long callsLastHour, long failuresLastHour, double failurePct, String status) {
    }

    /**
     * Ring buffer of per-minute counts for an operation.
     */
    private static final class OperationBuckets {
        private final long[] total = new long[WINDOW_MINUTES];
        private final long[] fail = new long[WINDOW_MINUTES];
        private final long[] minute = new long[WINDOW_MINUTES];

        private synchronized void record(long nowMs, boolean success) {
            long nowMin = nowMs / 60000L;
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
            }
            total[idx] += 1L;
            if (!success) {
                fail[idx] += 1L;
            }
        }

        /**
         * Builds a snapshot by summing buckets from the last hour.
         */
        private synchronized OperationSnapshot snapshot(long nowMs) {
            long nowMin = nowMs / 60000L;
            long totalSum = 0L;
            long failSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                long bucketMin = minute[i];
                if (bucketMin == 0L)
                    continue;
                if ((nowMin - bucketMin) >= WINDOW_MINUTES)
                    continue;
                totalSum += total[i];
                failSum += fail[i];
            }
            double failurePct = totalSum == 0 ? 0.0 : (failSum * 100.0) / totalSum;
            String status;
            if (totalSum == 0) {
                status = "no-data";
            } else if (failurePct >= 50.0) {
                status = "down";
            } else if (failurePct >= 10.0) {
                status = "degraded";
            } else {
                status = "ok";
            }
            return new OperationSnapshot(totalSum, failSum, failurePct, status);
        }
    }
}
