package space.ketterling.congestion.metrics;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Success/failure counts for engine operations over a rolling 60-minute
 * window.
 *
 * <p>
 * Operations are free-form names; the engine records {@link #FORECAST},
 * {@link #HORIZON}, {@link #CACHE}, {@link #RETRAIN} and {@link #SINK}.
 * </p>
 */
public final class ForecastMetrics {
    public static final String FORECAST = "forecast";
    public static final String HORIZON = "horizon";
    public static final String CACHE = "cache";
    public static final String RETRAIN = "retrain";
    public static final String SINK = "sink";

    private static final int WINDOW_MINUTES = 60;
    private static final Map<String, OperationBuckets> OPERATIONS = new ConcurrentHashMap<>();

    /**
     * Utility class; no instances.
     */
    private ForecastMetrics() {
    }

    /**
     * Records one call outcome for a named operation.
     */
    public static void record(String operation, boolean success) {
        record(operation, success, System.currentTimeMillis());
    }

    /**
     * Records an outcome at an explicit wall-clock time. Blank names are ignored.
     */
    static void record(String operation, boolean success, long nowMillis) {
        if (operation == null || operation.isBlank())
            return;
        OPERATIONS.computeIfAbsent(operation, k -> new OperationBuckets()).record(success, nowMillis / 60000L);
    }

    /**
     * Counts per operation, sorted by name.
     */
    public static Map<String, OperationSnapshot> snapshot() {
        return snapshot(System.currentTimeMillis());
    }

    /**
     * Builds the snapshot as of {@code nowMillis}.
     */
    static Map<String, OperationSnapshot> snapshot(long nowMillis) {
        Map<String, OperationSnapshot> out = new TreeMap<>();
        for (var e : OPERATIONS.entrySet()) {
            out.put(e.getKey(), e.getValue().snapshot(nowMillis / 60000L));
        }
        return out;
    }

    /**
     * Returns the rolling window size (minutes) used for metrics.
     */
    public static int windowMinutes() {
        return WINDOW_MINUTES;
    }

    /**
     * Summary metrics for a single operation.
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

        /**
         * Records success/failure in the current minute bucket.
         */
        private synchronized void record(boolean success, long nowMin) {
            int idx = (int) (nowMin % WINDOW_MINUTES);
            if (minute[idx] != nowMin) {
                minute[idx] = nowMin;
                total[idx] = 0L;
                fail[idx] = 0L;
            }
            total[idx] += 1L;
            if (!success)
                fail[idx] += 1L;
        }

        /**
         * Builds a snapshot by summing buckets from the last hour.
         */
        private synchronized OperationSnapshot snapshot(long nowMin) {
            long totalSum = 0L;
            long failSum = 0L;
            for (int i = 0; i < WINDOW_MINUTES; i++) {
                long bucketMin = minute[i];
                if (bucketMin == 0L || (nowMin - bucketMin) >= WINDOW_MINUTES)
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
