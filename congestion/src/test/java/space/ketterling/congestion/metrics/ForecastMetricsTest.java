package space.ketterling.congestion.metrics;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ForecastMetricsTest {
    private static final long T0 = 1_700_000_000_000L;
    private static final long MINUTE = 60_000L;

    @Test
    void snapshot_shouldCountCallsAndFailuresWithinWindow() {
        String op = "test-window";
        for (int i = 0; i < 9; i++)
            ForecastMetrics.record(op, true, T0 + i * MINUTE);
        ForecastMetrics.record(op, false, T0 + 10 * MINUTE);

        ForecastMetrics.OperationSnapshot s = ForecastMetrics.snapshot(T0 + 10 * MINUTE).get(op);
        assertEquals(10, s.callsLastHour());
        assertEquals(1, s.failuresLastHour());
        assertEquals(10.0, s.failurePct(), 1e-9);
        assertEquals("degraded", s.status());
    }

    @Test
    void snapshot_shouldDropBucketsOlderThanAnHour() {
        String op = "test-expiry";
        ForecastMetrics.record(op, false, T0);
        ForecastMetrics.record(op, true, T0 + 30 * MINUTE);

        assertEquals("down", ForecastMetrics.snapshot(T0 + 30 * MINUTE).get(op).status());
        ForecastMetrics.OperationSnapshot later = ForecastMetrics.snapshot(T0 + 61 * MINUTE).get(op);
        assertEquals(1, later.callsLastHour());
        assertEquals("ok", later.status());
        assertEquals("no-data", ForecastMetrics.snapshot(T0 + 200 * MINUTE).get(op).status());
    }

    @Test
    void record_shouldIgnoreBlankOperation() {
        ForecastMetrics.record(" ", true, T0);
        assertFalse(ForecastMetrics.snapshot(T0).containsKey(" "));
    }
}
