package space.ketterling.agriweather.metrics;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BackendCallMetricsTest {
    private static final long MINUTE = 60_000L;

    private final AtomicLong now = new AtomicLong(1_750_000_000_000L);
    private final BackendCallMetrics metrics = new BackendCallMetrics(now::get);

    private void record(String op, int ok, int failed) {
        for (int i = 0; i < ok; i++)
            metrics.record(op, true);
        for (int i = 0; i < failed; i++)
            metrics.record(op, false);
    }

    @Test
    void statusFollowsFailureRate() {
        record("latestReading", 20, 0);
        record("readings", 9, 1);
        record("saveAlert", 1, 1);

        Map<String, BackendCallMetrics.OperationSnapshot> snap = metrics.snapshot();

        assertEquals("ok", snap.get("latestReading").status());
        assertEquals("degraded", snap.get("readings").status());
        assertEquals(10.0, snap.get("readings").failurePct(), 1e-9);
        assertEquals("down", snap.get("saveAlert").status());
        assertEquals("down", metrics.overallStatus());
    }

    @Test
    void callsOlderThanTheWindowDropOut() {
        record("readings", 0, 3);
        now.addAndGet(30 * MINUTE);
        record("readings", 7, 0);

        assertEquals(10, metrics.snapshot().get("readings").callsLastHour());
        assertEquals("degraded", metrics.overallStatus());

        now.addAndGet(31 * MINUTE);
        BackendCallMetrics.OperationSnapshot later = metrics.snapshot().get("readings");
        assertEquals(7, later.callsLastHour());
        assertEquals(0, later.failuresLastHour());
        assertEquals("ok", metrics.overallStatus());

        now.addAndGet(BackendCallMetrics.windowMinutes() * MINUTE);
        assertEquals("no-data", metrics.overallStatus());
    }

    @Test
    void nothingRecordedMeansNoData() {
        metrics.record(" ", false);
        metrics.record(null, false);

        assertTrue(metrics.snapshot().isEmpty());
        assertEquals("no-data", metrics.overallStatus());
    }
}
