package space.ketterling.agriweather.jobs;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import space.ketterling.agriweather.config.AppConfig;
import space.ketterling.agriweather.engine.EngineWiring;
import space.ketterling.agriweather.model.Location;
import space.ketterling.agriweather.support.InMemoryWeatherStore;
import space.ketterling.agriweather.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EvaluationSchedulerTest {
    private final InMemoryWeatherStore store = new InMemoryWeatherStore();
    private final EngineWiring wiring = EngineWiring.build(AppConfig.fromProperties(new Properties()), store,
            new MutableClock(Instant.parse("2025-06-10T06:30:00Z"), ZoneId.of("Asia/Kolkata")));

    @AfterEach
    void tearDown() {
        wiring.close();
    }

    @Test
    void failingJobIsLoggedNotPropagated() {
        EvaluationScheduler scheduler = new EvaluationScheduler(Duration.ofHours(1), Duration.ofHours(1),
                wiring.engine());
        AtomicReference<String> seen = new AtomicReference<>();

        Runnable job = scheduler.safe("alertEvaluation", () -> {
            seen.set(MDC.get("job"));
            throw new IllegalStateException("boom");
        });

        assertDoesNotThrow(job::run);
        assertEquals("alertEvaluation", seen.get());
        assertNull(MDC.get("job"));
    }

    @Test
    void locationRefreshRunsOnSchedule() throws Exception {
        store.saveLocation(new Location("panipat", "Panipat", "Panipat", "Haryana", 29.3909, 76.9635, null));
        EvaluationScheduler scheduler = new EvaluationScheduler(Duration.ofHours(1), Duration.ofMillis(100),
                wiring.engine());
        scheduler.start();
        try {
            long deadline = System.currentTimeMillis() + 5_000;
            while (wiring.engine().indexedLocations() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(20);
            }
            assertEquals(1, wiring.engine().indexedLocations());
            assertTrue(store.calls("listLocations") >= 1);
        } finally {
            scheduler.stop();
        }
    }

    @Test
    void evaluationPassSurvivesBackendOutage() {
        wiring.engine().registerLocation(new Location("panipat", "Panipat", "Panipat", "Haryana", 29.3909,
                76.9635, null));
        store.setFailing(true);
        EvaluationScheduler scheduler = new EvaluationScheduler(Duration.ofHours(1), Duration.ofHours(1),
                wiring.engine());

        assertDoesNotThrow(scheduler::evaluateAll);
    }
}
