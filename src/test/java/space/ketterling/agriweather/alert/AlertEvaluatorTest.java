package space.ketterling.agriweather.alert;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.agriweather.analytics.ConfiguredCropProfiles;
import space.ketterling.agriweather.analytics.MetricsEngine;
import space.ketterling.agriweather.cache.CachedRepository;
import space.ketterling.agriweather.config.AlertThresholds;
import space.ketterling.agriweather.config.CacheSettings;
import space.ketterling.agriweather.config.ForecastSettings;
import space.ketterling.agriweather.error.NotFoundException;
import space.ketterling.agriweather.forecast.ForecastAggregator;
import space.ketterling.agriweather.forecast.StoredForecastSource;
import space.ketterling.agriweather.metrics.BackendCallMetrics;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.AlertSeverity;
import space.ketterling.agriweather.model.AlertState;
import space.ketterling.agriweather.model.CropProfile;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Measurements;
import space.ketterling.agriweather.model.Reading;
import space.ketterling.agriweather.support.InMemoryWeatherStore;
import space.ketterling.agriweather.support.MutableClock;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlertEvaluatorTest {
    private static final ZoneId IST = ZoneId.of("Asia/Kolkata");
    // 12:00 IST on 2025-06-10
    private static final Instant NOON = Instant.parse("2025-06-10T06:30:00Z");
    private static final LocalDate TODAY = LocalDate.of(2025, 6, 10);
    private static final String PANIPAT = "panipat";

    private final MutableClock clock = new MutableClock(NOON, IST);
    private final InMemoryWeatherStore store = new InMemoryWeatherStore();
    private CachedRepository repository;
    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        repository = new CachedRepository(store, CacheSettings.defaults(), new BackendCallMetrics(clock::millis),
                clock);
        MetricsEngine metrics = new MetricsEngine(clock);
        ForecastAggregator forecasts = new ForecastAggregator(List.of(new StoredForecastSource(repository)),
                ForecastSettings.defaults(), clock);
        ConfiguredCropProfiles crops = new ConfiguredCropProfiles(new CropProfile(CropProfile.GENERIC, 10, 30, 70),
                List.of(new CropProfile("TOMATO", 10, 15, 70)));
        AlertThresholds thresholds = AlertThresholds.defaults();
        evaluator = new AlertEvaluator(repository, forecasts, crops, AlertRules.standard(thresholds, metrics),
                thresholds, clock);
    }

    @AfterEach
    void tearDown() {
        repository.close();
    }

    /**
     * Mild weather that triggers nothing except what soil moisture implies.
     */
    private void record(Instant at, Double soilPct) {
        repository.recordReading(new Reading(PANIPAT, at,
                Measurements.EMPTY.withTemperature(28.0).withHumidity(50.0).withSoil(null, soilPct), "test"));
    }

    private void record(Instant at, double tempC, double humidityPct) {
        repository.recordReading(new Reading(PANIPAT, at,
                Measurements.EMPTY.withTemperature(tempC).withHumidity(humidityPct), "test"));
    }

    private void forecast(LocalDate day, Instant issued, Measurements m) {
        repository.upsertForecast(List.of(new ForecastPoint(PANIPAT, day, "imd", issued, m, 0.8)));
    }

    private void dryDays(int days, double pct) {
        for (int i = days - 1; i >= 0; i--) {
            record(NOON.minus(Duration.ofDays(i)), pct);
        }
    }

    private List<Alert> active() {
        return store.allAlerts().stream().filter(Alert::isActive).collect(Collectors.toList());
    }

    @Test
    void irrigationAdvisoryOpensAfterDryRunAndResolvesWhenSoilRecovers() {
        dryDays(5, 12.0);

        EvaluationOutcome first = evaluator.evaluate(PANIPAT, "TOMATO");

        assertEquals(1, first.created().size());
        Alert opened = first.created().get(0);
        assertEquals(AlertCategory.IRRIGATION_ADVISORY, opened.category());
        assertEquals(AlertSeverity.MEDIUM, opened.severity());
        assertTrue(opened.condition().contains("5 consecutive days"), opened.condition());
        assertEquals(NOON, opened.createdAt());

        clock.advance(Duration.ofHours(2));
        record(clock.instant(), 20.0);
        EvaluationOutcome second = evaluator.evaluate(PANIPAT, "TOMATO");

        assertEquals(1, second.resolved().size());
        Alert done = second.resolved().get(0);
        assertEquals(opened.id(), done.id());
        assertEquals(AlertState.RESOLVED, done.state());
        assertEquals(clock.instant(), done.resolvedAt());
        assertEquals(NOON, done.createdAt());
        assertTrue(active().isEmpty());
    }

    @Test
    void repeatedEvaluationDoesNotDuplicate() {
        dryDays(5, 12.0);

        evaluator.evaluate(PANIPAT, "TOMATO");
        EvaluationOutcome again = evaluator.evaluate(PANIPAT, "TOMATO");

        assertFalse(again.changedAnything());
        assertEquals(1, active().size());
    }

    @Test
    void worseningConditionRefreshesTheSameAlert() {
        dryDays(5, 12.0);
        Alert opened = evaluator.evaluate(PANIPAT, "TOMATO").created().get(0);

        clock.advance(Duration.ofDays(1));
        record(clock.instant(), 11.0);
        EvaluationOutcome out = evaluator.evaluate(PANIPAT, "TOMATO");

        assertTrue(out.created().isEmpty());
        assertEquals(1, out.refreshed().size());
        Alert refreshed = out.refreshed().get(0);
        assertEquals(opened.id(), refreshed.id());
        assertEquals(AlertSeverity.HIGH, refreshed.severity());
        assertEquals(opened.createdAt(), refreshed.createdAt());
        assertEquals(clock.instant(), refreshed.updatedAt());
        assertEquals(1, active().size());
    }

    @Test
    void shortDryRunDoesNotTrigger() {
        record(NOON.minus(Duration.ofDays(2)), 40.0);
        dryDays(2, 12.0);

        EvaluationOutcome out = evaluator.evaluate(PANIPAT, "TOMATO");

        assertTrue(out.created().isEmpty());
    }

    @Test
    void cropThresholdsDecideWhatIsDry() {
        dryDays(4, 20.0);

        assertTrue(evaluator.evaluate(PANIPAT, "TOMATO").created().isEmpty());
        // generic profile treats anything under 30% as dry
        assertEquals(AlertCategory.IRRIGATION_ADVISORY, evaluator.evaluate(PANIPAT, null).created().get(0)
                .category());
    }

    @Test
    void concurrentEvaluationsOpenOneAlertPerCategory() throws Exception {
        dryDays(5, 12.0);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            CountDownLatch start = new CountDownLatch(1);
            List<Future<EvaluationOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return evaluator.evaluate(PANIPAT, "TOMATO");
                }));
            }
            start.countDown();
            int created = 0;
            for (Future<EvaluationOutcome> f : futures) {
                created += f.get(20, TimeUnit.SECONDS).created().size();
            }
            assertEquals(1, created);
            assertEquals(1, active().size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void manualResolveIsIdempotent() {
        dryDays(5, 12.0);
        Alert opened = evaluator.evaluate(PANIPAT, "TOMATO").created().get(0);

        clock.advance(Duration.ofMinutes(30));
        Alert first = evaluator.resolve(opened.id());
        clock.advance(Duration.ofMinutes(30));
        Alert second = evaluator.resolve(opened.id());

        assertEquals(AlertState.RESOLVED, first.state());
        assertEquals(first.resolvedAt(), second.resolvedAt());
        assertEquals(NOON.plus(Duration.ofMinutes(30)), second.resolvedAt());
    }

    @Test
    void resolvedAlertCanReopenAsANewAlert() {
        dryDays(5, 12.0);
        Alert opened = evaluator.evaluate(PANIPAT, "TOMATO").created().get(0);
        evaluator.resolve(opened.id());

        clock.advance(Duration.ofMinutes(5));
        Alert reopened = evaluator.evaluate(PANIPAT, "TOMATO").created().get(0);

        assertFalse(opened.id().equals(reopened.id()));
        assertEquals(1, active().size());
        assertEquals(2, store.allAlerts().size());
    }

    @Test
    void unknownAlertOrCropIsNotFound() {
        assertThrows(NotFoundException.class, () -> evaluator.resolve("no-such-alert"));
        assertThrows(NotFoundException.class, () -> evaluator.evaluate(PANIPAT, "MANGO"));
    }

    @Test
    void heavyForecastRainRaisesFloodRiskAndEscalates() {
        forecast(TODAY.plusDays(1), NOON.minus(Duration.ofHours(2)), Measurements.EMPTY.withRainfall(60.0));

        EvaluationOutcome out = evaluator.evaluate(PANIPAT, null);

        assertEquals(1, out.created().size());
        Alert flood = out.created().get(0);
        assertEquals(AlertCategory.FLOOD_RISK, flood.category());
        assertEquals(AlertSeverity.HIGH, flood.severity());

        forecast(TODAY.plusDays(1), NOON, Measurements.EMPTY.withRainfall(120.0));
        EvaluationOutcome escalated = evaluator.evaluate(PANIPAT, null);

        assertEquals(flood.id(), escalated.refreshed().get(0).id());
        assertEquals(AlertSeverity.EXTREME, escalated.refreshed().get(0).severity());
    }

    @Test
    void rainBeyondTheNext24HoursIsIgnored() {
        forecast(TODAY.plusDays(1), NOON, Measurements.EMPTY.withRainfall(10.0));
        forecast(TODAY.plusDays(3), NOON, Measurements.EMPTY.withRainfall(200.0));

        assertFalse(evaluator.evaluate(PANIPAT, null).changedAnything());
    }

    @Test
    void rulesApplyInPriorityOrder() {
        record(NOON, 40.0, 85.0);

        List<AlertCategory> categories = evaluator.evaluate(PANIPAT, null).created().stream()
                .map(Alert::category)
                .collect(Collectors.toList());

        assertEquals(List.of(AlertCategory.HEAT_ADVISORY, AlertCategory.DISEASE_RISK), categories);
    }

    @Test
    void extremeHeatIsAnExtremeAdvisory() {
        record(NOON, 40.0, 60.0);

        Alert heat = evaluator.evaluate(PANIPAT, null).created().get(0);

        assertEquals(AlertCategory.HEAT_ADVISORY, heat.category());
        assertEquals(AlertSeverity.EXTREME, heat.severity());
        assertEquals(AlertCategory.HEAT_ADVISORY.recommendedAction(), heat.recommendedAction());
    }

    @Test
    void frostNowIsHighAndForecastFrostIsMedium() {
        record(NOON, 1.0, 50.0);
        Alert now = evaluator.evaluate(PANIPAT, null).created().get(0);
        assertEquals(AlertCategory.FROST_WARNING, now.category());
        assertEquals(AlertSeverity.HIGH, now.severity());

        clock.advance(Duration.ofHours(1));
        record(clock.instant(), 10.0, 50.0);
        forecast(TODAY.plusDays(1), clock.instant(), Measurements.EMPTY.withTemperature(0.5));
        EvaluationOutcome out = evaluator.evaluate(PANIPAT, null);

        assertEquals(AlertSeverity.MEDIUM, out.refreshed().get(0).severity());
        assertEquals(now.id(), out.refreshed().get(0).id());
    }

    @Test
    void warmHumidWeatherRaisesDiseaseRisk() {
        record(NOON, 25.0, 85.0);

        EvaluationOutcome out = evaluator.evaluate(PANIPAT, null);

        assertEquals(1, out.created().size());
        assertEquals(AlertCategory.DISEASE_RISK, out.created().get(0).category());
        assertEquals(AlertSeverity.MEDIUM, out.created().get(0).severity());
    }

    @Test
    void missingInputsLeaveActiveAlertsUntouched() {
        dryDays(5, 12.0);
        Alert opened = evaluator.evaluate(PANIPAT, "TOMATO").created().get(0);

        clock.advance(Duration.ofHours(1));
        repository.recordReading(new Reading(PANIPAT, clock.instant(),
                Measurements.EMPTY.withTemperature(28.0).withHumidity(50.0), "test"));
        EvaluationOutcome out = evaluator.evaluate(PANIPAT, "TOMATO");

        assertTrue(out.resolved().isEmpty());
        Alert still = store.allAlerts().get(0);
        assertSame(AlertState.ACTIVE, still.state());
        assertEquals(opened.id(), still.id());
        assertNull(still.resolvedAt());
    }

    @Test
    void dayWithoutSoilDataDoesNotResolveADryAdvisory() {
        dryDays(5, 12.0);
        Alert opened = evaluator.evaluate(PANIPAT, "TOMATO").created().get(0);

        // nothing recorded on June 11
        clock.advance(Duration.ofDays(2));
        record(clock.instant(), 12.0);
        EvaluationOutcome out = evaluator.evaluate(PANIPAT, "TOMATO");

        assertTrue(out.resolved().isEmpty());
        assertTrue(out.refreshed().isEmpty());
        assertEquals(1, active().size());
        assertEquals(opened.id(), active().get(0).id());

        clock.advance(Duration.ofHours(1));
        record(clock.instant(), 20.0);
        assertEquals(opened.id(), evaluator.evaluate(PANIPAT, "TOMATO").resolved().get(0).id());
    }

    @Test
    void dataGapDoesNotOpenAnAdvisory() {
        record(NOON.minus(Duration.ofDays(4)), 12.0);
        record(NOON.minus(Duration.ofDays(3)), 12.0);
        record(NOON.minus(Duration.ofDays(1)), 12.0);
        record(NOON, 12.0);

        assertTrue(evaluator.evaluate(PANIPAT, "TOMATO").created().isEmpty());
        assertTrue(active().isEmpty());
    }

    @Test
    void locationWithoutAnyDataChangesNothing() {
        EvaluationOutcome out = evaluator.evaluate("karnal");

        assertNotNull(out);
        assertFalse(out.changedAnything());
    }
}
