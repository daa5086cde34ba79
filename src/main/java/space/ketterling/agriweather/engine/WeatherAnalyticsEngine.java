package space.ketterling.agriweather.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.agriweather.alert.AlertEvaluator;
import space.ketterling.agriweather.alert.EvaluationOutcome;
import space.ketterling.agriweather.analytics.CropProfileProvider;
import space.ketterling.agriweather.analytics.MetricSummary;
import space.ketterling.agriweather.analytics.MetricsEngine;
import space.ketterling.agriweather.cache.CacheStats;
import space.ketterling.agriweather.cache.CachedRepository;
import space.ketterling.agriweather.cache.Fetched;
import space.ketterling.agriweather.cache.SingleFlightCache;
import space.ketterling.agriweather.error.NotFoundException;
import space.ketterling.agriweather.error.WeatherEngineException;
import space.ketterling.agriweather.forecast.ForecastAggregator;
import space.ketterling.agriweather.geo.GeoIndex;
import space.ketterling.agriweather.geo.GeoMath;
import space.ketterling.agriweather.geo.NearbyLocation;
import space.ketterling.agriweather.metrics.BackendCallMetrics;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.CropProfile;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Location;
import space.ketterling.agriweather.model.Reading;

import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for request handlers and jobs. Resolves locations through the
 * geo index and delegates to the repository, metrics, forecast and alert
 * components it was built with.
 */
public final class WeatherAnalyticsEngine {
    private static final Logger log = LoggerFactory.getLogger(WeatherAnalyticsEngine.class);

    private static final String OP_METRICS = "metrics";

    private final GeoIndex geo;
    private final CachedRepository repository;
    private final MetricsEngine metrics;
    private final ForecastAggregator forecasts;
    private final AlertEvaluator alerts;
    private final CropProfileProvider crops;
    private final BackendCallMetrics backendMetrics;
    private final double defaultRadiusKm;
    private final int metricsLookbackDays;
    private final Clock clock;
    private final SingleFlightCache<DerivedSummary> summaries;

    public WeatherAnalyticsEngine(GeoIndex geo, CachedRepository repository, MetricsEngine metrics,
            ForecastAggregator forecasts, AlertEvaluator alerts, CropProfileProvider crops,
            BackendCallMetrics backendMetrics, double defaultRadiusKm, int metricsLookbackDays, Clock clock) {
        this.geo = geo;
        this.repository = repository;
        this.metrics = metrics;
        this.forecasts = forecasts;
        this.alerts = alerts;
        this.crops = crops;
        this.backendMetrics = backendMetrics;
        this.defaultRadiusKm = defaultRadiusKm;
        this.metricsLookbackDays = metricsLookbackDays;
        this.clock = clock;
        this.summaries = repository.newCache();
    }

    // ---- locations ----

    public List<NearbyLocation> nearby(double lat, double lon, Double radiusKm) {
        return geo.nearby(lat, lon, radiusKm == null ? defaultRadiusKm : radiusKm);
    }

    public Optional<NearbyLocation> nearest(double lat, double lon, Double radiusKm) {
        return geo.nearest(lat, lon, radiusKm == null ? defaultRadiusKm : radiusKm);
    }

    /**
     * Stores the location and (re)indexes it. Coordinates are validated
     * before anything is written.
     */
    public Location registerLocation(Location location) {
        GeoMath.requireValid(location.latitude(), location.longitude());
        repository.saveLocation(location);
        geo.register(location);
        return location;
    }

    /**
     * Indexed location, falling back to the store for ids not yet indexed.
     *
     * @throws NotFoundException when neither knows the id
     */
    public Location location(String locationId) {
        Optional<Location> indexed = geo.get(locationId);
        if (indexed.isPresent())
            return indexed.get();
        Location stored = repository.findLocation(locationId)
                .orElseThrow(() -> new NotFoundException("unknown location: " + locationId));
        geo.register(stored);
        return stored;
    }

    public int rebuildIndex() {
        return geo.rebuildFrom(repository::listLocations);
    }

    // ---- observations and forecasts ----

    public Fetched<Reading> current(String locationId) {
        location(locationId);
        return repository.getCurrent(locationId);
    }

    public Fetched<List<Reading>> history(String locationId, LocalDate from, LocalDate to) {
        if (from.isAfter(to))
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        location(locationId);
        return repository.getHistory(locationId, from, to);
    }

    /**
     * Aggregated forecast, one point per day.
     */
    public List<ForecastPoint> forecast(String locationId, int days) {
        if (days < 1)
            throw new IllegalArgumentException("days must be >= 1, got " + days);
        location(locationId);
        return forecasts.aggregate(locationId, days);
    }

    public int maxForecastDays() {
        return forecasts.maxHorizonDays();
    }

    public void recordReading(Reading reading) {
        location(reading.locationId());
        repository.recordReading(reading);
    }

    public void upsertForecast(List<ForecastPoint> points) {
        Set<String> locations = new LinkedHashSet<>();
        points.forEach(p -> locations.add(p.locationId()));
        locations.forEach(this::location);
        repository.upsertForecast(points);
    }

    // ---- metrics ----

    /**
     * Heat stress, soil moisture and GDD for a location. {@code from}/{@code to}
     * bound the GDD window and default to the last week ending today.
     *
     * @throws NotFoundException when the location or the crop is unknown
     */
    public Fetched<MetricSummary> metrics(String locationId, String cropId, LocalDate from, LocalDate to) {
        LocalDate end = to == null ? LocalDate.now(clock) : to;
        LocalDate start = from == null ? end.minusDays(metricsLookbackDays - 1L) : from;
        if (start.isAfter(end))
            throw new IllegalArgumentException("from " + start + " is after to " + end);
        CropProfile crop = crops.resolve(cropId);
        location(locationId);

        String window = crop.cropId() + ":" + start + ".." + end;
        Fetched<DerivedSummary> derived = repository.derive(summaries, OP_METRICS, locationId, window,
                repository.settings().metricsTtl(), () -> computeSummary(locationId, crop, start, end));
        return new Fetched<>(derived.value().summary(), derived.stale() || derived.value().fromStaleInputs(),
                derived.loadedAt());
    }

    private DerivedSummary computeSummary(String locationId, CropProfile crop, LocalDate from, LocalDate to) {
        boolean stale = false;
        Reading current = null;
        try {
            Fetched<Reading> f = repository.getCurrent(locationId);
            current = f.value();
            stale = f.stale();
        } catch (NotFoundException e) {
            log.debug("no current reading for {}", locationId);
        }
        List<Reading> history = List.of();
        try {
            Fetched<List<Reading>> f = repository.getHistory(locationId, from, to);
            history = f.value();
            stale |= f.stale();
        } catch (NotFoundException e) {
            log.debug("no history for {} between {} and {}", locationId, from, to);
        }
        return new DerivedSummary(metrics.summarize(locationId, current, history, from, to, crop), stale);
    }

    private record DerivedSummary(MetricSummary summary, boolean fromStaleInputs) {
    }

    // ---- alerts ----

    public Fetched<List<Alert>> activeAlerts(String locationId) {
        location(locationId);
        return repository.listActiveAlerts(locationId);
    }

    public EvaluationOutcome evaluate(String locationId, String cropId) {
        location(locationId);
        return alerts.evaluate(locationId, cropId);
    }

    public Alert resolve(String alertId) {
        return alerts.resolve(alertId);
    }

    /**
     * Evaluates every indexed location with the default crop. A failing
     * location is logged and skipped.
     *
     * @return number of locations evaluated without error
     */
    public int evaluateAll() {
        int ok = 0;
        for (Location l : geo.all()) {
            try {
                EvaluationOutcome out = alerts.evaluate(l.id());
                if (out.changedAnything()) {
                    log.info("Alerts for {}: {} created, {} refreshed, {} resolved", l.id(), out.created().size(),
                            out.refreshed().size(), out.resolved().size());
                }
                ok++;
            } catch (WeatherEngineException e) {
                log.warn("Alert evaluation failed for {}: {} {}", l.id(), e.code(), e.getMessage());
            }
        }
        return ok;
    }

    // ---- health ----

    public Map<String, BackendCallMetrics.OperationSnapshot> backendMetrics() {
        return backendMetrics.snapshot();
    }

    public String backendStatus() {
        return backendMetrics.overallStatus();
    }

    public CacheStats cacheStats() {
        return repository.cacheStats();
    }

    public int cachedEntries() {
        return repository.cachedEntries();
    }

    public int indexedLocations() {
        return geo.size();
    }
}
