package space.ketterling.agriweather.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.agriweather.config.CacheSettings;
import space.ketterling.agriweather.db.StoreException;
import space.ketterling.agriweather.db.WeatherStore;
import space.ketterling.agriweather.error.BackendUnavailableException;
import space.ketterling.agriweather.error.NotFoundException;
import space.ketterling.agriweather.error.RepositoryTimeoutException;
import space.ketterling.agriweather.metrics.BackendCallMetrics;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Location;
import space.ketterling.agriweather.model.Reading;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Read-through cache in front of a {@link WeatherStore}.
 *
 * <p>
 * Reads are served from {@link SingleFlightCache} with a TTL per data kind;
 * concurrent misses for the same key share one backend call. Every write
 * invalidates the written location before it returns, so a caller always
 * reads its own writes. Each call takes a deadline; the overloads without one
 * use {@link CacheSettings#repositoryTimeout()}.
 * </p>
 */
public final class CachedRepository implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CachedRepository.class);

    static final String OP_CURRENT = "current";
    static final String OP_HISTORY = "history";
    static final String OP_FORECAST = "forecast";
    static final String OP_ALERTS = "alerts";

    private final WeatherStore store;
    private final CacheSettings settings;
    private final BackendCallMetrics metrics;
    private final Clock clock;
    private final ExecutorService loaders;
    private final ExecutorService derivers;
    private final SingleFlightCache<Reading> currentCache;
    private final SingleFlightCache<List<Reading>> historyCache;
    private final SingleFlightCache<List<ForecastPoint>> forecastCache;
    private final SingleFlightCache<List<Alert>> alertCache;
    // every cache above plus the derived ones, for invalidation and stats
    private final List<SingleFlightCache<?>> caches = new CopyOnWriteArrayList<>();

    public CachedRepository(WeatherStore store, CacheSettings settings, BackendCallMetrics metrics, Clock clock) {
        this.store = store;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.loaders = Executors.newFixedThreadPool(settings.loaderThreads(), daemonThreads("cache-loader-"));
        // derived values call back into the cache, so they must not share the loader pool
        this.derivers = Executors.newFixedThreadPool(settings.loaderThreads(), daemonThreads("cache-derive-"));
        this.currentCache = newCache();
        this.historyCache = newCache();
        this.forecastCache = newCache();
        this.alertCache = newCache();
    }

    /**
     * A cache for values derived from repository data. Writes invalidate it
     * together with the data it was derived from.
     */
    public <T> SingleFlightCache<T> newCache() {
        SingleFlightCache<T> cache = new SingleFlightCache<>(clock, settings.degradedAvailabilityOnBackendFailure());
        caches.add(cache);
        return cache;
    }

    public CacheSettings settings() {
        return settings;
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    public CacheStats cacheStats() {
        CacheStats total = CacheStats.EMPTY;
        for (SingleFlightCache<?> cache : caches)
            total = total.plus(cache.stats());
        return total;
    }

    public int cachedEntries() {
        int n = 0;
        for (SingleFlightCache<?> cache : caches)
            n += cache.size();
        return n;
    }

    // ---- reads ----

    /**
     * Most recent reading for a location.
     *
     * @throws NotFoundException when the location has no readings
     */
    public Fetched<Reading> getCurrent(String locationId) {
        return getCurrent(locationId, settings.repositoryTimeout());
    }

    public Fetched<Reading> getCurrent(String locationId, Duration timeout) {
        return currentCache.get(CacheKey.of(OP_CURRENT, locationId), settings.currentTtl(), timeout, loaders,
                () -> load("latestReading", () -> store.latestReading(locationId))
                        .orElseThrow(() -> new NotFoundException("no readings for location " + locationId)));
    }

    /**
     * Readings whose local date (in the clock zone) lies in {@code [from, to]},
     * oldest first.
     *
     * @throws NotFoundException when nothing falls in the range
     */
    public Fetched<List<Reading>> getHistory(String locationId, LocalDate from, LocalDate to) {
        return getHistory(locationId, from, to, settings.repositoryTimeout());
    }

    public Fetched<List<Reading>> getHistory(String locationId, LocalDate from, LocalDate to, Duration timeout) {
        if (from.isAfter(to))
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        ZoneId zone = clock.getZone();
        Instant start = from.atStartOfDay(zone).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(zone).toInstant();
        CacheKey key = new CacheKey(OP_HISTORY, locationId, from + ".." + to);
        return historyCache.get(key, settings.historyTtl(), timeout, loaders, () -> {
            List<Reading> rows = load("readings", () -> store.readings(locationId, start, end));
            if (rows.isEmpty())
                throw new NotFoundException("no readings for location " + locationId + " between " + from
                        + " and " + to);
            return List.copyOf(rows);
        });
    }

    /**
     * Stored forecast points dated today or later, latest issue per date and
     * source.
     *
     * @throws NotFoundException when no current forecast exists
     */
    public Fetched<List<ForecastPoint>> getForecast(String locationId) {
        return getForecast(locationId, settings.repositoryTimeout());
    }

    public Fetched<List<ForecastPoint>> getForecast(String locationId, Duration timeout) {
        LocalDate today = LocalDate.now(clock);
        CacheKey key = new CacheKey(OP_FORECAST, locationId, today.toString());
        return forecastCache.get(key, settings.forecastTtl(), timeout, loaders, () -> {
            List<ForecastPoint> rows = load("forecastPoints", () -> store.forecastPoints(locationId, today));
            if (rows.isEmpty())
                throw new NotFoundException("no forecast for location " + locationId + " from " + today);
            return List.copyOf(rows);
        });
    }

    /**
     * ACTIVE alerts for a location; an empty list is a valid answer.
     */
    public Fetched<List<Alert>> listActiveAlerts(String locationId) {
        return listActiveAlerts(locationId, settings.repositoryTimeout());
    }

    public Fetched<List<Alert>> listActiveAlerts(String locationId, Duration timeout) {
        return alertCache.get(CacheKey.of(OP_ALERTS, locationId), settings.alertsTtl(), timeout, loaders,
                () -> List.copyOf(load("activeAlerts", () -> store.activeAlerts(locationId))));
    }

    /**
     * Caches a value computed from repository data under the location, so it
     * is dropped together with the data it was derived from. {@code cache}
     * comes from {@link #newCache()}.
     */
    public <T> Fetched<T> derive(SingleFlightCache<T> cache, String operation, String locationId, String window,
            Duration ttl, Supplier<T> computation) {
        return cache.get(new CacheKey(operation, locationId, window), ttl, settings.repositoryTimeout(), derivers,
                computation);
    }

    /**
     * Uncached lookup by alert id.
     */
    public Optional<Alert> findAlert(String alertId) {
        return direct("findAlert", settings.repositoryTimeout(), () -> store.findAlert(alertId));
    }

    public Optional<Location> findLocation(String locationId) {
        return direct("findLocation", settings.repositoryTimeout(), () -> store.findLocation(locationId));
    }

    public List<Location> listLocations() {
        return direct("listLocations", settings.repositoryTimeout(), store::listLocations);
    }

    // ---- writes ----

    public void recordReading(Reading reading) {
        recordReading(reading, settings.repositoryTimeout());
    }

    public void recordReading(Reading reading, Duration timeout) {
        write("insertReading", Set.of(reading.locationId()), timeout, () -> {
            store.insertReading(reading);
            return null;
        });
    }

    /**
     * Stores forecast points, which may span several locations; each of them
     * is invalidated.
     */
    public void upsertForecast(List<ForecastPoint> points) {
        upsertForecast(points, settings.repositoryTimeout());
    }

    public void upsertForecast(List<ForecastPoint> points, Duration timeout) {
        if (points.isEmpty())
            return;
        Set<String> locations = new LinkedHashSet<>();
        for (ForecastPoint p : points)
            locations.add(p.locationId());
        List<ForecastPoint> copy = List.copyOf(points);
        write("upsertForecastPoints", locations, timeout, () -> {
            store.upsertForecastPoints(copy);
            return null;
        });
    }

    public void saveAlert(Alert alert) {
        saveAlert(alert, settings.repositoryTimeout());
    }

    public void saveAlert(Alert alert, Duration timeout) {
        write("saveAlert", Set.of(alert.locationId()), timeout, () -> {
            store.saveAlert(alert);
            return null;
        });
    }

    public void saveLocation(Location location) {
        write("saveLocation", Set.of(location.id()), settings.repositoryTimeout(), () -> {
            store.saveLocation(location);
            return null;
        });
    }

    public void invalidate(String locationId) {
        for (SingleFlightCache<?> cache : caches)
            cache.invalidate(locationId);
    }

    @Override
    public void close() {
        derivers.shutdownNow();
        loaders.shutdownNow();
    }

    // ---- plumbing ----

    @FunctionalInterface
    private interface StoreCall<T> {
        T call() throws StoreException;
    }

    /**
     * Runs a store call, recording the outcome and translating store failures.
     */
    private <T> T load(String operation, StoreCall<T> call) {
        try {
            T out = call.call();
            metrics.record(operation, true);
            return out;
        } catch (StoreException e) {
            metrics.record(operation, false);
            log.warn("Store call {} failed: {}", operation, e.getMessage());
            throw new BackendUnavailableException("backend call " + operation + " failed", e);
        }
    }

    private <T> T direct(String operation, Duration timeout, StoreCall<T> call) {
        CompletableFuture<T> future = CompletableFuture.supplyAsync(() -> load(operation, call), loaders);
        return await(operation, future, timeout);
    }

    private void write(String operation, Set<String> locations, Duration timeout, StoreCall<Void> call) {
        CompletableFuture<Void> future = CompletableFuture.supplyAsync(() -> load(operation, call), loaders);
        // a write that outlives its caller's deadline still invalidates when it lands
        future.whenComplete((ok, err) -> locations.forEach(this::invalidate));
        try {
            await(operation, future, timeout);
        } finally {
            locations.forEach(this::invalidate);
        }
    }

    private <T> T await(String operation, CompletableFuture<T> future, Duration timeout) {
        try {
            return future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new RepositoryTimeoutException(operation + " did not complete within " + timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RepositoryTimeoutException("interrupted during " + operation, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException)
                throw (RuntimeException) cause;
            throw new BackendUnavailableException(operation + " failed", cause);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
