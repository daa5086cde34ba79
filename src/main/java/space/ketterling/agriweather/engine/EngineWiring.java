package space.ketterling.agriweather.engine;

import space.ketterling.agriweather.alert.AlertEvaluator;
import space.ketterling.agriweather.alert.AlertRules;
import space.ketterling.agriweather.analytics.ConfiguredCropProfiles;
import space.ketterling.agriweather.analytics.MetricsEngine;
import space.ketterling.agriweather.cache.CachedRepository;
import space.ketterling.agriweather.config.AppConfig;
import space.ketterling.agriweather.db.WeatherStore;
import space.ketterling.agriweather.forecast.ForecastAggregator;
import space.ketterling.agriweather.forecast.StoredForecastSource;
import space.ketterling.agriweather.geo.GeoIndex;
import space.ketterling.agriweather.metrics.BackendCallMetrics;

import java.time.Clock;
import java.util.List;

/**
 * The engine's component graph, built once per process from configuration
 * and a store. Closing it stops the repository's loader threads.
 */
public final class EngineWiring implements AutoCloseable {
    private final GeoIndex geo;
    private final CachedRepository repository;
    private final WeatherAnalyticsEngine engine;

    private EngineWiring(GeoIndex geo, CachedRepository repository, WeatherAnalyticsEngine engine) {
        this.geo = geo;
        this.repository = repository;
        this.engine = engine;
    }

    /**
     * @param clock wall clock; its zone decides calendar days
     */
    public static EngineWiring build(AppConfig cfg, WeatherStore store, Clock clock) {
        BackendCallMetrics backendMetrics = new BackendCallMetrics(() -> clock.millis());
        GeoIndex geo = new GeoIndex();
        CachedRepository repository = new CachedRepository(store, cfg.cache(), backendMetrics, clock);
        MetricsEngine metrics = new MetricsEngine(clock);
        ForecastAggregator forecasts = new ForecastAggregator(List.of(new StoredForecastSource(repository)),
                cfg.forecast(), clock);
        ConfiguredCropProfiles crops = new ConfiguredCropProfiles(cfg.defaultCrop(), cfg.cropProfiles());
        AlertEvaluator alerts = new AlertEvaluator(repository, forecasts, crops,
                AlertRules.standard(cfg.alerts(), metrics), cfg.alerts(), clock);
        WeatherAnalyticsEngine engine = new WeatherAnalyticsEngine(geo, repository, metrics, forecasts, alerts, crops,
                backendMetrics, cfg.defaultRadiusKm(), cfg.alerts().lookbackDays(), clock);
        return new EngineWiring(geo, repository, engine);
    }

    public GeoIndex geo() {
        return geo;
    }

    public CachedRepository repository() {
        return repository;
    }

    public WeatherAnalyticsEngine engine() {
        return engine;
    }

    @Override
    public void close() {
        repository.close();
    }
}
