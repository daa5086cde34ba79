package space.ketterling.agriweather.jobs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import space.ketterling.agriweather.config.AppConfig;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Background jobs: periodic alert evaluation for every indexed location and
 * a periodic rebuild of the geo index from the store.
 */
public final class EvaluationScheduler {
    private static final Logger log = LoggerFactory.getLogger(EvaluationScheduler.class);

    // Executors for each job type, single-threaded
    private final ScheduledExecutorService alertsExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "job-alert-evaluation"));
    private final ScheduledExecutorService locationsExec = Executors
            .newSingleThreadScheduledExecutor(r -> new Thread(r, "job-location-refresh"));

    private final Duration alertEvaluation;
    private final Duration locationRefresh;
    private final WeatherAnalyticsEngine engine;

    private ScheduledFuture<?> alertsTask;
    private ScheduledFuture<?> locationsTask;

    public EvaluationScheduler(AppConfig cfg, WeatherAnalyticsEngine engine) {
        this(cfg.alertEvaluation(), cfg.locationRefresh(), engine);
    }

    EvaluationScheduler(Duration alertEvaluation, Duration locationRefresh, WeatherAnalyticsEngine engine) {
        this.alertEvaluation = alertEvaluation;
        this.locationRefresh = locationRefresh;
        this.engine = engine;
    }

    public void start() {
        locationsTask = locationsExec.scheduleWithFixedDelay(safe("locationRefresh", engine::rebuildIndex),
                locationRefresh.toMillis(), locationRefresh.toMillis(), TimeUnit.MILLISECONDS);

        // first evaluation shortly after startup so alerts reflect data already stored
        alertsTask = alertsExec.scheduleWithFixedDelay(safe("alertEvaluation", this::evaluateAll),
                10_000L, alertEvaluation.toMillis(), TimeUnit.MILLISECONDS);

        log.info("Evaluation scheduler started (alerts every {}, locations every {})", alertEvaluation,
                locationRefresh);
    }

    public void stop() {
        if (alertsTask != null)
            alertsTask.cancel(true);
        if (locationsTask != null)
            locationsTask.cancel(true);

        shutdown(alertsExec, "alertsExec");
        shutdown(locationsExec, "locationsExec");
    }

    void evaluateAll() {
        long t0 = System.currentTimeMillis();
        int ok = engine.evaluateAll();
        log.info("Alert evaluation finished for {}/{} locations in {} ms", ok, engine.indexedLocations(),
                System.currentTimeMillis() - t0);
    }

    private void shutdown(ScheduledExecutorService es, String name) {
        es.shutdownNow();
        try {
            if (!es.awaitTermination(3, TimeUnit.SECONDS)) {
                log.warn("{} did not terminate cleanly", name);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    Runnable safe(String name, ThrowingRunnable r) {
        return () -> {
            MDC.put("job", name);
            try {
                r.run();
            } catch (Exception e) {
                log.error("Scheduled job failed: {}", name, e);
            } finally {
                MDC.remove("job");
            }
        };
    }

    @FunctionalInterface
    interface ThrowingRunnable {
        void run() throws Exception;
    }
}
