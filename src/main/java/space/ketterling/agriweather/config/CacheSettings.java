package space.ketterling.agriweather.config;

import java.time.Duration;
import java.util.Objects;

/**
 * TTLs and behaviour of the repository cache.
 */
public record CacheSettings(
        Duration currentTtl,
        Duration forecastTtl,
        Duration historyTtl,
        Duration metricsTtl,
        Duration alertsTtl,
        Duration repositoryTimeout,
        int loaderThreads,
        boolean degradedAvailabilityOnBackendFailure) {

    public CacheSettings {
        requirePositive(currentTtl, "currentTtl");
        requirePositive(forecastTtl, "forecastTtl");
        requirePositive(historyTtl, "historyTtl");
        requirePositive(metricsTtl, "metricsTtl");
        requirePositive(alertsTtl, "alertsTtl");
        requirePositive(repositoryTimeout, "repositoryTimeout");
        if (loaderThreads < 1)
            throw new IllegalArgumentException("loaderThreads must be >= 1");
    }

    /**
     * Minutes-scale for current weather, hours-scale for forecasts.
     */
    public static CacheSettings defaults() {
        return new CacheSettings(Duration.ofMinutes(5), Duration.ofHours(3), Duration.ofMinutes(30),
                Duration.ofMinutes(2), Duration.ofMinutes(1), Duration.ofSeconds(5), 8, false);
    }

    public CacheSettings withDegradedAvailability(boolean enabled) {
        return new CacheSettings(currentTtl, forecastTtl, historyTtl, metricsTtl, alertsTtl, repositoryTimeout,
                loaderThreads, enabled);
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero())
            throw new IllegalArgumentException(name + " must be positive: " + d);
    }
}
