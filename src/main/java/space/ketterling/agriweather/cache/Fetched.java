package space.ketterling.agriweather.cache;

import java.time.Instant;

/**
 * A value returned by the repository, with a flag telling whether it was
 * served from an expired entry because the backend was unavailable.
 */
public record Fetched<T>(T value, boolean stale, Instant loadedAt) {
}
