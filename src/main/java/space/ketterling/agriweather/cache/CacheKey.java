package space.ketterling.agriweather.cache;

import java.util.Objects;

/**
 * Cache key: (operation, location, window). {@code window} is an opaque
 * string such as a date range, or "-" when the operation has none.
 */
public record CacheKey(String operation, String locationId, String window) {
    public CacheKey {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(locationId, "locationId");
        if (window == null || window.isBlank())
            window = "-";
    }

    public static CacheKey of(String operation, String locationId) {
        return new CacheKey(operation, locationId, "-");
    }

    @Override
    public String toString() {
        return operation + ":" + locationId + ":" + window;
    }
}
