package space.ketterling.agriweather.model;

import java.time.Instant;

/**
 * A derived metric for a location. Transient: regenerated on demand and only
 * cached for a short time.
 *
 * <p>
 * A {@code null} value means the metric is unavailable (see
 * {@link #unavailableReason()}), never zero.
 * </p>
 */
public record AgriculturalMetric(
        String locationId,
        MetricKind kind,
        Double value,
        String category,
        Instant windowStart,
        Instant windowEnd,
        Instant computedAt,
        String unavailableReason) {

    public static AgriculturalMetric available(String locationId, MetricKind kind, double value, String category,
            Instant windowStart, Instant windowEnd, Instant computedAt) {
        return new AgriculturalMetric(locationId, kind, value, category, windowStart, windowEnd, computedAt, null);
    }

    public static AgriculturalMetric unavailable(String locationId, MetricKind kind, Instant windowStart,
            Instant windowEnd, Instant computedAt, String reason) {
        return new AgriculturalMetric(locationId, kind, null, null, windowStart, windowEnd, computedAt, reason);
    }

    public boolean isAvailable() {
        return value != null;
    }
}
