package space.ketterling.agriweather.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Current projection of one alert. At most one ACTIVE alert exists per
 * (location, category); repeated triggers refresh it in place.
 */
public record Alert(
        String id,
        String locationId,
        AlertCategory category,
        AlertSeverity severity,
        String condition,
        AlertState state,
        Instant createdAt,
        Instant updatedAt,
        Instant resolvedAt) {

    public Alert {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
        if (state == AlertState.ACTIVE && resolvedAt != null)
            throw new IllegalArgumentException("active alert cannot have resolvedAt");
    }

    /**
     * Opens a new ACTIVE alert.
     */
    public static Alert open(String locationId, AlertCategory category, AlertSeverity severity, String condition,
            Instant now) {
        return new Alert(UUID.randomUUID().toString(), locationId, category, severity, condition,
                AlertState.ACTIVE, now, now, null);
    }

    /**
     * Same alert with refreshed detail; createdAt is untouched.
     */
    public Alert refreshed(AlertSeverity newSeverity, String newCondition, Instant now) {
        return new Alert(id, locationId, category, newSeverity, newCondition, state, createdAt, now, resolvedAt);
    }

    public Alert resolved(Instant now) {
        return new Alert(id, locationId, category, severity, condition, AlertState.RESOLVED, createdAt, now, now);
    }

    public boolean isActive() {
        return state == AlertState.ACTIVE;
    }

    public String recommendedAction() {
        return category.recommendedAction();
    }
}
