package space.ketterling.agriweather.model;

import java.util.Objects;

/**
 * A monitored farm location (village, field or station).
 *
 * <p>
 * Coordinates are validated by the {@code GeoIndex} when the location is
 * registered; the store is the source of truth for these rows.
 * </p>
 */
public record Location(
        String id,
        String name,
        String district,
        String region,
        double latitude,
        double longitude,
        Double elevationM) {

    public Location {
        Objects.requireNonNull(id, "id");
        if (id.isBlank())
            throw new IllegalArgumentException("location id must not be blank");
    }

    @Override
    public String toString() {
        if (name == null)
            return id;
        return district == null || district.isBlank() ? name : name + ", " + district;
    }
}
