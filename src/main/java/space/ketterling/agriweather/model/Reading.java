package space.ketterling.agriweather.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * One observed reading. Append-only: a newer timestamp supersedes it, it is
 * never edited.
 */
public record Reading(String locationId, Instant timestamp, Measurements measurements, String dataSource)
        implements WeatherSample {

    public Reading {
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(timestamp, "timestamp");
        if (measurements == null)
            measurements = Measurements.EMPTY;
    }

    public Reading(String locationId, Instant timestamp, Measurements measurements) {
        this(locationId, timestamp, measurements, null);
    }

    @Override
    public LocalDate sampleDate(ZoneId zone) {
        return timestamp.atZone(zone).toLocalDate();
    }
}
