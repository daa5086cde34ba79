package space.ketterling.agriweather.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Forecast for one location and one target day, as issued by a single source
 * (or produced by aggregation, in which case {@code source} is
 * {@link #AGGREGATED}).
 */
public record ForecastPoint(
        String locationId,
        LocalDate forecastDate,
        String source,
        Instant issuedAt,
        Measurements measurements,
        double confidence) implements WeatherSample {

    public static final String AGGREGATED = "aggregated";

    public ForecastPoint {
        Objects.requireNonNull(locationId, "locationId");
        Objects.requireNonNull(forecastDate, "forecastDate");
        Objects.requireNonNull(issuedAt, "issuedAt");
        if (source == null || source.isBlank())
            source = "unknown";
        if (measurements == null)
            measurements = Measurements.EMPTY;
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0)
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
    }

    @Override
    public LocalDate sampleDate(ZoneId zone) {
        return forecastDate;
    }
}
