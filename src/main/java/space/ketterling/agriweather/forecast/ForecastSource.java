package space.ketterling.agriweather.forecast;

import space.ketterling.agriweather.model.ForecastPoint;

import java.time.LocalDate;
import java.util.List;

/**
 * Supplies raw forecast points, each with its own source name, issue time and
 * confidence.
 */
public interface ForecastSource {

    /**
     * Points for the location dated {@code from} or later. An empty list means
     * the source has nothing for the location.
     */
    List<ForecastPoint> pointsFor(String locationId, LocalDate from);
}
