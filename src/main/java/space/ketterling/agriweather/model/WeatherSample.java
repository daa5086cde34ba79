package space.ketterling.agriweather.model;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Anything that carries measurements for a location on a calendar day.
 */
public interface WeatherSample {
    String locationId();

    Measurements measurements();

    /**
     * Calendar day this sample belongs to in the given zone.
     */
    LocalDate sampleDate(ZoneId zone);
}
