package space.ketterling.agriweather.db;

import space.ketterling.agriweather.geo.LocationSource;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Location;
import space.ketterling.agriweather.model.Reading;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Durable storage for locations, readings, forecast points and alerts.
 *
 * <p>
 * "Not found" is an empty result; backend failures throw
 * {@link StoreException}. Range queries return rows in ascending time order.
 * </p>
 */
public interface WeatherStore extends LocationSource {

    Optional<Location> findLocation(String locationId) throws StoreException;

    void saveLocation(Location location) throws StoreException;

    /**
     * Most recent reading for the location.
     */
    Optional<Reading> latestReading(String locationId) throws StoreException;

    /**
     * Readings with {@code from <= timestamp < to}, oldest first.
     */
    List<Reading> readings(String locationId, Instant from, Instant to) throws StoreException;

    void insertReading(Reading reading) throws StoreException;

    /**
     * Forecast points with a target date on or after {@code fromDate}, ordered
     * by date then source. Only the latest issue per (date, source) is
     * returned.
     */
    List<ForecastPoint> forecastPoints(String locationId, LocalDate fromDate) throws StoreException;

    /**
     * Stores points; a newer issue for an existing (location, date, source)
     * supersedes the older one in reads.
     */
    void upsertForecastPoints(List<ForecastPoint> points) throws StoreException;

    List<Alert> activeAlerts(String locationId) throws StoreException;

    Optional<Alert> findAlert(String alertId) throws StoreException;

    /**
     * Inserts or replaces the alert row with the same id.
     */
    void saveAlert(Alert alert) throws StoreException;
}
