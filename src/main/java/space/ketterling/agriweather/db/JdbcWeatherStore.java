/*
* Copyright 2025 Taylor Ketterling
* JDBC store for the agricultural weather engine.
* Utilizes HikariCP for connection pooling and one repo class per table;
* SQL failures are reported as StoreException so callers can tell them apart from "not found".
*/
package space.ketterling.agriweather.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Location;
import space.ketterling.agriweather.model.Reading;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * {@link WeatherStore} backed by PostgreSQL.
 */
public class JdbcWeatherStore implements WeatherStore {
    private final LocationRepo locations;
    private final ReadingRepo readings;
    private final ForecastRepo forecasts;
    private final AlertRepo alerts;

    /**
     * Builds the repos (creating tables as needed) on the given pool.
     */
    public JdbcWeatherStore(HikariDataSource ds) throws StoreException {
        try {
            this.locations = new LocationRepo(ds);
            this.readings = new ReadingRepo(ds);
            this.forecasts = new ForecastRepo(ds);
            this.alerts = new AlertRepo(ds);
        } catch (SQLException e) {
            throw new StoreException("Unable to prepare schema", e);
        }
    }

    @Override
    public List<Location> listLocations() throws StoreException {
        return call("listLocations", locations::list);
    }

    @Override
    public Optional<Location> findLocation(String locationId) throws StoreException {
        return call("findLocation", () -> locations.findById(locationId));
    }

    @Override
    public void saveLocation(Location location) throws StoreException {
        run("saveLocation", () -> locations.upsert(location));
    }

    @Override
    public Optional<Reading> latestReading(String locationId) throws StoreException {
        return call("latestReading", () -> readings.latest(locationId));
    }

    @Override
    public List<Reading> readings(String locationId, Instant from, Instant to) throws StoreException {
        return call("readings", () -> readings.range(locationId, from, to));
    }

    @Override
    public void insertReading(Reading reading) throws StoreException {
        run("insertReading", () -> readings.insert(reading));
    }

    @Override
    public List<ForecastPoint> forecastPoints(String locationId, LocalDate fromDate) throws StoreException {
        return call("forecastPoints", () -> forecasts.fromDate(locationId, fromDate));
    }

    @Override
    public void upsertForecastPoints(List<ForecastPoint> points) throws StoreException {
        if (points.isEmpty())
            return;
        run("upsertForecastPoints", () -> forecasts.insertAll(points));
    }

    @Override
    public List<Alert> activeAlerts(String locationId) throws StoreException {
        return call("activeAlerts", () -> alerts.active(locationId));
    }

    @Override
    public Optional<Alert> findAlert(String alertId) throws StoreException {
        return call("findAlert", () -> alerts.findById(alertId));
    }

    @Override
    public void saveAlert(Alert alert) throws StoreException {
        run("saveAlert", () -> alerts.upsert(alert));
    }

    @FunctionalInterface
    private interface SqlCall<T> {
        T get() throws SQLException;
    }

    @FunctionalInterface
    private interface SqlRun {
        void run() throws SQLException;
    }

    private static <T> T call(String op, SqlCall<T> c) throws StoreException {
        try {
            return c.get();
        } catch (SQLException e) {
            throw new StoreException(op + " failed: " + e.getMessage(), e);
        }
    }

    private static void run(String op, SqlRun r) throws StoreException {
        try {
            r.run();
        } catch (SQLException e) {
            throw new StoreException(op + " failed: " + e.getMessage(), e);
        }
    }
}
