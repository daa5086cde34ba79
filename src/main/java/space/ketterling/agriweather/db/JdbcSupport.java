package space.ketterling.agriweather.db;

import space.ketterling.agriweather.model.Measurements;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;

/**
 * Null-aware JDBC helpers shared by the repos.
 */
final class JdbcSupport {
    static final String MEASUREMENT_COLUMNS = "temperature_c, humidity_pct, rainfall_mm, wind_speed_kmh, "
            + "wind_dir_deg, soil_temperature_c, soil_moisture_pct, solar_radiation_wm2";

    static final String MEASUREMENT_DDL = """
                temperature_c REAL,
                humidity_pct REAL,
                rainfall_mm REAL,
                wind_speed_kmh REAL,
                wind_dir_deg REAL,
                soil_temperature_c REAL,
                soil_moisture_pct REAL,
                solar_radiation_wm2 REAL
            """;

    /**
     * Utility class; do not instantiate.
     */
    private JdbcSupport() {
    }

    /**
     * Writes a nullable double to a prepared statement.
     */
    static void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    static void setInstant(PreparedStatement ps, int idx, Instant t) throws SQLException {
        if (t == null)
            ps.setNull(idx, Types.TIMESTAMP);
        else
            ps.setTimestamp(idx, Timestamp.from(t));
    }

    static Double getDouble(ResultSet rs, String column) throws SQLException {
        double v = rs.getDouble(column);
        return rs.wasNull() ? null : v;
    }

    static Instant getInstant(ResultSet rs, String column) throws SQLException {
        Timestamp ts = rs.getTimestamp(column);
        return ts == null ? null : ts.toInstant();
    }

    /**
     * Binds the eight measurement columns starting at {@code first}; returns
     * the next free index.
     */
    static int setMeasurements(PreparedStatement ps, int first, Measurements m) throws SQLException {
        int i = first;
        setDouble(ps, i++, m.temperatureC());
        setDouble(ps, i++, m.humidityPct());
        setDouble(ps, i++, m.rainfallMm());
        setDouble(ps, i++, m.windSpeedKmh());
        setDouble(ps, i++, m.windDirectionDeg());
        setDouble(ps, i++, m.soilTemperatureC());
        setDouble(ps, i++, m.soilMoisturePct());
        setDouble(ps, i++, m.solarRadiationWm2());
        return i;
    }

    static Measurements getMeasurements(ResultSet rs) throws SQLException {
        return new Measurements(
                getDouble(rs, "temperature_c"),
                getDouble(rs, "humidity_pct"),
                getDouble(rs, "rainfall_mm"),
                getDouble(rs, "wind_speed_kmh"),
                getDouble(rs, "wind_dir_deg"),
                getDouble(rs, "soil_temperature_c"),
                getDouble(rs, "soil_moisture_pct"),
                getDouble(rs, "solar_radiation_wm2"));
    }
}
