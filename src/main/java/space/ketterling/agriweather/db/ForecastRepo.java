package space.ketterling.agriweather.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.agriweather.model.ForecastPoint;

import java.sql.Connection;
import java.sql.Date;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Database access for per-source daily forecast points.
 */
public class ForecastRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ForecastRepo.class);

    /**
     * Creates a repo and ensures the table exists.
     */
    public ForecastRepo(HikariDataSource ds) throws SQLException {
        this.ds = ds;
        ensureTable();
    }

    private void ensureTable() throws SQLException {
        String ddl = "CREATE TABLE IF NOT EXISTS agri_forecast_point ("
                + "location_id TEXT NOT NULL REFERENCES agri_location(location_id) ON DELETE CASCADE, "
                + "forecast_date DATE NOT NULL, "
                + "source TEXT NOT NULL, "
                + "issued_at TIMESTAMPTZ NOT NULL, "
                + JdbcSupport.MEASUREMENT_DDL + ", "
                + "confidence REAL NOT NULL CHECK (confidence >= 0 AND confidence <= 1), "
                + "ingested_at TIMESTAMPTZ DEFAULT now(), "
                + "PRIMARY KEY (location_id, forecast_date, source, issued_at))";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(ddl)) {
            ps.execute();
        }
    }

    /**
     * Inserts forecast points in one transaction. Earlier issues for the same
     * (location, date, source) stay in the table for accuracy audits; reads
     * only return the latest issue. Re-sending an identical issue is a no-op.
     */
    public void insertAll(List<ForecastPoint> points) throws SQLException {
        String sql = "INSERT INTO agri_forecast_point (location_id, forecast_date, source, issued_at, "
                + JdbcSupport.MEASUREMENT_COLUMNS + ", confidence, ingested_at) "
                + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, now()) "
                + "ON CONFLICT (location_id, forecast_date, source, issued_at) DO NOTHING";

        try (Connection c = ds.getConnection()) {
            boolean auto = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (ForecastPoint p : points) {
                    ps.setString(1, p.locationId());
                    ps.setDate(2, Date.valueOf(p.forecastDate()));
                    ps.setString(3, p.source());
                    JdbcSupport.setInstant(ps, 4, p.issuedAt());
                    int next = JdbcSupport.setMeasurements(ps, 5, p.measurements());
                    ps.setDouble(next, p.confidence());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(auto);
            }
        }
        log.debug("insert forecast points: {}", points.size());
    }

    /**
     * Latest issue per (date, source) for dates on or after {@code fromDate},
     * ordered by date then source.
     */
    public List<ForecastPoint> fromDate(String locationId, LocalDate fromDate) throws SQLException {
        String sql = "SELECT DISTINCT ON (forecast_date, source) location_id, forecast_date, source, issued_at, "
                + JdbcSupport.MEASUREMENT_COLUMNS + ", confidence FROM agri_forecast_point "
                + "WHERE location_id = ? AND forecast_date >= ? "
                + "ORDER BY forecast_date, source, issued_at DESC";
        List<ForecastPoint> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            ps.setDate(2, Date.valueOf(fromDate));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ForecastPoint(
                            rs.getString("location_id"),
                            rs.getDate("forecast_date").toLocalDate(),
                            rs.getString("source"),
                            JdbcSupport.getInstant(rs, "issued_at"),
                            JdbcSupport.getMeasurements(rs),
                            rs.getDouble("confidence")));
                }
            }
        }
        return out;
    }
}
