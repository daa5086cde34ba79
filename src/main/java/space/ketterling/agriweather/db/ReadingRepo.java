package space.ketterling.agriweather.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.agriweather.model.Reading;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for observed readings (append-only).
 */
public class ReadingRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ReadingRepo.class);

    /**
     * Creates a repo and ensures the table exists.
     */
    public ReadingRepo(HikariDataSource ds) throws SQLException {
        this.ds = ds;
        ensureTable();
    }

    private void ensureTable() throws SQLException {
        String ddl = "CREATE TABLE IF NOT EXISTS agri_reading ("
                + "location_id TEXT NOT NULL REFERENCES agri_location(location_id) ON DELETE CASCADE, "
                + "observed_at TIMESTAMPTZ NOT NULL, "
                + JdbcSupport.MEASUREMENT_DDL + ", "
                + "data_source TEXT, "
                + "ingested_at TIMESTAMPTZ DEFAULT now(), "
                + "PRIMARY KEY (location_id, observed_at))";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(ddl)) {
            ps.execute();
        }
    }

    /**
     * Inserts a reading. A second reading with the same timestamp is ignored:
     * readings are never mutated once recorded.
     */
    public void insert(Reading r) throws SQLException {
        String sql = "INSERT INTO agri_reading (location_id, observed_at, " + JdbcSupport.MEASUREMENT_COLUMNS
                + ", data_source) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (location_id, observed_at) DO NOTHING";
        int inserted;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, r.locationId());
            ps.setTimestamp(2, Timestamp.from(r.timestamp()));
            int next = JdbcSupport.setMeasurements(ps, 3, r.measurements());
            ps.setString(next, r.dataSource());
            inserted = ps.executeUpdate();
        }
        if (inserted == 0)
            log.warn("Duplicate reading ignored: {} at {}", r.locationId(), r.timestamp());
        else
            log.debug("insert reading: {} at {}", r.locationId(), r.timestamp());
    }

    public Optional<Reading> latest(String locationId) throws SQLException {
        String sql = "SELECT location_id, observed_at, " + JdbcSupport.MEASUREMENT_COLUMNS + ", data_source "
                + "FROM agri_reading WHERE location_id = ? ORDER BY observed_at DESC LIMIT 1";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Readings in [from, to) ordered by timestamp ascending.
     */
    public List<Reading> range(String locationId, Instant from, Instant to) throws SQLException {
        String sql = "SELECT location_id, observed_at, " + JdbcSupport.MEASUREMENT_COLUMNS + ", data_source "
                + "FROM agri_reading WHERE location_id = ? AND observed_at >= ? AND observed_at < ? "
                + "ORDER BY observed_at";
        List<Reading> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            ps.setTimestamp(2, Timestamp.from(from));
            ps.setTimestamp(3, Timestamp.from(to));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        return out;
    }

    private static Reading map(ResultSet rs) throws SQLException {
        return new Reading(
                rs.getString("location_id"),
                JdbcSupport.getInstant(rs, "observed_at"),
                JdbcSupport.getMeasurements(rs),
                rs.getString("data_source"));
    }
}
