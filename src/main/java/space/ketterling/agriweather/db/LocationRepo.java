package space.ketterling.agriweather.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.agriweather.model.Location;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for monitored locations.
 */
public class LocationRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(LocationRepo.class);

    /**
     * Creates a repo and ensures the table exists.
     */
    public LocationRepo(HikariDataSource ds) throws SQLException {
        this.ds = ds;
        ensureTable();
    }

    /**
     * Creates the agri_location table if it does not exist.
     */
    private void ensureTable() throws SQLException {
        String sql = """
                CREATE TABLE IF NOT EXISTS agri_location (
                    location_id TEXT PRIMARY KEY,
                    name TEXT,
                    district TEXT,
                    region TEXT,
                    lat DOUBLE PRECISION NOT NULL,
                    lon DOUBLE PRECISION NOT NULL,
                    elevation_m DOUBLE PRECISION,
                    created_at TIMESTAMPTZ DEFAULT now(),
                    updated_at TIMESTAMPTZ DEFAULT now()
                )
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.execute();
        }
    }

    /**
     * Lists all locations ordered by id.
     */
    public List<Location> list() throws SQLException {
        String sql = "SELECT location_id, name, district, region, lat, lon, elevation_m FROM agri_location ORDER BY location_id";
        List<Location> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                out.add(map(rs));
        }
        return out;
    }

    public Optional<Location> findById(String locationId) throws SQLException {
        String sql = "SELECT location_id, name, district, region, lat, lon, elevation_m FROM agri_location WHERE location_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Inserts or updates a location (coordinates may move).
     */
    public void upsert(Location l) throws SQLException {
        String sql = """
                INSERT INTO agri_location (location_id, name, district, region, lat, lon, elevation_m)
                VALUES (?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT (location_id) DO UPDATE SET
                    name = EXCLUDED.name, district = EXCLUDED.district, region = EXCLUDED.region,
                    lat = EXCLUDED.lat, lon = EXCLUDED.lon, elevation_m = EXCLUDED.elevation_m, updated_at = now()
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, l.id());
            ps.setString(2, l.name());
            ps.setString(3, l.district());
            ps.setString(4, l.region());
            ps.setDouble(5, l.latitude());
            ps.setDouble(6, l.longitude());
            JdbcSupport.setDouble(ps, 7, l.elevationM());
            ps.executeUpdate();
        }
        log.debug("upsert location: {} ({},{})", l.id(), l.latitude(), l.longitude());
    }

    private static Location map(ResultSet rs) throws SQLException {
        return new Location(
                rs.getString("location_id"),
                rs.getString("name"),
                rs.getString("district"),
                rs.getString("region"),
                rs.getDouble("lat"),
                rs.getDouble("lon"),
                JdbcSupport.getDouble(rs, "elevation_m"));
    }
}
