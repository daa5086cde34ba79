package space.ketterling.agriweather.db;

import com.zaxxer.hikari.HikariDataSource;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.AlertSeverity;
import space.ketterling.agriweather.model.AlertState;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Database access for the current projection of alerts.
 */
public class AlertRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(AlertRepo.class);

    private static final String COLUMNS = "alert_id, location_id, category, severity, condition, state, "
            + "created_at, updated_at, resolved_at";

    /**
     * Creates a repo and ensures the table and its single-active index exist.
     */
    public AlertRepo(HikariDataSource ds) throws SQLException {
        this.ds = ds;
        ensureTable();
    }

    private void ensureTable() throws SQLException {
        String ddl = """
                CREATE TABLE IF NOT EXISTS agri_alert (
                    alert_id TEXT PRIMARY KEY,
                    location_id TEXT NOT NULL REFERENCES agri_location(location_id) ON DELETE CASCADE,
                    category TEXT NOT NULL,
                    severity TEXT NOT NULL,
                    condition TEXT,
                    state TEXT NOT NULL,
                    created_at TIMESTAMPTZ NOT NULL,
                    updated_at TIMESTAMPTZ,
                    resolved_at TIMESTAMPTZ
                )
                """;
        // at most one ACTIVE row per (location, category)
        String index = "CREATE UNIQUE INDEX IF NOT EXISTS ux_agri_alert_active "
                + "ON agri_alert (location_id, category) WHERE state = 'ACTIVE'";
        try (Connection c = ds.getConnection()) {
            try (PreparedStatement ps = c.prepareStatement(ddl)) {
                ps.execute();
            }
            try (PreparedStatement ps = c.prepareStatement(index)) {
                ps.execute();
            }
        }
    }

    /**
     * Inserts or replaces the row with the alert's id.
     */
    public void upsert(Alert a) throws SQLException {
        String sql = "INSERT INTO agri_alert (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) "
                + "ON CONFLICT (alert_id) DO UPDATE SET severity=EXCLUDED.severity, condition=EXCLUDED.condition, "
                + "state=EXCLUDED.state, updated_at=EXCLUDED.updated_at, resolved_at=EXCLUDED.resolved_at";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, a.id());
            ps.setString(2, a.locationId());
            ps.setString(3, a.category().name());
            ps.setString(4, a.severity().name());
            ps.setString(5, a.condition());
            ps.setString(6, a.state().name());
            JdbcSupport.setInstant(ps, 7, a.createdAt());
            JdbcSupport.setInstant(ps, 8, a.updatedAt());
            JdbcSupport.setInstant(ps, 9, a.resolvedAt());
            ps.executeUpdate();
        }
        log.debug("upsert alert: id={} location={} category={} state={}", a.id(), a.locationId(), a.category(),
                a.state());
    }

    /**
     * ACTIVE alerts for a location, most severe first.
     */
    public List<Alert> active(String locationId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM agri_alert WHERE location_id = ? AND state = 'ACTIVE' "
                + "ORDER BY created_at";
        List<Alert> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, locationId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next())
                    out.add(map(rs));
            }
        }
        out.sort((x, y) -> y.severity().compareTo(x.severity()));
        return out;
    }

    public Optional<Alert> findById(String alertId) throws SQLException {
        String sql = "SELECT " + COLUMNS + " FROM agri_alert WHERE alert_id = ?";
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, alertId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        }
    }

    private static Alert map(ResultSet rs) throws SQLException {
        return new Alert(
                rs.getString("alert_id"),
                rs.getString("location_id"),
                AlertCategory.valueOf(rs.getString("category")),
                AlertSeverity.valueOf(rs.getString("severity")),
                rs.getString("condition"),
                AlertState.valueOf(rs.getString("state")),
                JdbcSupport.getInstant(rs, "created_at"),
                JdbcSupport.getInstant(rs, "updated_at"),
                JdbcSupport.getInstant(rs, "resolved_at"));
    }
}
