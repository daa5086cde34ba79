package space.ketterling.agriweather.db;

import space.ketterling.agriweather.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

/**
 * Creates pooled database connections using HikariCP.
 */
public final class Database {
    /**
     * Utility class; do not instantiate.
     */
    private Database() {
    }

    /**
     * Builds the connection pool used by the JDBC store.
     */
    public static HikariDataSource createDataSource(AppConfig cfg) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(requireNonBlank(cfg.dbJdbcUrl(), "db.jdbcUrl"));
        hc.setUsername(requireNonBlank(cfg.dbUsername(), "db.username"));
        hc.setPassword(cfg.dbPassword());
        hc.setPoolName("agriweather-store");
        hc.setMaximumPoolSize(Math.max(2, cfg.dbPoolMax()));
        hc.setMinimumIdle(1);
        // shorter than the repository deadline so a dead DB surfaces as a backend error
        long deadlineMs = cfg.cache().repositoryTimeout().toMillis();
        hc.setConnectionTimeout(Math.max(250L, Math.min(10_000L, deadlineMs - 250L)));
        hc.setLeakDetectionThreshold(0);
        return new HikariDataSource(hc);
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String v, String name) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + name + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }
}
