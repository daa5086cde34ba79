package space.ketterling.agriweather.config;

import space.ketterling.agriweather.model.CropProfile;
import space.ketterling.agriweather.model.HeatStressLevel;

import java.io.IOException;
import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups all runtime settings for the API, database, cache,
 * forecast aggregation, alert thresholds, crop profiles and schedules.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,

        // Engine
        CacheSettings cache,
        ForecastSettings forecast,
        double defaultRadiusKm,
        AlertThresholds alerts,

        // Crops
        CropProfile defaultCrop,
        List<CropProfile> cropProfiles,

        // Schedules
        Duration alertEvaluation,
        Duration locationRefresh,

        // Time
        ZoneId clockZoneId) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read application.properties", e);
        }
        return build((envKey, propKey, def) -> envOr(p, envKey, propKey, def));
    }

    /**
     * Builds configuration from the given properties only (no env, no -D).
     */
    public static AppConfig fromProperties(Properties p) {
        return build((envKey, propKey, def) -> {
            String v = p.getProperty(propKey);
            return v == null || v.isBlank() ? def : v;
        });
    }

    private static AppConfig build(Lookup l) {
        int port = Integer.parseInt(l.get("API_PORT", "api.port", "8080"));
        String dbUrl = l.get("DB_JDBC_URL", "db.jdbcUrl", "");
        String dbUser = l.get("DB_USERNAME", "db.username", "");
        String dbPass = l.get("DB_PASSWORD", "db.password", ""); // ok empty if local trust auth
        int dbPoolMax = Integer.parseInt(l.get("DB_POOL_MAX", "db.poolMax", "8"));

        CacheSettings cache = new CacheSettings(
                duration(l, "CACHE_CURRENT_TTL", "cache.currentTtl", "PT5M"),
                duration(l, "CACHE_FORECAST_TTL", "cache.forecastTtl", "PT3H"),
                duration(l, "CACHE_HISTORY_TTL", "cache.historyTtl", "PT30M"),
                duration(l, "CACHE_METRICS_TTL", "cache.metricsTtl", "PT2M"),
                duration(l, "CACHE_ALERTS_TTL", "cache.alertsTtl", "PT1M"),
                duration(l, "REPOSITORY_TIMEOUT", "repository.timeout", "PT5S"),
                Integer.parseInt(l.get("CACHE_LOADER_THREADS", "cache.loaderThreads", "8")),
                Boolean.parseBoolean(l.get("DEGRADED_AVAILABILITY",
                        "cache.degradedAvailabilityOnBackendFailure", "false")));

        ForecastSettings forecast = new ForecastSettings(
                Integer.parseInt(l.get("FORECAST_MAX_HORIZON_DAYS", "forecast.maxHorizonDays", "7")),
                Double.parseDouble(l.get("FORECAST_DECAY_PER_DAY", "forecast.decayPerDay", "0.1")));

        double radiusKm = Double.parseDouble(l.get("GEO_DEFAULT_RADIUS_KM", "geo.defaultRadiusKm", "10"));

        AlertThresholds alerts = new AlertThresholds(
                Double.parseDouble(l.get("ALERT_FLOOD_RAINFALL_MM", "alerts.floodRainfallMm", "50")),
                Integer.parseInt(l.get("ALERT_IRRIGATION_DRY_DAYS", "alerts.irrigationDryDays", "3")),
                Double.parseDouble(l.get("ALERT_FROST_TEMP_C", "alerts.frostTemperatureC", "2")),
                Double.parseDouble(l.get("ALERT_DISEASE_HUMIDITY_PCT", "alerts.diseaseHumidityPct", "80")),
                Double.parseDouble(l.get("ALERT_DISEASE_MIN_TEMP_C", "alerts.diseaseMinTemperatureC", "20")),
                HeatStressLevel.valueOf(l.get("ALERT_HEAT_LEVEL", "alerts.heatAdvisoryLevel", "EXTREME")
                        .trim().toUpperCase(Locale.ROOT)),
                Integer.parseInt(l.get("ALERT_LOOKBACK_DAYS", "alerts.lookbackDays", "7")));

        CropProfile defaultCrop = parseCrop(
                CropProfile.GENERIC + ":" + l.get("CROPS_DEFAULT", "crops.default", "10:30:70"));
        List<CropProfile> crops = parseCrops(l.get("CROPS_PROFILES", "crops.profiles",
                "TOMATO:10:30:70:18:32:50:80|POTATO:7:30:70:10:30:60:85|CAULIFLOWER:5:30:70:10:25:60:85"
                        + "|CUCUMBER:12:30:70:18:35:50:85"));

        Duration evaluation = duration(l, "SCHED_ALERT_EVALUATION", "schedule.alertEvaluation", "PT4H");
        Duration locationRefresh = duration(l, "SCHED_LOCATION_REFRESH", "schedule.locationRefresh", "PT1H");

        ZoneId zoneId = ZoneId.of(l.get("CLOCK_ZONE", "clock.zone", "Asia/Kolkata"));

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,

                cache,
                forecast,
                radiusKm,
                alerts,

                defaultCrop,
                crops,

                evaluation,
                locationRefresh,

                zoneId);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    @FunctionalInterface
    private interface Lookup {
        String get(String envKey, String propKey, String def);
    }

    /**
     * Reads a value from env, then JVM property, then properties file fallback.
     */
    private static String envOr(Properties p, String envKey, String propKey, String def) {
        String v = System.getenv(envKey);
        if (v != null && !v.isBlank())
            return v;
        String sys = System.getProperty(propKey);
        if (sys != null && !sys.isBlank())
            return sys;
        String fromFile = p.getProperty(propKey);
        return fromFile == null || fromFile.isBlank() ? def : fromFile;
    }

    private static Duration duration(Lookup l, String envKey, String propKey, String def) {
        String raw = l.get(envKey, propKey, def);
        try {
            return Duration.parse(raw.trim());
        } catch (DateTimeException e) {
            throw new IllegalStateException("Invalid duration for " + propKey + ": " + raw, e);
        }
    }

    /**
     * Parses crop profiles in the format "ID:base:dryBelow:saturatedAbove|...",
     * each optionally followed by ":minTemp:maxTemp:minHumidity:maxHumidity".
     */
    static List<CropProfile> parseCrops(String s) {
        if (s == null || s.isBlank())
            return List.of();
        List<CropProfile> out = new ArrayList<>();
        for (String part : s.split("\\|")) {
            if (part.isBlank())
                continue;
            out.add(parseCrop(part));
        }
        return List.copyOf(out);
    }

    private static CropProfile parseCrop(String part) {
        String[] bits = part.trim().split(":");
        if (bits.length != 4 && bits.length != 8)
            throw new IllegalStateException("Crop profile must be ID:base:dryBelow:saturatedAbove"
                    + "[:minTemp:maxTemp:minHumidity:maxHumidity], got " + part);
        double[] v = new double[bits.length - 1];
        for (int i = 1; i < bits.length; i++) {
            try {
                v[i - 1] = Double.parseDouble(bits[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Invalid number in crop profile " + part + ": " + bits[i], e);
            }
        }
        String id = bits[0].trim().toUpperCase(Locale.ROOT);
        if (v.length == 3)
            return new CropProfile(id, v[0], v[1], v[2]);
        return new CropProfile(id, v[0], v[1], v[2], v[3], v[4], v[5], v[6]);
    }
}
