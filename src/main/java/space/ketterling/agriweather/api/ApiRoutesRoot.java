package space.ketterling.agriweather.api;

import io.javalin.Javalin;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    /**
     * Utility class; do not instantiate.
     */
    private ApiRoutesRoot() {
    }

    /**
     * Registers root and health endpoints.
     */
    static void register(ApiServer api) {
        Javalin app = api.app();
        WeatherAnalyticsEngine engine = api.engine();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "agri-weather-engine",
                "status", "ok",
                "endpoints", List.of(
                        "GET /health",
                        "GET /api/metrics/backend",
                        "GET /api/locations/nearby?lat=29.39&lon=76.97&radiusKm=10",
                        "GET /api/locations/{id}",
                        "POST /api/locations",
                        "GET /api/locations/{id}/current",
                        "GET /api/locations/{id}/history?from=2025-06-01&to=2025-06-07",
                        "GET /api/locations/{id}/forecast?days=7",
                        "GET /api/locations/{id}/metrics?crop=TOMATO&from=2025-06-01&to=2025-06-07",
                        "GET /api/locations/{id}/alerts",
                        "POST /api/locations/{id}/alerts/evaluate?crop=TOMATO",
                        "POST /api/alerts/{alertId}/resolve",
                        "POST /api/readings",
                        "POST /api/forecasts"))));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            String backend = engine.backendStatus();
            out.put("status", "down".equals(backend) ? "degraded" : "ok");
            out.put("time", OffsetDateTime.now());
            out.put("backend", backend);
            out.put("indexed_locations", engine.indexedLocations());
            if ("down".equals(backend)) {
                ctx.status(503);
            }
            ctx.json(out);
        });
    }
}
