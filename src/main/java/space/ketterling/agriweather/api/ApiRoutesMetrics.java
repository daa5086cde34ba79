package space.ketterling.agriweather.api;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import space.ketterling.agriweather.analytics.MetricSummary;
import space.ketterling.agriweather.cache.CacheStats;
import space.ketterling.agriweather.cache.Fetched;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;
import space.ketterling.agriweather.metrics.BackendCallMetrics;

/**
 * Agricultural metrics per location and backend call metrics.
 */
final class ApiRoutesMetrics {

    private ApiRoutesMetrics() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        WeatherAnalyticsEngine engine = api.engine();
        ApiJson json = api.json();

        app.get("/api/locations/{id}/metrics", ctx -> {
            String id = ctx.pathParam("id");
            Fetched<MetricSummary> summary = engine.metrics(id, ApiServer.optionalString(ctx, "crop"),
                    ApiServer.optionalDate(ctx, "from"), ApiServer.optionalDate(ctx, "to"));
            api.respond(ctx, id, summary, json.summary(summary.value()));
        });

        // Backend call metrics (rolling 60 minutes)
        app.get("/api/metrics/backend", ctx -> {
            ObjectNode out = api.om().createObjectNode();
            out.put("window_minutes", BackendCallMetrics.windowMinutes());
            out.put("status", engine.backendStatus());
            ArrayNode operations = out.putArray("operations");
            for (var e : engine.backendMetrics().entrySet()) {
                var snap = e.getValue();
                ObjectNode row = api.om().createObjectNode();
                row.put("operation", e.getKey());
                row.put("calls_last_hour", snap.callsLastHour());
                row.put("failures_last_hour", snap.failuresLastHour());
                row.put("failure_pct", snap.failurePct());
                row.put("status", snap.status());
                operations.add(row);
            }

            CacheStats stats = engine.cacheStats();
            ObjectNode cache = out.putObject("cache");
            cache.put("hits", stats.hits());
            cache.put("loads", stats.loads());
            cache.put("joins", stats.joins());
            cache.put("stale_served", stats.staleServed());
            cache.put("timeouts", stats.timeouts());
            cache.put("invalidations", stats.invalidations());
            cache.put("evictions", stats.evictions());
            cache.put("entries", engine.cachedEntries());
            ctx.json(out);
        });
    }
}
