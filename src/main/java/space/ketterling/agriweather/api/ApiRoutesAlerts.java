package space.ketterling.agriweather.api;

import io.javalin.Javalin;
import space.ketterling.agriweather.cache.Fetched;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;
import space.ketterling.agriweather.model.Alert;

import java.util.List;

/**
 * Active alerts, on-demand evaluation and manual resolution.
 */
final class ApiRoutesAlerts {

    private ApiRoutesAlerts() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        WeatherAnalyticsEngine engine = api.engine();
        ApiJson json = api.json();

        app.get("/api/locations/{id}/alerts", ctx -> {
            String id = ctx.pathParam("id");
            Fetched<List<Alert>> active = engine.activeAlerts(id);
            api.respond(ctx, id, active, json.alerts(active.value()));
        });

        app.post("/api/locations/{id}/alerts/evaluate", ctx -> ctx.json(json.outcome(
                engine.evaluate(ctx.pathParam("id"), ApiServer.optionalString(ctx, "crop")))));

        app.post("/api/alerts/{alertId}/resolve",
                ctx -> ctx.json(json.alert(engine.resolve(ctx.pathParam("alertId")))));
    }
}
