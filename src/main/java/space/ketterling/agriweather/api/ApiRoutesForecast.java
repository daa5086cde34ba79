package space.ketterling.agriweather.api;

import io.javalin.Javalin;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;
import space.ketterling.agriweather.model.ForecastPoint;

import java.util.List;

/**
 * Aggregated forecasts and forecast ingestion.
 */
final class ApiRoutesForecast {

    private ApiRoutesForecast() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        WeatherAnalyticsEngine engine = api.engine();
        ApiJson json = api.json();

        app.get("/api/locations/{id}/forecast", ctx -> {
            String id = ctx.pathParam("id");
            Integer days = ApiServer.optionalInt(ctx, "days");
            int requested = days == null ? engine.maxForecastDays() : days;
            List<ForecastPoint> points = engine.forecast(id, requested);
            ctx.json(api.om().createObjectNode()
                    .put("location_id", id)
                    .put("days_requested", requested)
                    .set("days", json.forecastPoints(points)));
        });

        app.post("/api/forecasts", ctx -> {
            List<ForecastPoint> points = json.parseForecastPoints(api.body(ctx));
            engine.upsertForecast(points);
            ctx.status(201).json(api.om().createObjectNode().put("stored", points.size()));
        });
    }
}
