package space.ketterling.agriweather.api;

import io.javalin.Javalin;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;
import space.ketterling.agriweather.model.Location;

/**
 * Location lookup and registration.
 */
final class ApiRoutesLocations {

    private ApiRoutesLocations() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        WeatherAnalyticsEngine engine = api.engine();
        ApiJson json = api.json();

        app.get("/api/locations/nearby", ctx -> {
            double lat = ApiServer.requireDouble(ctx, "lat");
            double lon = ApiServer.requireDouble(ctx, "lon");
            Double radiusKm = ApiServer.optionalDouble(ctx, "radiusKm");
            ctx.json(json.nearby(engine.nearby(lat, lon, radiusKm)));
        });

        app.get("/api/locations/{id}", ctx -> ctx.json(json.location(engine.location(ctx.pathParam("id")))));

        app.post("/api/locations", ctx -> {
            Location saved = engine.registerLocation(json.parseLocation(api.body(ctx)));
            ctx.status(201).json(json.location(saved));
        });
    }
}
