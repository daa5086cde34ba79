package space.ketterling.agriweather.api;

import io.javalin.Javalin;
import space.ketterling.agriweather.cache.Fetched;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;
import space.ketterling.agriweather.model.Reading;

import java.time.LocalDate;
import java.util.List;

/**
 * Current conditions, reading history and reading ingestion.
 */
final class ApiRoutesObservations {

    private ApiRoutesObservations() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        WeatherAnalyticsEngine engine = api.engine();
        ApiJson json = api.json();

        app.get("/api/locations/{id}/current", ctx -> {
            String id = ctx.pathParam("id");
            Fetched<Reading> current = engine.current(id);
            api.respond(ctx, id, current, json.reading(current.value()));
        });

        app.get("/api/locations/{id}/history", ctx -> {
            String id = ctx.pathParam("id");
            LocalDate from = ApiServer.requireDate(ctx, "from");
            LocalDate to = ApiServer.requireDate(ctx, "to");
            Fetched<List<Reading>> history = engine.history(id, from, to);
            api.respond(ctx, id, history, json.readings(history.value()));
        });

        app.post("/api/readings", ctx -> {
            List<Reading> readings = json.parseReadings(api.body(ctx));
            for (Reading r : readings) {
                engine.recordReading(r);
            }
            ctx.status(201).json(api.om().createObjectNode().put("recorded", readings.size()));
        });
    }
}
