/*
* Copyright 2025 Taylor Ketterling
* API Server for the agricultural weather engine.
* utilizes Javalin for the HTTP server and exposes locations, observations, forecasts,
* metrics and alerts. uses Jackson for JSON processing.
*/

package space.ketterling.agriweather.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.agriweather.cache.Fetched;
import space.ketterling.agriweather.engine.WeatherAnalyticsEngine;
import space.ketterling.agriweather.error.ErrorCode;
import space.ketterling.agriweather.error.WeatherEngineException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    static final String STALE_HEADER = "X-Data-Stale";

    private final int port;
    private final ObjectMapper om;
    private final WeatherAnalyticsEngine engine;
    private final ApiJson json;
    private Javalin app;

    public ApiServer(int port, ObjectMapper om, WeatherAnalyticsEngine engine) {
        this.port = port;
        this.om = om;
        this.engine = engine;
        this.json = new ApiJson(om);
    }

    /**
     * Mapper used for responses: java.time values as ISO-8601 strings.
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper om = new ObjectMapper();
        om.registerModule(new JavaTimeModule());
        om.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return om;
    }

    public void start() {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.jsonMapper(new JavalinJackson(om, false));
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> {
            ctx.attribute("startTime", System.currentTimeMillis());
            log.info("Incoming {} {} from {}", ctx.method(), ctx.path(), ctx.ip());
        });

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        app.exception(WeatherEngineException.class, (e, ctx) -> {
            int status = statusFor(e.code());
            if (status >= 500) {
                log.warn("{} {} failed: {} {}", ctx.method(), ctx.path(), e.code(), e.getMessage());
            }
            ctx.status(status).json(error(e.code().name().toLowerCase(Locale.ROOT), e.getMessage()));
        });

        app.exception(IllegalArgumentException.class, (e, ctx) -> ctx.status(400)
                .json(error("bad_request", e.getMessage())));

        // Helpful JSON error instead of default HTML-ish errors
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(error("internal_error", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesLocations.register(this);
        ApiRoutesObservations.register(this);
        ApiRoutesForecast.register(this);
        ApiRoutesMetrics.register(this);
        ApiRoutesAlerts.register(this);

        app.start(port);
    }

    public void stop() {
        if (app != null) {
            app.stop();
        }
    }

    /**
     * Port the server is bound to; differs from the configured one when that
     * was 0.
     */
    public int boundPort() {
        return app.port();
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    ApiJson json() {
        return json;
    }

    WeatherAnalyticsEngine engine() {
        return engine;
    }

    static int statusFor(ErrorCode code) {
        switch (code) {
            case INVALID_COORDINATES:
                return 400;
            case NOT_FOUND:
            case INSUFFICIENT_DATA:
                return 404;
            case BACKEND_UNAVAILABLE:
                return 503;
            case TIMEOUT:
                return 504;
            default:
                return 500;
        }
    }

    ObjectNode error(String error, String message) {
        ObjectNode out = om.createObjectNode().put("error", error);
        if (message != null)
            out.put("message", message);
        return out;
    }

    /**
     * Wraps a repository result, flagging stale data in the body and a header.
     */
    void respond(Context ctx, String locationId, Fetched<?> fetched, JsonNode data) {
        ObjectNode out = om.createObjectNode();
        out.put("location_id", locationId);
        out.put("stale", fetched.stale());
        out.put("loaded_at", fetched.loadedAt().toString());
        out.set("data", data);
        if (fetched.stale())
            ctx.header(STALE_HEADER, "true");
        ctx.json(out);
    }

    JsonNode body(Context ctx) {
        try {
            return om.readTree(ctx.body());
        } catch (Exception e) {
            throw new IllegalArgumentException("request body is not valid JSON");
        }
    }

    static double requireDouble(Context ctx, String name) {
        String s = ctx.queryParam(name);
        if (s == null || s.isBlank())
            throw new IllegalArgumentException(name + " is required");
        return parseDouble(name, s);
    }

    static Double optionalDouble(Context ctx, String name) {
        String s = ctx.queryParam(name);
        if (s == null || s.isBlank())
            return null;
        return parseDouble(name, s);
    }

    static Integer optionalInt(Context ctx, String name) {
        String s = ctx.queryParam(name);
        if (s == null || s.isBlank())
            return null;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + s);
        }
    }

    static LocalDate optionalDate(Context ctx, String name) {
        String s = ctx.queryParam(name);
        if (s == null || s.isBlank())
            return null;
        try {
            return LocalDate.parse(s.trim());
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(name + " must be an ISO date (yyyy-MM-dd): " + s);
        }
    }

    static LocalDate requireDate(Context ctx, String name) {
        LocalDate d = optionalDate(ctx, name);
        if (d == null)
            throw new IllegalArgumentException(name + " is required");
        return d;
    }

    static String optionalString(Context ctx, String name) {
        String s = ctx.queryParam(name);
        return (s == null || s.isBlank()) ? null : s.trim();
    }

    private static double parseDouble(String name, String s) {
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a number: " + s);
        }
    }
}
