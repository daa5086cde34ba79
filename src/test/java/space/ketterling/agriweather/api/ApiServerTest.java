package space.ketterling.agriweather.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import space.ketterling.agriweather.config.AppConfig;
import space.ketterling.agriweather.engine.EngineWiring;
import space.ketterling.agriweather.support.InMemoryWeatherStore;
import space.ketterling.agriweather.support.MutableClock;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiServerTest {
    private static final String PANIPAT = "{\"id\":\"panipat\",\"name\":\"Panipat\",\"district\":\"Panipat\","
            + "\"region\":\"Haryana\",\"lat\":29.3909,\"lon\":76.9635,\"elevation_m\":219}";

    private final InMemoryWeatherStore store = new InMemoryWeatherStore();
    private final ObjectMapper om = ApiServer.defaultObjectMapper();
    private final HttpClient client = HttpClient.newHttpClient();
    private EngineWiring wiring;
    private ApiServer server;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2025-06-10T06:30:00Z"), ZoneId.of("Asia/Kolkata"));
        wiring = EngineWiring.build(AppConfig.fromProperties(new Properties()), store, clock);
        server = new ApiServer(0, om, wiring.engine());
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.stop();
        wiring.close();
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.boundPort() + path);
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build(), HttpResponse.BodyHandlers.ofString());
    }

    private JsonNode json(HttpResponse<String> response) throws Exception {
        return om.readTree(response.body());
    }

    @Test
    void healthReportsBackendStatus() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertEquals("ok", body.get("status").asText());
        assertEquals("no-data", body.get("backend").asText());
        assertEquals(0, body.get("indexed_locations").asInt());
    }

    @Test
    void locationsCanBeRegisteredAndSearched() throws Exception {
        assertEquals(201, post("/api/locations", PANIPAT).statusCode());

        JsonNode location = json(get("/api/locations/panipat"));
        assertEquals("Panipat", location.get("name").asText());
        assertEquals(219.0, location.get("elevation_m").asDouble());

        JsonNode nearby = json(get("/api/locations/nearby?lat=29.39&lon=76.97&radiusKm=5"));
        assertEquals(1, nearby.size());
        assertEquals("panipat", nearby.get(0).get("id").asText());
        assertTrue(nearby.get(0).get("distance_km").asDouble() < 1.0);
    }

    @Test
    void badInputMapsToClientErrors() throws Exception {
        HttpResponse<String> missing = get("/api/locations/nearby?lon=76.97");
        assertEquals(400, missing.statusCode());
        assertEquals("bad_request", json(missing).get("error").asText());

        HttpResponse<String> outOfRange = get("/api/locations/nearby?lat=95&lon=76.97");
        assertEquals(400, outOfRange.statusCode());
        assertEquals("invalid_coordinates", json(outOfRange).get("error").asText());

        HttpResponse<String> unknown = get("/api/locations/sonipat");
        assertEquals(404, unknown.statusCode());
        assertEquals("not_found", json(unknown).get("error").asText());

        assertEquals(400, post("/api/readings", "not json").statusCode());
    }

    @Test
    void readingsAreIngestedAndServedInAnEnvelope() throws Exception {
        post("/api/locations", PANIPAT);
        HttpResponse<String> created = post("/api/readings", "["
                + "{\"location_id\":\"panipat\",\"timestamp\":\"2025-06-09T06:00:00Z\",\"temperature_c\":29.5},"
                + "{\"location_id\":\"panipat\",\"timestamp\":\"2025-06-10T06:00:00Z\",\"temperature_c\":31.0,"
                + "\"humidity_pct\":48,\"soil_moisture_pct\":22}]");
        assertEquals(201, created.statusCode());
        assertEquals(2, json(created).get("recorded").asInt());

        HttpResponse<String> current = get("/api/locations/panipat/current");
        JsonNode body = json(current);
        assertEquals(200, current.statusCode());
        assertEquals("panipat", body.get("location_id").asText());
        assertFalse(body.get("stale").asBoolean());
        assertEquals(31.0, body.get("data").get("temperature_c").asDouble());
        assertTrue(body.get("data").get("rainfall_mm").isNull());
        assertFalse(current.headers().firstValue("X-Data-Stale").isPresent());

        JsonNode history = json(get("/api/locations/panipat/history?from=2025-06-09&to=2025-06-10"));
        assertEquals(2, history.get("data").size());
        assertEquals(400, get("/api/locations/panipat/history?from=2025-06-09").statusCode());
    }

    @Test
    void forecastsAreAggregated() throws Exception {
        post("/api/locations", PANIPAT);
        assertEquals(404, get("/api/locations/panipat/forecast").statusCode());

        HttpResponse<String> stored = post("/api/forecasts", "["
                + "{\"location_id\":\"panipat\",\"date\":\"2025-06-11\",\"source\":\"imd\","
                + "\"issued_at\":\"2025-06-10T00:00:00Z\",\"confidence\":0.9,\"temperature_c\":30},"
                + "{\"location_id\":\"panipat\",\"date\":\"2025-06-11\",\"source\":\"owm\","
                + "\"issued_at\":\"2025-06-10T00:00:00Z\",\"confidence\":0.7,\"temperature_c\":32}]");
        assertEquals(201, stored.statusCode());

        JsonNode body = json(get("/api/locations/panipat/forecast?days=2"));
        assertEquals(2, body.get("days_requested").asInt());
        assertEquals(1, body.get("days").size());
        JsonNode day = body.get("days").get(0);
        assertEquals("aggregated", day.get("source").asText());
        assertEquals(30.875, day.get("temperature_c").asDouble(), 1e-9);
        assertEquals(400, get("/api/locations/panipat/forecast?days=0").statusCode());
    }

    @Test
    void alertsCanBeEvaluatedListedAndResolved() throws Exception {
        post("/api/locations", PANIPAT);
        post("/api/readings", "{\"location_id\":\"panipat\",\"timestamp\":\"2025-06-10T06:00:00Z\","
                + "\"temperature_c\":25,\"humidity_pct\":90}");

        JsonNode outcome = json(post("/api/locations/panipat/alerts/evaluate", ""));
        assertEquals(1, outcome.get("created").size());
        String alertId = outcome.get("created").get(0).get("id").asText();
        assertEquals("DISEASE_RISK", outcome.get("created").get(0).get("category").asText());

        JsonNode active = json(get("/api/locations/panipat/alerts"));
        assertEquals(1, active.get("data").size());
        assertFalse(active.get("data").get(0).get("recommended_action").asText().isBlank());

        JsonNode resolved = json(post("/api/alerts/" + alertId + "/resolve", ""));
        assertEquals("RESOLVED", resolved.get("state").asText());
        assertEquals(0, json(get("/api/locations/panipat/alerts")).get("data").size());
        assertEquals(404, post("/api/alerts/nope/resolve", "").statusCode());
        assertEquals(404, post("/api/locations/panipat/alerts/evaluate?crop=MANGO", "").statusCode());
    }

    @Test
    void metricsEndpointsReportSummaryAndBackendCalls() throws Exception {
        post("/api/locations", PANIPAT);
        post("/api/readings", "{\"location_id\":\"panipat\",\"timestamp\":\"2025-06-10T06:00:00Z\","
                + "\"temperature_c\":30,\"humidity_pct\":50,\"soil_moisture_pct\":12}");

        JsonNode summary = json(get("/api/locations/panipat/metrics?crop=TOMATO&from=2025-06-10&to=2025-06-10"));
        assertEquals("TOMATO", summary.get("data").get("crop").asText());
        assertEquals(4, summary.get("data").get("metrics").size());
        JsonNode suitability = summary.get("data").get("suitability");
        assertTrue(suitability.get("temperature_suitable").asBoolean());
        assertFalse(suitability.get("soil_moisture_suitable").asBoolean());
        assertEquals("DROUGHT_STRESS", suitability.get("risk_factors").get(0).get("factor").asText());
        JsonNode history = summary.get("data").get("history");
        assertEquals(30.0, history.get("temperature").get("average_c").asDouble(), 1e-9);
        assertEquals("STABLE", history.get("temperature").get("trend").asText());
        assertTrue(history.get("rainfall").isNull());

        JsonNode backend = json(get("/api/metrics/backend"));
        assertEquals(60, backend.get("window_minutes").asInt());
        assertEquals("ok", backend.get("status").asText());
        assertTrue(backend.get("operations").size() > 0);
        assertTrue(backend.get("cache").get("loads").asLong() > 0);
    }

    @Test
    void backendOutageIsServiceUnavailable() throws Exception {
        post("/api/locations", PANIPAT);
        store.setFailing(true);

        HttpResponse<String> response = get("/api/locations/panipat/current");

        assertEquals(503, response.statusCode());
        assertEquals("backend_unavailable", json(response).get("error").asText());
    }
}
