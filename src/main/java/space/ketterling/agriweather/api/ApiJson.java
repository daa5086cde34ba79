package space.ketterling.agriweather.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import space.ketterling.agriweather.alert.EvaluationOutcome;
import space.ketterling.agriweather.analytics.CropSuitability;
import space.ketterling.agriweather.analytics.HistoricalAnalysis;
import space.ketterling.agriweather.analytics.MetricSummary;
import space.ketterling.agriweather.geo.NearbyLocation;
import space.ketterling.agriweather.model.AgriculturalMetric;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Location;
import space.ketterling.agriweather.model.Measurements;
import space.ketterling.agriweather.model.Reading;
import space.ketterling.agriweather.model.RiskFactor;

import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * JSON views of the domain types (snake_case, ISO-8601 times) and parsing of
 * request bodies.
 */
final class ApiJson {
    private final ObjectMapper om;

    ApiJson(ObjectMapper om) {
        this.om = om;
    }

    // ---- writing ----

    ObjectNode location(Location l) {
        ObjectNode row = om.createObjectNode();
        row.put("id", l.id());
        row.put("name", l.name());
        row.put("district", l.district());
        row.put("region", l.region());
        row.put("lat", l.latitude());
        row.put("lon", l.longitude());
        putNullable(row, "elevation_m", l.elevationM());
        return row;
    }

    ArrayNode nearby(List<NearbyLocation> hits) {
        ArrayNode arr = om.createArrayNode();
        for (NearbyLocation n : hits) {
            ObjectNode row = location(n.location());
            row.put("distance_km", n.distanceKm());
            arr.add(row);
        }
        return arr;
    }

    ObjectNode measurements(Measurements m) {
        ObjectNode row = om.createObjectNode();
        putNullable(row, "temperature_c", m.temperatureC());
        putNullable(row, "humidity_pct", m.humidityPct());
        putNullable(row, "rainfall_mm", m.rainfallMm());
        putNullable(row, "wind_speed_kmh", m.windSpeedKmh());
        putNullable(row, "wind_direction_deg", m.windDirectionDeg());
        putNullable(row, "soil_temperature_c", m.soilTemperatureC());
        putNullable(row, "soil_moisture_pct", m.soilMoisturePct());
        putNullable(row, "solar_radiation_wm2", m.solarRadiationWm2());
        return row;
    }

    ObjectNode reading(Reading r) {
        ObjectNode row = om.createObjectNode();
        row.put("location_id", r.locationId());
        row.put("timestamp", r.timestamp().toString());
        putNullable(row, "data_source", r.dataSource());
        row.setAll(measurements(r.measurements()));
        return row;
    }

    ArrayNode readings(Collection<Reading> rs) {
        ArrayNode arr = om.createArrayNode();
        rs.forEach(r -> arr.add(reading(r)));
        return arr;
    }

    ObjectNode forecastPoint(ForecastPoint p) {
        ObjectNode row = om.createObjectNode();
        row.put("location_id", p.locationId());
        row.put("date", p.forecastDate().toString());
        row.put("source", p.source());
        row.put("issued_at", p.issuedAt().toString());
        row.put("confidence", p.confidence());
        row.setAll(measurements(p.measurements()));
        return row;
    }

    ArrayNode forecastPoints(Collection<ForecastPoint> ps) {
        ArrayNode arr = om.createArrayNode();
        ps.forEach(p -> arr.add(forecastPoint(p)));
        return arr;
    }

    ObjectNode metric(AgriculturalMetric m) {
        ObjectNode row = om.createObjectNode();
        row.put("kind", m.kind().name());
        row.put("available", m.isAvailable());
        putNullable(row, "value", m.value());
        putNullable(row, "category", m.category());
        putNullable(row, "window_start", m.windowStart());
        putNullable(row, "window_end", m.windowEnd());
        row.put("computed_at", m.computedAt().toString());
        putNullable(row, "unavailable_reason", m.unavailableReason());
        return row;
    }

    ObjectNode summary(MetricSummary s) {
        ObjectNode out = om.createObjectNode();
        out.put("crop", s.cropId());
        out.put("computed_at", s.computedAt().toString());
        ArrayNode arr = out.putArray("metrics");
        s.metrics().forEach(m -> arr.add(metric(m)));
        out.set("suitability", suitability(s.suitability()));
        out.set("history", history(s.history()));
        return out;
    }

    ObjectNode suitability(CropSuitability c) {
        ObjectNode row = om.createObjectNode();
        putNullable(row, "temperature_suitable", c.temperatureSuitable());
        putNullable(row, "humidity_suitable", c.humiditySuitable());
        putNullable(row, "soil_moisture_suitable", c.soilMoistureSuitable());
        ArrayNode risks = row.putArray("risk_factors");
        for (RiskFactor r : c.riskFactors()) {
            ObjectNode risk = om.createObjectNode();
            risk.put("factor", r.name());
            risk.put("description", r.description());
            risks.add(risk);
        }
        return row;
    }

    ObjectNode history(HistoricalAnalysis h) {
        ObjectNode row = om.createObjectNode();
        row.put("from", h.from().toString());
        row.put("to", h.to().toString());
        HistoricalAnalysis.TemperatureTrend t = h.temperature();
        if (t == null) {
            row.putNull("temperature");
        } else {
            ObjectNode temp = row.putObject("temperature");
            temp.put("average_c", t.averageC());
            temp.put("high_c", t.highC());
            temp.put("low_c", t.lowC());
            temp.put("trend", t.trend().name());
        }
        HistoricalAnalysis.RainfallPattern r = h.rainfall();
        if (r == null) {
            row.putNull("rainfall");
        } else {
            ObjectNode rain = row.putObject("rainfall");
            rain.put("total_mm", r.totalMm());
            rain.put("average_mm", r.averageMm());
            rain.put("days_with_rain", r.daysWithRain());
            rain.put("trend", r.trend().name());
        }
        return row;
    }

    ObjectNode alert(Alert a) {
        ObjectNode row = om.createObjectNode();
        row.put("id", a.id());
        row.put("location_id", a.locationId());
        row.put("category", a.category().name());
        row.put("severity", a.severity().name());
        putNullable(row, "condition", a.condition());
        row.put("state", a.state().name());
        row.put("recommended_action", a.recommendedAction());
        row.put("created_at", a.createdAt().toString());
        putNullable(row, "updated_at", a.updatedAt());
        putNullable(row, "resolved_at", a.resolvedAt());
        return row;
    }

    ArrayNode alerts(Collection<Alert> as) {
        ArrayNode arr = om.createArrayNode();
        as.forEach(a -> arr.add(alert(a)));
        return arr;
    }

    ObjectNode outcome(EvaluationOutcome o) {
        ObjectNode out = om.createObjectNode();
        out.put("location_id", o.locationId());
        out.set("created", alerts(o.created()));
        out.set("refreshed", alerts(o.refreshed()));
        out.set("resolved", alerts(o.resolved()));
        return out;
    }

    private void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Boolean)
            obj.put(key, (Boolean) value);
        else if (value instanceof Number)
            obj.put(key, ((Number) value).doubleValue());
        else
            obj.put(key, value.toString());
    }

    // ---- parsing ----

    Location parseLocation(JsonNode n) {
        return new Location(
                requireText(n, "id"),
                text(n, "name"),
                text(n, "district"),
                text(n, "region"),
                requireNumber(n, "lat"),
                requireNumber(n, "lon"),
                number(n, "elevation_m"));
    }

    /**
     * A single reading object or an array of them.
     */
    List<Reading> parseReadings(JsonNode body) {
        List<Reading> out = new ArrayList<>();
        for (JsonNode n : asArray(body)) {
            out.add(new Reading(requireText(n, "location_id"), requireInstant(n, "timestamp"), parseMeasurements(n),
                    text(n, "data_source")));
        }
        return out;
    }

    List<ForecastPoint> parseForecastPoints(JsonNode body) {
        List<ForecastPoint> out = new ArrayList<>();
        for (JsonNode n : asArray(body)) {
            String date = requireText(n, "date");
            LocalDate forecastDate;
            try {
                forecastDate = LocalDate.parse(date);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("date must be yyyy-MM-dd: " + date);
            }
            out.add(new ForecastPoint(requireText(n, "location_id"), forecastDate, text(n, "source"),
                    requireInstant(n, "issued_at"), parseMeasurements(n), requireNumber(n, "confidence")));
        }
        return out;
    }

    private Measurements parseMeasurements(JsonNode n) {
        return new Measurements(
                number(n, "temperature_c"),
                number(n, "humidity_pct"),
                number(n, "rainfall_mm"),
                number(n, "wind_speed_kmh"),
                number(n, "wind_direction_deg"),
                number(n, "soil_temperature_c"),
                number(n, "soil_moisture_pct"),
                number(n, "solar_radiation_wm2"));
    }

    private static List<JsonNode> asArray(JsonNode body) {
        List<JsonNode> out = new ArrayList<>();
        if (body == null || body.isNull() || body.isMissingNode())
            throw new IllegalArgumentException("request body is required");
        if (body.isArray()) {
            body.forEach(out::add);
        } else {
            out.add(body);
        }
        if (out.isEmpty())
            throw new IllegalArgumentException("request body is empty");
        return out;
    }

    private static String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v == null || v.isNull()) ? null : v.asText();
    }

    private static String requireText(JsonNode n, String field) {
        String s = text(n, field);
        if (s == null || s.isBlank())
            throw new IllegalArgumentException(field + " is required");
        return s;
    }

    private static Double number(JsonNode n, String field) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull())
            return null;
        if (!v.isNumber())
            throw new IllegalArgumentException(field + " must be a number");
        return v.asDouble();
    }

    private static double requireNumber(JsonNode n, String field) {
        Double d = number(n, field);
        if (d == null)
            throw new IllegalArgumentException(field + " is required");
        return d;
    }

    private static Instant requireInstant(JsonNode n, String field) {
        String s = requireText(n, field);
        try {
            return Instant.parse(s);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException(field + " must be an ISO-8601 instant: " + s);
        }
    }
}
