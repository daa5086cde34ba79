package space.ketterling.agriweather.forecast;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.agriweather.config.ForecastSettings;
import space.ketterling.agriweather.error.InsufficientDataException;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Measurements;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/**
 * Merges forecast points from several sources into one point per day.
 *
 * <p>
 * For each day only the latest issue of each source takes part. Measurement
 * fields are confidence-weighted means over the points that carry them (wind
 * direction as a circular mean). The combined confidence is
 * {@code sum(c^2) / sum(c)}, multiplied by {@code exp(-decayPerDay * (n - 1))}
 * for day n, and capped by the previous day's value so it never increases
 * with the horizon.
 * </p>
 */
public final class ForecastAggregator {
    private static final Logger log = LoggerFactory.getLogger(ForecastAggregator.class);

    private final List<ForecastSource> sources;
    private final ForecastSettings settings;
    private final Clock clock;

    public ForecastAggregator(List<ForecastSource> sources, ForecastSettings settings, Clock clock) {
        if (sources.isEmpty())
            throw new IllegalArgumentException("at least one forecast source is required");
        this.sources = List.copyOf(sources);
        this.settings = settings;
        this.clock = clock;
    }

    public int maxHorizonDays() {
        return settings.maxHorizonDays();
    }

    /**
     * One aggregated point per day from today, ascending by date. Days that no
     * source covers are left out.
     *
     * @param horizonDays days requested; values above the configured maximum
     *                    are clamped
     * @throws IllegalArgumentException  when {@code horizonDays < 1}
     * @throws InsufficientDataException when no day in the horizon has data
     */
    public List<ForecastPoint> aggregate(String locationId, int horizonDays) {
        if (horizonDays < 1)
            throw new IllegalArgumentException("horizonDays must be >= 1, got " + horizonDays);
        int horizon = Math.min(horizonDays, settings.maxHorizonDays());
        LocalDate today = LocalDate.now(clock);
        LocalDate last = today.plusDays(horizon - 1L);

        Map<LocalDate, Map<String, ForecastPoint>> byDay = new TreeMap<>();
        for (ForecastSource source : sources) {
            for (ForecastPoint p : source.pointsFor(locationId, today)) {
                if (!p.locationId().equals(locationId) || p.forecastDate().isBefore(today)
                        || p.forecastDate().isAfter(last))
                    continue;
                byDay.computeIfAbsent(p.forecastDate(), d -> new HashMap<>())
                        .merge(p.source(), p, ForecastAggregator::latestIssue);
            }
        }

        List<ForecastPoint> out = new ArrayList<>();
        double previous = 1.0;
        for (int n = 1; n <= horizon; n++) {
            LocalDate day = today.plusDays(n - 1L);
            Map<String, ForecastPoint> points = byDay.get(day);
            if (points == null || points.isEmpty()) {
                log.debug("no forecast sources for {} on {}", locationId, day);
                continue;
            }
            List<ForecastPoint> dayPoints = new ArrayList<>(points.values());
            double decayed = baseConfidence(dayPoints) * Math.exp(-settings.decayPerDay() * (n - 1));
            double confidence = Math.max(0.0, Math.min(previous, decayed));
            previous = confidence;
            out.add(new ForecastPoint(locationId, day, ForecastPoint.AGGREGATED, latestIssuedAt(dayPoints),
                    combine(dayPoints), confidence));
        }

        if (out.isEmpty())
            throw new InsufficientDataException(
                    "no forecast data for location " + locationId + " in the next " + horizon + " days");
        return out;
    }

    /**
     * Confidence-weighted combination of the inputs' own confidences. Falls
     * back to the plain mean (zero) when every confidence is zero.
     */
    static double baseConfidence(List<ForecastPoint> points) {
        double sum = 0.0;
        double sumSq = 0.0;
        for (ForecastPoint p : points) {
            sum += p.confidence();
            sumSq += p.confidence() * p.confidence();
        }
        if (sum == 0.0)
            return 0.0;
        return Math.min(1.0, sumSq / sum);
    }

    static Measurements combine(List<ForecastPoint> points) {
        return new Measurements(
                weightedMean(points, Measurements::temperatureC),
                weightedMean(points, Measurements::humidityPct),
                weightedMean(points, Measurements::rainfallMm),
                weightedMean(points, Measurements::windSpeedKmh),
                circularMean(points),
                weightedMean(points, Measurements::soilTemperatureC),
                weightedMean(points, Measurements::soilMoisturePct),
                weightedMean(points, Measurements::solarRadiationWm2));
    }

    private static Double weightedMean(List<ForecastPoint> points, Function<Measurements, Double> field) {
        double weighted = 0.0;
        double weights = 0.0;
        double plain = 0.0;
        int count = 0;
        for (ForecastPoint p : points) {
            Double v = field.apply(p.measurements());
            if (v == null)
                continue;
            weighted += v * p.confidence();
            weights += p.confidence();
            plain += v;
            count++;
        }
        if (count == 0)
            return null;
        if (weights == 0.0)
            return plain / count;
        return weighted / weights;
    }

    private static Double circularMean(List<ForecastPoint> points) {
        boolean unweighted = points.stream()
                .allMatch(p -> p.measurements().windDirectionDeg() == null || p.confidence() == 0.0);
        double sin = 0.0;
        double cos = 0.0;
        int count = 0;
        for (ForecastPoint p : points) {
            Double deg = p.measurements().windDirectionDeg();
            if (deg == null)
                continue;
            double w = unweighted ? 1.0 : p.confidence();
            double rad = Math.toRadians(deg);
            sin += w * Math.sin(rad);
            cos += w * Math.cos(rad);
            count++;
        }
        if (count == 0 || Math.hypot(sin, cos) < 1e-9)
            return null;
        double deg = Math.toDegrees(Math.atan2(sin, cos));
        return deg < 0 ? deg + 360.0 : deg;
    }

    private static ForecastPoint latestIssue(ForecastPoint a, ForecastPoint b) {
        return b.issuedAt().isAfter(a.issuedAt()) ? b : a;
    }

    private static Instant latestIssuedAt(List<ForecastPoint> points) {
        Instant latest = points.get(0).issuedAt();
        for (ForecastPoint p : points) {
            if (p.issuedAt().isAfter(latest))
                latest = p.issuedAt();
        }
        return latest;
    }
}
