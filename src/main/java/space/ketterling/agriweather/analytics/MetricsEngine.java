package space.ketterling.agriweather.analytics;

import space.ketterling.agriweather.model.AgriculturalMetric;
import space.ketterling.agriweather.model.CropProfile;
import space.ketterling.agriweather.model.HeatStressLevel;
import space.ketterling.agriweather.model.Measurements;
import space.ketterling.agriweather.model.MetricKind;
import space.ketterling.agriweather.model.Reading;
import space.ketterling.agriweather.model.RiskFactor;
import space.ketterling.agriweather.model.SoilMoistureCategory;
import space.ketterling.agriweather.model.SoilTemperatureStatus;
import space.ketterling.agriweather.model.Trend;
import space.ketterling.agriweather.model.WeatherSample;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.DoubleSummaryStatistics;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derives agricultural metrics from readings and forecast points.
 *
 * <p>
 * Missing inputs yield an unavailable metric, never a zero. Calendar days are
 * taken in the zone of the supplied clock, which is also the only source of
 * {@code computedAt}; with a fixed clock every method is deterministic.
 * </p>
 */
public final class MetricsEngine {
    /** Soil colder than this is too cold for root growth. */
    public static final double SOIL_COLD_BELOW_C = 10.0;
    public static final double SOIL_HOT_ABOVE_C = 35.0;
    /** Smallest half-to-half change that counts as a trend. */
    static final double TREND_THRESHOLD = 0.1;

    private final Clock clock;

    public MetricsEngine(Clock clock) {
        this.clock = clock;
    }

    public ZoneId zone() {
        return clock.getZone();
    }

    /**
     * Heat index (Celsius) of one sample, categorised into a
     * {@link HeatStressLevel}.
     */
    public AgriculturalMetric heatStress(WeatherSample sample) {
        Instant at = instantOf(sample);
        Instant now = clock.instant();
        Measurements m = sample.measurements();
        if (m.temperatureC() == null || m.humidityPct() == null) {
            return AgriculturalMetric.unavailable(sample.locationId(), MetricKind.HEAT_STRESS_INDEX, at, at, now,
                    "temperature and humidity are both required");
        }
        if (m.humidityPct() < 0.0 || m.humidityPct() > 100.0) {
            return AgriculturalMetric.unavailable(sample.locationId(), MetricKind.HEAT_STRESS_INDEX, at, at, now,
                    "humidity out of range: " + m.humidityPct());
        }
        double hi = HeatIndex.celsius(m.temperatureC(), m.humidityPct());
        return AgriculturalMetric.available(sample.locationId(), MetricKind.HEAT_STRESS_INDEX, hi,
                HeatIndex.level(hi).name(), at, at, now);
    }

    /**
     * Level of an available heat stress metric; {@code null} when unavailable.
     */
    public static HeatStressLevel heatLevelOf(AgriculturalMetric metric) {
        if (metric == null || !metric.isAvailable() || metric.kind() != MetricKind.HEAT_STRESS_INDEX)
            return null;
        return HeatStressLevel.valueOf(metric.category());
    }

    public AgriculturalMetric soilMoisture(WeatherSample sample, CropProfile crop) {
        Instant at = instantOf(sample);
        Double pct = sample.measurements().soilMoisturePct();
        if (pct == null) {
            return AgriculturalMetric.unavailable(sample.locationId(), MetricKind.SOIL_MOISTURE_CATEGORY, at, at,
                    clock.instant(), "no soil moisture reading");
        }
        return AgriculturalMetric.available(sample.locationId(), MetricKind.SOIL_MOISTURE_CATEGORY, pct,
                categorize(pct, crop).name(), at, at, clock.instant());
    }

    /**
     * Piecewise mapping: below dryBelow is dry, above saturatedAbove is
     * saturated, the bounds themselves are optimal.
     */
    public static SoilMoistureCategory categorize(double moisturePct, CropProfile crop) {
        if (moisturePct < crop.dryBelowPct())
            return SoilMoistureCategory.DRY;
        if (moisturePct > crop.saturatedAbovePct())
            return SoilMoistureCategory.SATURATED;
        return SoilMoistureCategory.OPTIMAL;
    }

    public AgriculturalMetric soilTemperature(WeatherSample sample) {
        Instant at = instantOf(sample);
        Double c = sample.measurements().soilTemperatureC();
        if (c == null) {
            return AgriculturalMetric.unavailable(sample.locationId(), MetricKind.SOIL_TEMPERATURE_STATUS, at, at,
                    clock.instant(), "no soil temperature reading");
        }
        return AgriculturalMetric.available(sample.locationId(), MetricKind.SOIL_TEMPERATURE_STATUS, c,
                soilTemperatureStatus(c).name(), at, at, clock.instant());
    }

    public static SoilTemperatureStatus soilTemperatureStatus(double soilTempC) {
        if (soilTempC < SOIL_COLD_BELOW_C)
            return SoilTemperatureStatus.COLD;
        if (soilTempC > SOIL_HOT_ABOVE_C)
            return SoilTemperatureStatus.HOT;
        return SoilTemperatureStatus.OPTIMAL;
    }

    /**
     * Checks the reading against the crop's temperature, humidity and soil
     * moisture ranges (bounds inclusive) and lists the risks it implies.
     */
    public CropSuitability cropSuitability(Reading current, CropProfile crop) {
        if (current == null)
            return CropSuitability.UNKNOWN;
        Measurements m = current.measurements();
        List<RiskFactor> risks = new ArrayList<>();
        Boolean temperatureOk = null;
        if (m.temperatureC() != null) {
            double t = m.temperatureC();
            temperatureOk = t >= crop.minTemperatureC() && t <= crop.maxTemperatureC();
            if (t <= crop.minTemperatureC())
                risks.add(RiskFactor.COLD_STRESS);
            if (t >= crop.maxTemperatureC())
                risks.add(RiskFactor.HEAT_STRESS);
        }
        Boolean humidityOk = null;
        if (m.humidityPct() != null) {
            double h = m.humidityPct();
            humidityOk = h >= crop.minHumidityPct() && h <= crop.maxHumidityPct();
            if (h >= crop.maxHumidityPct())
                risks.add(RiskFactor.DISEASE);
        }
        Boolean soilOk = null;
        if (m.soilMoisturePct() != null) {
            SoilMoistureCategory category = categorize(m.soilMoisturePct(), crop);
            soilOk = category == SoilMoistureCategory.OPTIMAL;
            if (category == SoilMoistureCategory.DRY)
                risks.add(RiskFactor.DROUGHT_STRESS);
        }
        return new CropSuitability(temperatureOk, humidityOk, soilOk, risks);
    }

    /**
     * Daily temperature and rainfall statistics over {@code [from, to]}. Days
     * without the field are left out of the series rather than counted as
     * zero.
     */
    public HistoricalAnalysis historicalAnalysis(Collection<? extends WeatherSample> samples, LocalDate from,
            LocalDate to) {
        if (from.isAfter(to))
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        ZoneId zone = clock.getZone();
        Map<LocalDate, List<Double>> temps = new TreeMap<>();
        Map<LocalDate, Double> rain = new TreeMap<>();
        for (WeatherSample s : samples) {
            LocalDate day = s.sampleDate(zone);
            if (day.isBefore(from) || day.isAfter(to))
                continue;
            Measurements m = s.measurements();
            if (m.temperatureC() != null)
                temps.computeIfAbsent(day, d -> new ArrayList<>()).add(m.temperatureC());
            if (m.rainfallMm() != null)
                rain.merge(day, m.rainfallMm(), Double::sum);
        }

        HistoricalAnalysis.TemperatureTrend temperature = null;
        if (!temps.isEmpty()) {
            List<Double> daily = new ArrayList<>();
            temps.values().forEach(v -> daily.add(v.stream().mapToDouble(Double::doubleValue).average()
                    .orElseThrow()));
            DoubleSummaryStatistics stats = daily.stream().mapToDouble(Double::doubleValue).summaryStatistics();
            temperature = new HistoricalAnalysis.TemperatureTrend(stats.getAverage(), stats.getMax(),
                    stats.getMin(), trendOf(daily));
        }

        HistoricalAnalysis.RainfallPattern rainfall = null;
        if (!rain.isEmpty()) {
            List<Double> daily = new ArrayList<>(rain.values());
            double total = daily.stream().mapToDouble(Double::doubleValue).sum();
            int rainy = (int) daily.stream().filter(v -> v > 0.0).count();
            rainfall = new HistoricalAnalysis.RainfallPattern(total, total / daily.size(), rainy, trendOf(daily));
        }
        return new HistoricalAnalysis(from, to, temperature, rainfall);
    }

    /**
     * Compares the mean of the later half of the series with the mean of the
     * earlier half; the middle value of an odd series goes to the later half.
     */
    public static Trend trendOf(List<Double> values) {
        if (values.size() < 2)
            return Trend.STABLE;
        int half = values.size() / 2;
        double first = values.subList(0, half).stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        double second = values.subList(half, values.size()).stream().mapToDouble(Double::doubleValue).average()
                .orElseThrow();
        double diff = second - first;
        if (Math.abs(diff) < TREND_THRESHOLD)
            return Trend.STABLE;
        return diff > 0 ? Trend.INCREASING : Trend.DECREASING;
    }

    /**
     * Growing degree days over {@code [from, to]}: for each day
     * {@code max(0, (Tmax + Tmin) / 2 - base)}, Tmax and Tmin taken from the
     * samples of that day. A day without any temperature makes the whole
     * metric unavailable.
     */
    public AgriculturalMetric growingDegreeDays(String locationId, Collection<? extends WeatherSample> samples,
            LocalDate from, LocalDate to, CropProfile crop) {
        if (from.isAfter(to))
            throw new IllegalArgumentException("from " + from + " is after to " + to);
        ZoneId zone = clock.getZone();
        Instant start = from.atStartOfDay(zone).toInstant();
        Instant end = to.plusDays(1).atStartOfDay(zone).toInstant();

        Map<LocalDate, double[]> minMax = new TreeMap<>();
        for (WeatherSample s : samples) {
            Double t = s.measurements().temperatureC();
            if (t == null)
                continue;
            LocalDate day = s.sampleDate(zone);
            if (day.isBefore(from) || day.isAfter(to))
                continue;
            double[] mm = minMax.computeIfAbsent(day, d -> new double[] { t, t });
            mm[0] = Math.min(mm[0], t);
            mm[1] = Math.max(mm[1], t);
        }

        double total = 0.0;
        for (LocalDate day = from; !day.isAfter(to); day = day.plusDays(1)) {
            double[] mm = minMax.get(day);
            if (mm == null) {
                return AgriculturalMetric.unavailable(locationId, MetricKind.GROWING_DEGREE_DAYS, start, end,
                        clock.instant(), "no temperature data for " + day);
            }
            total += Math.max(0.0, (mm[0] + mm[1]) / 2.0 - crop.gddBaseC());
        }
        return AgriculturalMetric.available(locationId, MetricKind.GROWING_DEGREE_DAYS, total, crop.cropId(), start,
                end, clock.instant());
    }

    /**
     * Consecutive days ending at {@code endDate} whose mean soil moisture is
     * dry for the crop. The run stops at the first day that is not dry or that
     * has no soil moisture data; {@link DryRun#endedByGap()} tells the two
     * apart.
     */
    public DryRun consecutiveDryDays(Collection<? extends WeatherSample> samples, LocalDate endDate,
            CropProfile crop) {
        ZoneId zone = clock.getZone();
        Map<LocalDate, List<Double>> byDay = new TreeMap<>();
        for (WeatherSample s : samples) {
            Double pct = s.measurements().soilMoisturePct();
            if (pct == null)
                continue;
            byDay.computeIfAbsent(s.sampleDate(zone), d -> new ArrayList<>()).add(pct);
        }
        int run = 0;
        for (LocalDate day = endDate;; day = day.minusDays(1)) {
            List<Double> values = byDay.get(day);
            if (values == null)
                return new DryRun(run, true);
            double mean = values.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
            if (categorize(mean, crop) != SoilMoistureCategory.DRY)
                return new DryRun(run, false);
            run++;
        }
    }

    /**
     * Heat stress, soil moisture, soil temperature and crop suitability from
     * the current reading, plus GDD and the historical analysis over the
     * history window. A {@code null} current reading makes the current-reading
     * parts unavailable.
     */
    public MetricSummary summarize(String locationId, Reading current, Collection<? extends WeatherSample> history,
            LocalDate from, LocalDate to, CropProfile crop) {
        Instant now = clock.instant();
        AgriculturalMetric heat;
        AgriculturalMetric soil;
        AgriculturalMetric soilTemp;
        if (current == null) {
            heat = AgriculturalMetric.unavailable(locationId, MetricKind.HEAT_STRESS_INDEX, null, null, now,
                    "no current reading");
            soil = AgriculturalMetric.unavailable(locationId, MetricKind.SOIL_MOISTURE_CATEGORY, null, null, now,
                    "no current reading");
            soilTemp = AgriculturalMetric.unavailable(locationId, MetricKind.SOIL_TEMPERATURE_STATUS, null, null, now,
                    "no current reading");
        } else {
            heat = heatStress(current);
            soil = soilMoisture(current, crop);
            soilTemp = soilTemperature(current);
        }
        AgriculturalMetric gdd = growingDegreeDays(locationId, history, from, to, crop);
        return new MetricSummary(locationId, crop.cropId(), heat, soil, soilTemp, gdd,
                cropSuitability(current, crop), historicalAnalysis(history, from, to), now);
    }

    private Instant instantOf(WeatherSample sample) {
        if (sample instanceof Reading)
            return ((Reading) sample).timestamp();
        return sample.sampleDate(clock.getZone()).atStartOfDay(clock.getZone()).toInstant();
    }
}
