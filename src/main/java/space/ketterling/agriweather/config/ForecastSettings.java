package space.ketterling.agriweather.config;

/**
 * Forecast aggregation settings.
 *
 * <p>
 * Confidence for the n-th day (n = 1 is today) is multiplied by
 * {@code exp(-decayPerDay * (n - 1))}.
 * </p>
 */
public record ForecastSettings(int maxHorizonDays, double decayPerDay) {

    public ForecastSettings {
        if (maxHorizonDays < 1)
            throw new IllegalArgumentException("maxHorizonDays must be >= 1");
        if (Double.isNaN(decayPerDay) || decayPerDay < 0)
            throw new IllegalArgumentException("decayPerDay must be >= 0");
    }

    public static ForecastSettings defaults() {
        return new ForecastSettings(7, 0.1);
    }
}
