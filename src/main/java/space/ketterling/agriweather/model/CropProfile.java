package space.ketterling.agriweather.model;

/**
 * Per-crop thresholds: GDD base temperature, soil moisture bands and the air
 * temperature and humidity ranges the crop tolerates.
 *
 * <p>
 * Moisture below {@code dryBelowPct} is dry, above {@code saturatedAbovePct}
 * is saturated, anything in between is optimal.
 * </p>
 */
public record CropProfile(
        String cropId,
        double gddBaseC,
        double dryBelowPct,
        double saturatedAbovePct,
        double minTemperatureC,
        double maxTemperatureC,
        double minHumidityPct,
        double maxHumidityPct) {

    public static final String GENERIC = "GENERIC";

    public static final double DEFAULT_MIN_TEMPERATURE_C = 10.0;
    public static final double DEFAULT_MAX_TEMPERATURE_C = 35.0;
    public static final double DEFAULT_MIN_HUMIDITY_PCT = 40.0;
    public static final double DEFAULT_MAX_HUMIDITY_PCT = 80.0;

    public CropProfile {
        if (cropId == null || cropId.isBlank())
            cropId = GENERIC;
        if (Double.isNaN(gddBaseC) || Double.isNaN(dryBelowPct) || Double.isNaN(saturatedAbovePct)
                || Double.isNaN(minTemperatureC) || Double.isNaN(maxTemperatureC)
                || Double.isNaN(minHumidityPct) || Double.isNaN(maxHumidityPct))
            throw new IllegalArgumentException("crop profile thresholds must be numbers: " + cropId);
        if (dryBelowPct < 0 || saturatedAbovePct > 100 || dryBelowPct >= saturatedAbovePct)
            throw new IllegalArgumentException(
                    "crop profile " + cropId + " needs 0 <= dryBelow < saturatedAbove <= 100, got "
                            + dryBelowPct + " / " + saturatedAbovePct);
        if (minTemperatureC >= maxTemperatureC)
            throw new IllegalArgumentException(
                    "crop profile " + cropId + " needs minTemperature < maxTemperature, got "
                            + minTemperatureC + " / " + maxTemperatureC);
        if (minHumidityPct < 0 || maxHumidityPct > 100 || minHumidityPct >= maxHumidityPct)
            throw new IllegalArgumentException(
                    "crop profile " + cropId + " needs 0 <= minHumidity < maxHumidity <= 100, got "
                            + minHumidityPct + " / " + maxHumidityPct);
    }

    /**
     * Profile with the default temperature and humidity ranges.
     */
    public CropProfile(String cropId, double gddBaseC, double dryBelowPct, double saturatedAbovePct) {
        this(cropId, gddBaseC, dryBelowPct, saturatedAbovePct, DEFAULT_MIN_TEMPERATURE_C, DEFAULT_MAX_TEMPERATURE_C,
                DEFAULT_MIN_HUMIDITY_PCT, DEFAULT_MAX_HUMIDITY_PCT);
    }
}
