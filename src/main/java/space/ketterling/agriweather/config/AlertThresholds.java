package space.ketterling.agriweather.config;

import space.ketterling.agriweather.model.HeatStressLevel;

/**
 * Thresholds used by the alert rules.
 */
public record AlertThresholds(
        double floodRainfallMm,
        int irrigationDryDays,
        double frostTemperatureC,
        double diseaseHumidityPct,
        double diseaseMinTemperatureC,
        HeatStressLevel heatAdvisoryLevel,
        int lookbackDays) {

    public AlertThresholds {
        if (floodRainfallMm <= 0)
            throw new IllegalArgumentException("floodRainfallMm must be > 0");
        if (irrigationDryDays < 1)
            throw new IllegalArgumentException("irrigationDryDays must be >= 1");
        if (lookbackDays < irrigationDryDays)
            throw new IllegalArgumentException("lookbackDays must cover irrigationDryDays");
        if (heatAdvisoryLevel == null || heatAdvisoryLevel == HeatStressLevel.NONE)
            throw new IllegalArgumentException("heatAdvisoryLevel must be MODERATE or above");
    }

    public static AlertThresholds defaults() {
        return new AlertThresholds(50.0, 3, 2.0, 80.0, 20.0, HeatStressLevel.EXTREME, 7);
    }
}
