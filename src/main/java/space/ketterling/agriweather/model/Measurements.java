package space.ketterling.agriweather.model;

/**
 * Measurement fields shared by readings and forecast points.
 *
 * <p>
 * Every field is nullable: sensor gaps are expected and must never be
 * replaced by a default. Units: temperature in Celsius, humidity and soil
 * moisture in percent, rainfall in mm, wind speed in km/h, wind direction in
 * degrees, solar radiation in W/m2.
 * </p>
 */
public record Measurements(
        Double temperatureC,
        Double humidityPct,
        Double rainfallMm,
        Double windSpeedKmh,
        Double windDirectionDeg,
        Double soilTemperatureC,
        Double soilMoisturePct,
        Double solarRadiationWm2) {

    public static final Measurements EMPTY = new Measurements(null, null, null, null, null, null, null, null);

    public Measurements withTemperature(Double v) {
        return new Measurements(v, humidityPct, rainfallMm, windSpeedKmh, windDirectionDeg, soilTemperatureC,
                soilMoisturePct, solarRadiationWm2);
    }

    public Measurements withHumidity(Double v) {
        return new Measurements(temperatureC, v, rainfallMm, windSpeedKmh, windDirectionDeg, soilTemperatureC,
                soilMoisturePct, solarRadiationWm2);
    }

    public Measurements withRainfall(Double v) {
        return new Measurements(temperatureC, humidityPct, v, windSpeedKmh, windDirectionDeg, soilTemperatureC,
                soilMoisturePct, solarRadiationWm2);
    }

    public Measurements withWind(Double speedKmh, Double directionDeg) {
        return new Measurements(temperatureC, humidityPct, rainfallMm, speedKmh, directionDeg, soilTemperatureC,
                soilMoisturePct, solarRadiationWm2);
    }

    public Measurements withSoil(Double soilTempC, Double moisturePct) {
        return new Measurements(temperatureC, humidityPct, rainfallMm, windSpeedKmh, windDirectionDeg, soilTempC,
                moisturePct, solarRadiationWm2);
    }
}
