package space.ketterling.agriweather.analytics;

import space.ketterling.agriweather.model.HeatStressLevel;

/**
 * NOAA / NWS heat index.
 *
 * <p>
 * Uses Steadman's simple form when its average with the air temperature is
 * below 80°F, otherwise the Rothfusz regression with the NWS low- and
 * high-humidity adjustments. Computed in Fahrenheit; the public API is in
 * Celsius.
 * </p>
 */
public final class HeatIndex {

    private HeatIndex() {
    }

    /**
     * Heat index in Celsius.
     *
     * @throws IllegalArgumentException when humidity is outside 0..100 or an
     *                                  input is not a finite number
     */
    public static double celsius(double temperatureC, double humidityPct) {
        return fahrenheitToCelsius(fahrenheit(celsiusToFahrenheit(temperatureC), humidityPct));
    }

    static double fahrenheit(double t, double rh) {
        if (!Double.isFinite(t) || !Double.isFinite(rh))
            throw new IllegalArgumentException("temperature and humidity must be finite");
        if (rh < 0.0 || rh > 100.0)
            throw new IllegalArgumentException("humidity out of range: " + rh);

        double simple = 0.5 * (t + 61.0 + ((t - 68.0) * 1.2) + (rh * 0.094));
        if ((simple + t) / 2.0 < 80.0)
            return simple;

        double hi = -42.379
                + 2.04901523 * t
                + 10.14333127 * rh
                - 0.22475541 * t * rh
                - 0.00683783 * t * t
                - 0.05481717 * rh * rh
                + 0.00122874 * t * t * rh
                + 0.00085282 * t * rh * rh
                - 0.00000199 * t * t * rh * rh;

        if (rh < 13.0 && t >= 80.0 && t <= 112.0) {
            hi -= ((13.0 - rh) / 4.0) * Math.sqrt((17.0 - Math.abs(t - 95.0)) / 17.0);
        } else if (rh > 85.0 && t >= 80.0 && t <= 87.0) {
            hi += ((rh - 85.0) / 10.0) * ((87.0 - t) / 5.0);
        }
        return hi;
    }

    /**
     * NWS bands: below 90°F none, below 103°F moderate, below 125°F severe,
     * otherwise extreme.
     */
    public static HeatStressLevel level(double heatIndexC) {
        double f = celsiusToFahrenheit(heatIndexC);
        if (f < 90.0)
            return HeatStressLevel.NONE;
        if (f < 103.0)
            return HeatStressLevel.MODERATE;
        if (f < 125.0)
            return HeatStressLevel.SEVERE;
        return HeatStressLevel.EXTREME;
    }

    static double celsiusToFahrenheit(double c) {
        return c * 9.0 / 5.0 + 32.0;
    }

    static double fahrenheitToCelsius(double f) {
        return (f - 32.0) * 5.0 / 9.0;
    }
}
