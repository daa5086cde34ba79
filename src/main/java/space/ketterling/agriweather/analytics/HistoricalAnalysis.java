package space.ketterling.agriweather.analytics;

import space.ketterling.agriweather.model.Trend;

import java.time.LocalDate;

/**
 * Temperature and rainfall over a window of days. Either part is {@code null}
 * when no reading in the window has the field.
 */
public record HistoricalAnalysis(
        LocalDate from,
        LocalDate to,
        TemperatureTrend temperature,
        RainfallPattern rainfall) {

    /**
     * Statistics of the daily mean temperatures.
     */
    public record TemperatureTrend(double averageC, double highC, double lowC, Trend trend) {
    }

    /**
     * Statistics of the daily rainfall totals.
     */
    public record RainfallPattern(double totalMm, double averageMm, int daysWithRain, Trend trend) {
    }
}
