package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.model.CropProfile;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Reading;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Inputs gathered once per evaluation and shared by every rule.
 *
 * @param current  latest reading, or {@code null} when the location has none
 * @param history  readings over the lookback window, oldest first
 * @param forecast aggregated forecast for today and tomorrow
 */
public record EvaluationContext(
        String locationId,
        LocalDate today,
        CropProfile crop,
        Reading current,
        List<Reading> history,
        List<ForecastPoint> forecast) {

    public EvaluationContext {
        history = history == null ? List.of() : List.copyOf(history);
        forecast = forecast == null ? List.of() : List.copyOf(forecast);
    }

    /**
     * Forecast points for today and tomorrow.
     */
    public List<ForecastPoint> next24h() {
        LocalDate tomorrow = today.plusDays(1);
        return forecast.stream().filter(p -> !p.forecastDate().isAfter(tomorrow)).collect(Collectors.toList());
    }
}
