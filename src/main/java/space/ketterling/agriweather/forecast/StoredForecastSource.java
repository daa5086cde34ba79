package space.ketterling.agriweather.forecast;

import space.ketterling.agriweather.cache.CachedRepository;
import space.ketterling.agriweather.error.NotFoundException;
import space.ketterling.agriweather.model.ForecastPoint;

import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Forecast points previously stored through the repository.
 */
public final class StoredForecastSource implements ForecastSource {
    private final CachedRepository repository;

    public StoredForecastSource(CachedRepository repository) {
        this.repository = repository;
    }

    @Override
    public List<ForecastPoint> pointsFor(String locationId, LocalDate from) {
        List<ForecastPoint> points;
        try {
            points = repository.getForecast(locationId).value();
        } catch (NotFoundException e) {
            return List.of();
        }
        return points.stream().filter(p -> !p.forecastDate().isBefore(from)).collect(Collectors.toList());
    }
}
