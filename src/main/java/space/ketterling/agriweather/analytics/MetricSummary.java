package space.ketterling.agriweather.analytics;

import space.ketterling.agriweather.model.AgriculturalMetric;

import java.time.Instant;
import java.util.List;

/**
 * All metrics for one location and crop.
 */
public record MetricSummary(
        String locationId,
        String cropId,
        AgriculturalMetric heatStress,
        AgriculturalMetric soilMoisture,
        AgriculturalMetric soilTemperature,
        AgriculturalMetric growingDegreeDays,
        CropSuitability suitability,
        HistoricalAnalysis history,
        Instant computedAt) {

    public List<AgriculturalMetric> metrics() {
        return List.of(heatStress, soilMoisture, soilTemperature, growingDegreeDays);
    }
}
