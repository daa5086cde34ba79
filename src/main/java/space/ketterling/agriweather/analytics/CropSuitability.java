package space.ketterling.agriweather.analytics;

import space.ketterling.agriweather.model.RiskFactor;

import java.util.List;

/**
 * Whether the current conditions suit a crop. Each check is {@code null} when
 * the reading lacks the field it needs.
 */
public record CropSuitability(
        Boolean temperatureSuitable,
        Boolean humiditySuitable,
        Boolean soilMoistureSuitable,
        List<RiskFactor> riskFactors) {

    public static final CropSuitability UNKNOWN = new CropSuitability(null, null, null, List.of());

    public CropSuitability {
        riskFactors = riskFactors == null ? List.of() : List.copyOf(riskFactors);
    }
}
