package space.ketterling.agriweather.model;

/**
 * Current conditions that put a crop at risk.
 */
public enum RiskFactor {
    COLD_STRESS("Cold stress risk"),
    HEAT_STRESS("Heat stress risk"),
    DISEASE("Disease risk due to high humidity"),
    DROUGHT_STRESS("Drought stress risk");

    private final String description;

    RiskFactor(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
