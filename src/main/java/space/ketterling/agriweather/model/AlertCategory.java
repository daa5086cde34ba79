package space.ketterling.agriweather.model;

/**
 * Alert categories in fixed evaluation priority order (declaration order).
 */
public enum AlertCategory {
    FLOOD_RISK("Clear field drainage channels and postpone fertilizer or pesticide application."),
    HEAT_ADVISORY("Irrigate during early morning or evening and provide shade for seedlings and livestock."),
    FROST_WARNING("Cover sensitive crops overnight and irrigate lightly before sunset."),
    IRRIGATION_ADVISORY("Schedule irrigation; soil moisture has stayed below the crop's dry threshold."),
    DISEASE_RISK("Inspect leaves for fungal symptoms and consider preventive spraying.");

    private final String recommendedAction;

    AlertCategory(String recommendedAction) {
        this.recommendedAction = recommendedAction;
    }

    public String recommendedAction() {
        return recommendedAction;
    }
}
