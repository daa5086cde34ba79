package space.ketterling.agriweather.model;

public enum MetricKind {
    HEAT_STRESS_INDEX,
    SOIL_MOISTURE_CATEGORY,
    GROWING_DEGREE_DAYS,
    SOIL_TEMPERATURE_STATUS
}
