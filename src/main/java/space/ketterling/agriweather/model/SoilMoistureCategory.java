package space.ketterling.agriweather.model;

public enum SoilMoistureCategory {
    DRY,
    OPTIMAL,
    SATURATED
}
