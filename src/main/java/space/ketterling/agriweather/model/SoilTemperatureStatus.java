package space.ketterling.agriweather.model;

public enum SoilTemperatureStatus {
    COLD,
    OPTIMAL,
    HOT
}
