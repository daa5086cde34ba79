package space.ketterling.agriweather.model;

public enum AlertSeverity {
    LOW,
    MEDIUM,
    HIGH,
    EXTREME
}
