package space.ketterling.agriweather.model;

public enum AlertState {
    ACTIVE,
    RESOLVED
}
