package space.ketterling.agriweather.model;

/**
 * Heat stress bands, ordered from least to most severe.
 */
public enum HeatStressLevel {
    NONE,
    MODERATE,
    SEVERE,
    EXTREME;

    public boolean atLeast(HeatStressLevel other) {
        return compareTo(other) >= 0;
    }
}
