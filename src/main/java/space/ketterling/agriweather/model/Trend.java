package space.ketterling.agriweather.model;

/**
 * Direction of a daily series, comparing the mean of its later half with the
 * mean of its earlier half.
 */
public enum Trend {
    STABLE,
    INCREASING,
    DECREASING
}
