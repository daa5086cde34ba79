package space.ketterling.agriweather.analytics;

/**
 * A run of consecutive dry days counted back from an end date.
 *
 * @param days         length of the run
 * @param endedByGap   {@code true} when the run stopped at a day without any
 *                     soil moisture data rather than at a day that was not dry
 */
public record DryRun(int days, boolean endedByGap) {
}
