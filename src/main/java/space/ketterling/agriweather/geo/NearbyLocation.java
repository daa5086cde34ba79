package space.ketterling.agriweather.geo;

import space.ketterling.agriweather.model.Location;

/**
 * A location together with its distance from a query center.
 */
public record NearbyLocation(Location location, double distanceKm) {
}
