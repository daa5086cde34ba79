package space.ketterling.agriweather.geo;

import space.ketterling.agriweather.error.InvalidCoordinatesException;

/**
 * Great-circle helpers.
 */
public final class GeoMath {
    public static final double EARTH_RADIUS_KM = 6371.0;

    /**
     * Utility class; do not instantiate.
     */
    private GeoMath() {
    }

    /**
     * Haversine distance in kilometres.
     */
    public static double haversineKm(double lat1, double lon1, double lat2, double lon2) {
        double dLat = Math.toRadians(lat2 - lat1);
        double dLon = Math.toRadians(lon2 - lon1);
        double a = Math.sin(dLat / 2) * Math.sin(dLat / 2)
                + Math.cos(Math.toRadians(lat1)) * Math.cos(Math.toRadians(lat2))
                        * Math.sin(dLon / 2) * Math.sin(dLon / 2);
        double c = 2 * Math.asin(Math.min(1.0, Math.sqrt(a)));
        return EARTH_RADIUS_KM * c;
    }

    /**
     * Rejects latitudes outside -90..90 and longitudes outside -180..180.
     */
    public static void requireValid(double lat, double lon) {
        if (Double.isNaN(lat) || lat < -90.0 || lat > 90.0)
            throw new InvalidCoordinatesException("latitude out of range [-90, 90]: " + lat);
        if (Double.isNaN(lon) || lon < -180.0 || lon > 180.0)
            throw new InvalidCoordinatesException("longitude out of range [-180, 180]: " + lon);
    }
}
