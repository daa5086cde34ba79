package space.ketterling.agriweather.geo;

import space.ketterling.agriweather.db.StoreException;
import space.ketterling.agriweather.model.Location;

import java.util.List;

/**
 * Enumerates every known location; used to rebuild the index at startup.
 */
@FunctionalInterface
public interface LocationSource {
    List<Location> listLocations() throws StoreException;
}
