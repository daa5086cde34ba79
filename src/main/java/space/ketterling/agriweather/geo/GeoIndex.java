package space.ketterling.agriweather.geo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.agriweather.db.StoreException;
import space.ketterling.agriweather.error.BackendUnavailableException;
import space.ketterling.agriweather.error.InvalidCoordinatesException;
import space.ketterling.agriweather.model.Location;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory spatial index over registered locations.
 *
 * <p>
 * Not persistent: the store owns locations and the index is rebuilt from a
 * {@link LocationSource}. Backed by a {@link ConcurrentHashMap}, so writes to
 * one location never block reads or writes of another.
 * </p>
 */
public final class GeoIndex {
    private static final Logger log = LoggerFactory.getLogger(GeoIndex.class);

    private static final Comparator<NearbyLocation> BY_DISTANCE_THEN_ID = Comparator
            .comparingDouble(NearbyLocation::distanceKm)
            .thenComparing(n -> n.location().id());

    private final Map<String, Entry> byId = new ConcurrentHashMap<>();
    private final AtomicLong registrations = new AtomicLong();

    /**
     * A location and the registration sequence number it was stored with.
     */
    private record Entry(Location location, long seq) {
    }

    /**
     * Adds a location or replaces the coordinates of an existing one.
     */
    public void register(Location location) {
        GeoMath.requireValid(location.latitude(), location.longitude());
        Entry stored = byId.put(location.id(), new Entry(location, registrations.incrementAndGet()));
        Location previous = stored == null ? null : stored.location();
        if (previous != null && (previous.latitude() != location.latitude()
                || previous.longitude() != location.longitude())) {
            log.info("Location {} moved from {},{} to {},{}", location.id(), previous.latitude(),
                    previous.longitude(), location.latitude(), location.longitude());
        }
    }

    public Optional<Location> get(String locationId) {
        Entry e = byId.get(locationId);
        return e == null ? Optional.empty() : Optional.of(e.location());
    }

    public boolean contains(String locationId) {
        return byId.containsKey(locationId);
    }

    public int size() {
        return byId.size();
    }

    /**
     * Snapshot of all registered locations ordered by id.
     */
    public List<Location> all() {
        List<Location> out = new ArrayList<>();
        byId.values().forEach(e -> out.add(e.location()));
        out.sort(Comparator.comparing(Location::id));
        return out;
    }

    /**
     * Locations within {@code radiusKm} of the center (inclusive), nearest
     * first, ties broken by id ascending.
     */
    public List<NearbyLocation> nearby(double centerLat, double centerLon, double radiusKm) {
        GeoMath.requireValid(centerLat, centerLon);
        if (Double.isNaN(radiusKm) || radiusKm < 0)
            throw new IllegalArgumentException("radiusKm must be >= 0: " + radiusKm);

        List<NearbyLocation> out = new ArrayList<>();
        for (Entry e : byId.values()) {
            Location l = e.location();
            double d = GeoMath.haversineKm(centerLat, centerLon, l.latitude(), l.longitude());
            if (d <= radiusKm)
                out.add(new NearbyLocation(l, d));
        }
        out.sort(BY_DISTANCE_THEN_ID);
        return out;
    }

    /**
     * Single closest location within the radius, if any.
     */
    public Optional<NearbyLocation> nearest(double centerLat, double centerLon, double radiusKm) {
        List<NearbyLocation> hits = nearby(centerLat, centerLon, radiusKm);
        return hits.isEmpty() ? Optional.empty() : Optional.of(hits.get(0));
    }

    /**
     * Replaces the index contents with the locations from the source.
     * Locations with invalid coordinates are skipped and logged. A location
     * registered while the source is being read is kept as registered, even
     * when the source does not list it yet.
     */
    public int rebuildFrom(LocationSource source) {
        long startedAt = registrations.get();
        List<Location> locations;
        try {
            locations = source.listLocations();
        } catch (StoreException e) {
            throw new BackendUnavailableException("Unable to enumerate locations for geo index", e);
        }
        return replaceAll(locations, startedAt);
    }

    private int replaceAll(Collection<Location> locations, long startedAt) {
        Map<String, Location> fresh = new ConcurrentHashMap<>();
        for (Location l : locations) {
            try {
                GeoMath.requireValid(l.latitude(), l.longitude());
                fresh.put(l.id(), l);
            } catch (InvalidCoordinatesException e) {
                log.warn("Skipping location {} during index rebuild: {}", l.id(), e.getMessage());
            }
        }
        for (String id : byId.keySet()) {
            if (!fresh.containsKey(id))
                byId.computeIfPresent(id, (k, e) -> e.seq() > startedAt ? e : null);
        }
        fresh.forEach((id, l) -> byId.compute(id,
                (k, e) -> e != null && e.seq() > startedAt ? e : new Entry(l, startedAt)));
        log.info("Geo index rebuilt with {} locations", fresh.size());
        return fresh.size();
    }
}
