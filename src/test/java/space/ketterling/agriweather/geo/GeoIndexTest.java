package space.ketterling.agriweather.geo;

import org.junit.jupiter.api.Test;
import space.ketterling.agriweather.db.StoreException;
import space.ketterling.agriweather.error.BackendUnavailableException;
import space.ketterling.agriweather.error.InvalidCoordinatesException;
import space.ketterling.agriweather.model.Location;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GeoIndexTest {

    private static Location loc(String id, double lat, double lon) {
        return new Location(id, id, "district", "region", lat, lon, null);
    }

    @Test
    void haversineOfOneDegreeOfLatitude() {
        assertEquals(111.195, GeoMath.haversineKm(0, 0, 1, 0), 0.001);
        assertEquals(0.0, GeoMath.haversineKm(29.39, 76.97, 29.39, 76.97), 1e-9);
    }

    @Test
    void nearbyIsInclusiveAndOrderedByDistance() {
        GeoIndex index = new GeoIndex();
        index.register(loc("panipat", 29.39, 76.97));
        index.register(loc("karnal", 29.6857, 76.9905));
        index.register(loc("sonipat", 28.99, 77.02));
        index.register(loc("ludhiana", 30.90, 75.85));

        List<NearbyLocation> hits = index.nearby(29.39, 76.97, 50);

        assertEquals(List.of("panipat", "karnal", "sonipat"),
                hits.stream().map(n -> n.location().id()).collect(Collectors.toList()));
        assertEquals(0.0, hits.get(0).distanceKm(), 1e-9);

        double exact = GeoMath.haversineKm(29.39, 76.97, 29.6857, 76.9905);
        assertEquals(2, index.nearby(29.39, 76.97, exact).size());
        assertEquals(1, index.nearby(29.39, 76.97, exact - 0.001).size());
    }

    @Test
    void tiesAreBrokenById() {
        GeoIndex index = new GeoIndex();
        index.register(loc("b-field", 10.0, 10.0));
        index.register(loc("a-field", 10.0, 10.0));
        index.register(loc("c-field", 10.0, 10.0));

        assertEquals(List.of("a-field", "b-field", "c-field"), index.nearby(10.0, 10.0, 1).stream()
                .map(n -> n.location().id()).collect(Collectors.toList()));
    }

    @Test
    void nearbyMatchesBruteForceOnRandomPoints() {
        Random rnd = new Random(42);
        GeoIndex index = new GeoIndex();
        List<Location> all = new ArrayList<>();
        for (int i = 0; i < 200; i++) {
            Location l = loc(String.format("L%03d", i), 28 + rnd.nextDouble() * 3, 75 + rnd.nextDouble() * 3);
            all.add(l);
            index.register(l);
        }

        List<String> expected = all.stream()
                .filter(l -> GeoMath.haversineKm(29.5, 76.5, l.latitude(), l.longitude()) <= 80)
                .sorted((x, y) -> {
                    int c = Double.compare(GeoMath.haversineKm(29.5, 76.5, x.latitude(), x.longitude()),
                            GeoMath.haversineKm(29.5, 76.5, y.latitude(), y.longitude()));
                    return c != 0 ? c : x.id().compareTo(y.id());
                })
                .map(Location::id)
                .collect(Collectors.toList());

        List<String> actual = index.nearby(29.5, 76.5, 80).stream().map(n -> n.location().id())
                .collect(Collectors.toList());
        assertEquals(expected, actual);
    }

    @Test
    void registerReplacesCoordinatesOfExistingId() {
        GeoIndex index = new GeoIndex();
        index.register(loc("field-1", 29.39, 76.97));
        index.register(loc("field-1", 12.97, 77.59));

        assertEquals(1, index.size());
        assertTrue(index.nearby(29.39, 76.97, 10).isEmpty());
        assertEquals(1, index.nearby(12.97, 77.59, 1).size());
    }

    @Test
    void locationLabelLeavesOutMissingDistrict() {
        assertEquals("Panipat, Panipat district",
                new Location("p", "Panipat", "Panipat district", "Haryana", 29.39, 76.97, null).toString());
        assertEquals("Karnal", new Location("k", "Karnal", null, "Haryana", 29.69, 76.99, null).toString());
        assertEquals("s", new Location("s", null, null, null, 28.99, 77.02, null).toString());
    }

    @Test
    void invalidCoordinatesAreRejected() {
        GeoIndex index = new GeoIndex();
        assertThrows(InvalidCoordinatesException.class, () -> index.register(loc("x", 91, 0)));
        assertThrows(InvalidCoordinatesException.class, () -> index.register(loc("x", 0, -180.5)));
        assertThrows(InvalidCoordinatesException.class, () -> index.nearby(Double.NaN, 0, 10));
        assertThrows(IllegalArgumentException.class, () -> index.nearby(0, 0, -1));
        assertFalse(index.contains("x"));
    }

    @Test
    void nearestReturnsClosestWithinRadius() {
        GeoIndex index = new GeoIndex();
        index.register(loc("karnal", 29.6857, 76.9905));
        index.register(loc("sonipat", 28.99, 77.02));

        assertEquals("karnal", index.nearest(29.39, 76.97, 100).orElseThrow().location().id());
        assertTrue(index.nearest(29.39, 76.97, 5).isEmpty());
    }

    @Test
    void rebuildReplacesContentsAndSkipsInvalidRows() {
        GeoIndex index = new GeoIndex();
        index.register(loc("stale", 1, 1));

        int n = index.rebuildFrom(() -> List.of(loc("a", 10, 10), loc("bad", 95, 10), loc("b", 11, 11)));

        assertEquals(2, n);
        assertEquals(List.of("a", "b"), index.all().stream().map(Location::id).collect(Collectors.toList()));
    }

    @Test
    void registrationDuringRebuildSurvivesIt() {
        GeoIndex index = new GeoIndex();
        index.register(loc("a", 10, 10));
        index.register(loc("moved", 20, 20));

        index.rebuildFrom(() -> {
            // registered while the store is being read; the snapshot below misses both
            index.register(loc("b", 12, 12));
            index.register(loc("moved", 21, 21));
            return List.of(loc("a", 10, 10), loc("moved", 20, 20));
        });

        assertEquals(List.of("a", "b", "moved"),
                index.all().stream().map(Location::id).collect(Collectors.toList()));
        assertEquals(21.0, index.get("moved").orElseThrow().latitude(), 1e-9);
        assertEquals(1, index.nearby(12, 12, 1).size());

        // the next rebuild trusts the store again
        index.rebuildFrom(() -> List.of(loc("a", 10, 10)));
        assertEquals(List.of("a"), index.all().stream().map(Location::id).collect(Collectors.toList()));
    }

    @Test
    void rebuildFailureSurfacesAsBackendUnavailable() {
        GeoIndex index = new GeoIndex();
        index.register(loc("kept", 1, 1));

        assertThrows(BackendUnavailableException.class, () -> index.rebuildFrom(() -> {
            throw new StoreException("connection refused");
        }));
        assertTrue(index.contains("kept"));
    }

    @Test
    void concurrentRegistrationOfDifferentLocations() throws Exception {
        GeoIndex index = new GeoIndex();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        for (int t = 0; t < 8; t++) {
            int thread = t;
            pool.submit(() -> {
                start.await();
                for (int i = 0; i < 250; i++) {
                    index.register(loc("t" + thread + "-" + i, thread, i * 0.1));
                    index.nearby(thread, 0, 5);
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertTrue(pool.awaitTermination(30, TimeUnit.SECONDS));
        assertEquals(2000, index.size());
    }
}
