package space.ketterling.agriweather.cache;

/**
 * Counters since startup.
 *
 * @param hits          fresh entry served
 * @param loads         loads started (one per single-flight group)
 * @param joins         callers that waited on somebody else's load
 * @param staleServed   expired entries served after a backend failure
 * @param timeouts      callers released by their deadline
 * @param invalidations location shards dropped after a write, counted per
 *                      cache that held data for the location
 * @param evictions     expired entries purged
 */
public record CacheStats(long hits, long loads, long joins, long staleServed, long timeouts, long invalidations,
        long evictions) {

    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0, 0, 0, 0);

    public CacheStats plus(CacheStats o) {
        return new CacheStats(hits + o.hits, loads + o.loads, joins + o.joins, staleServed + o.staleServed,
                timeouts + o.timeouts, invalidations + o.invalidations, evictions + o.evictions);
    }
}
