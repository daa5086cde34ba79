package space.ketterling.agriweather.support;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.atomic.AtomicReference;

public class MutableClock extends Clock {
    private final ZoneId zone;
    private final AtomicReference<Instant> instant;

    public MutableClock(Instant initial, ZoneId zone) {
        this.zone = zone;
        this.instant = new AtomicReference<>(initial);
    }

    public void setInstant(Instant next) {
        instant.set(next);
    }

    public void advance(Duration d) {
        instant.updateAndGet(i -> i.plus(d));
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(instant(), zone);
    }

    @Override
    public Instant instant() {
        return instant.get();
    }
}
