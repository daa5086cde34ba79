package space.ketterling.agriweather.alert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import space.ketterling.agriweather.analytics.CropProfileProvider;
import space.ketterling.agriweather.cache.CachedRepository;
import space.ketterling.agriweather.cache.Fetched;
import space.ketterling.agriweather.config.AlertThresholds;
import space.ketterling.agriweather.error.BackendUnavailableException;
import space.ketterling.agriweather.error.InsufficientDataException;
import space.ketterling.agriweather.error.NotFoundException;
import space.ketterling.agriweather.forecast.ForecastAggregator;
import space.ketterling.agriweather.model.Alert;
import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.CropProfile;
import space.ketterling.agriweather.model.ForecastPoint;
import space.ketterling.agriweather.model.Reading;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies the alert rules to a location and drives the alert lifecycle.
 *
 * <p>
 * Per (location, category) the lifecycle is: none, then ACTIVE, then
 * RESOLVED, after which a new ACTIVE alert may be opened. Transitions for one
 * pair are serialised by a lock of their own, so at most one ACTIVE alert
 * exists per pair; other pairs proceed in parallel.
 * </p>
 */
public final class AlertEvaluator {
    private static final Logger log = LoggerFactory.getLogger(AlertEvaluator.class);

    private static final int FORECAST_DAYS = 2;

    private final CachedRepository repository;
    private final ForecastAggregator forecasts;
    private final CropProfileProvider crops;
    private final List<AlertRule> rules;
    private final AlertThresholds thresholds;
    private final Clock clock;
    private final Map<PairKey, ReentrantLock> locks = new ConcurrentHashMap<>();

    public AlertEvaluator(CachedRepository repository, ForecastAggregator forecasts, CropProfileProvider crops,
            List<AlertRule> rules, AlertThresholds thresholds, Clock clock) {
        this.repository = repository;
        this.forecasts = forecasts;
        this.crops = crops;
        this.rules = AlertRules.ordered(rules);
        this.thresholds = thresholds;
        this.clock = clock;
    }

    public EvaluationOutcome evaluate(String locationId) {
        return evaluate(locationId, null);
    }

    /**
     * Runs every rule in priority order against the location's current
     * reading, recent history and 24h forecast.
     *
     * @param cropId crop whose thresholds apply; {@code null} for the default
     * @throws NotFoundException           when the crop id is unknown
     * @throws BackendUnavailableException when inputs or alert state cannot be
     *                                     read
     */
    public EvaluationOutcome evaluate(String locationId, String cropId) {
        Objects.requireNonNull(locationId, "locationId");
        CropProfile crop = crops.resolve(cropId);
        EvaluationContext context = gather(locationId, crop);

        List<Alert> created = new ArrayList<>();
        List<Alert> refreshed = new ArrayList<>();
        List<Alert> resolved = new ArrayList<>();

        for (AlertRule rule : rules) {
            RuleOutcome outcome = rule.evaluate(context);
            if (outcome.status() == RuleOutcome.Status.UNKNOWN) {
                log.debug("{} for {} undecided: {}", rule.category(), locationId, outcome.detail());
                continue;
            }
            ReentrantLock lock = lockFor(locationId, rule.category());
            lock.lock();
            try {
                apply(locationId, rule.category(), outcome, created, refreshed, resolved);
            } finally {
                lock.unlock();
            }
        }
        return new EvaluationOutcome(locationId, created, refreshed, resolved);
    }

    /**
     * Resolves an alert regardless of rule state. Resolving an alert that is
     * already resolved returns it unchanged.
     *
     * @throws NotFoundException when no alert has the id
     */
    public Alert resolve(String alertId) {
        Alert alert = repository.findAlert(alertId)
                .orElseThrow(() -> new NotFoundException("unknown alert: " + alertId));
        ReentrantLock lock = lockFor(alert.locationId(), alert.category());
        lock.lock();
        try {
            // re-read under the lock; an evaluation may have resolved it meanwhile
            Alert latest = repository.findAlert(alertId).orElse(alert);
            if (!latest.isActive())
                return latest;
            Alert done = latest.resolved(clock.instant());
            repository.saveAlert(done);
            log.info("Alert {} ({} at {}) resolved manually", done.id(), done.category(), done.locationId());
            return done;
        } finally {
            lock.unlock();
        }
    }

    private void apply(String locationId, AlertCategory category, RuleOutcome outcome, List<Alert> created,
            List<Alert> refreshed, List<Alert> resolved) {
        Optional<Alert> active = activeAlert(locationId, category);

        if (outcome.status() == RuleOutcome.Status.CLEAR) {
            if (active.isPresent()) {
                Alert done = active.get().resolved(clock.instant());
                repository.saveAlert(done);
                resolved.add(done);
                log.info("Alert {} {} at {} resolved: {}", done.id(), category, locationId, outcome.detail());
            }
            return;
        }

        if (active.isEmpty()) {
            Alert opened = Alert.open(locationId, category, outcome.severity(), outcome.detail(), clock.instant());
            repository.saveAlert(opened);
            created.add(opened);
            log.info("Alert {} {} at {} opened ({}): {}", opened.id(), category, locationId, opened.severity(),
                    opened.condition());
            return;
        }

        Alert existing = active.get();
        if (existing.severity() == outcome.severity() && Objects.equals(existing.condition(), outcome.detail())) {
            log.debug("Alert {} {} at {} unchanged", existing.id(), category, locationId);
            return;
        }
        Alert updated = existing.refreshed(outcome.severity(), outcome.detail(), clock.instant());
        repository.saveAlert(updated);
        refreshed.add(updated);
        log.info("Alert {} {} at {} refreshed ({} -> {}): {}", updated.id(), category, locationId,
                existing.severity(), updated.severity(), updated.condition());
    }

    private Optional<Alert> activeAlert(String locationId, AlertCategory category) {
        Fetched<List<Alert>> active = repository.listActiveAlerts(locationId);
        if (active.stale())
            throw new BackendUnavailableException("current alert state for " + locationId + " is unavailable");
        return active.value().stream().filter(a -> a.category() == category).findFirst();
    }

    private EvaluationContext gather(String locationId, CropProfile crop) {
        LocalDate today = LocalDate.now(clock);

        Reading current = null;
        try {
            current = repository.getCurrent(locationId).value();
        } catch (NotFoundException e) {
            log.debug("no current reading for {}", locationId);
        }

        List<Reading> history = List.of();
        try {
            history = repository.getHistory(locationId, today.minusDays(thresholds.lookbackDays() - 1L), today)
                    .value();
        } catch (NotFoundException e) {
            log.debug("no reading history for {}", locationId);
        }

        List<ForecastPoint> forecast = List.of();
        try {
            forecast = forecasts.aggregate(locationId, FORECAST_DAYS);
        } catch (InsufficientDataException e) {
            log.debug("no forecast for {}", locationId);
        }

        return new EvaluationContext(locationId, today, crop, current, history, forecast);
    }

    private ReentrantLock lockFor(String locationId, AlertCategory category) {
        return locks.computeIfAbsent(new PairKey(locationId, category), k -> new ReentrantLock());
    }

    private record PairKey(String locationId, AlertCategory category) {
    }
}
