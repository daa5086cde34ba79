package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.analytics.DryRun;
import space.ketterling.agriweather.analytics.MetricsEngine;
import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.AlertSeverity;
import space.ketterling.agriweather.model.Reading;
import space.ketterling.agriweather.model.SoilMoistureCategory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Soil moisture dry for the crop on at least N consecutive days, ending with
 * the current reading. A current reading that is not dry clears the
 * advisory; a dry run shorter than N that stops at a day without soil data is
 * undecided.
 */
final class IrrigationAdvisoryRule implements AlertRule {
    private final MetricsEngine metrics;
    private final int dryDays;

    IrrigationAdvisoryRule(MetricsEngine metrics, int dryDays) {
        this.metrics = metrics;
        this.dryDays = dryDays;
    }

    @Override
    public AlertCategory category() {
        return AlertCategory.IRRIGATION_ADVISORY;
    }

    @Override
    public RuleOutcome evaluate(EvaluationContext context) {
        Reading current = context.current();
        if (current == null || current.measurements().soilMoisturePct() == null)
            return RuleOutcome.unknown("no current soil moisture");

        double pct = current.measurements().soilMoisturePct();
        if (MetricsEngine.categorize(pct, context.crop()) != SoilMoistureCategory.DRY) {
            return RuleOutcome.clear(String.format(Locale.ROOT, "soil moisture %.1f%% not dry for %s", pct,
                    context.crop().cropId()));
        }

        List<Reading> samples = new ArrayList<>(context.history());
        if (!samples.contains(current))
            samples.add(current);
        LocalDate end = current.sampleDate(metrics.zone());
        DryRun dry = metrics.consecutiveDryDays(samples, end, context.crop());
        int run = dry.days();
        if (run < dryDays && dry.endedByGap()) {
            return RuleOutcome.unknown(String.format(Locale.ROOT, "no soil moisture data for %s",
                    end.minusDays(run)));
        }
        String detail = String.format(Locale.ROOT, "soil moisture below %.1f%% for %d consecutive days (now %.1f%%)",
                context.crop().dryBelowPct(), run, pct);
        if (run < dryDays)
            return RuleOutcome.clear(detail);
        AlertSeverity severity = run >= 2 * dryDays ? AlertSeverity.HIGH : AlertSeverity.MEDIUM;
        return RuleOutcome.triggered(severity, detail);
    }
}
