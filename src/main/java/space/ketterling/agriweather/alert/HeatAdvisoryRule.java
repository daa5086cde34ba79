package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.analytics.MetricsEngine;
import space.ketterling.agriweather.model.AgriculturalMetric;
import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.AlertSeverity;
import space.ketterling.agriweather.model.HeatStressLevel;

import java.util.Locale;

/**
 * Current heat stress at or above the configured level.
 */
final class HeatAdvisoryRule implements AlertRule {
    private final MetricsEngine metrics;
    private final HeatStressLevel triggerLevel;

    HeatAdvisoryRule(MetricsEngine metrics, HeatStressLevel triggerLevel) {
        this.metrics = metrics;
        this.triggerLevel = triggerLevel;
    }

    @Override
    public AlertCategory category() {
        return AlertCategory.HEAT_ADVISORY;
    }

    @Override
    public RuleOutcome evaluate(EvaluationContext context) {
        if (context.current() == null)
            return RuleOutcome.unknown("no current reading");
        AgriculturalMetric heat = metrics.heatStress(context.current());
        HeatStressLevel level = MetricsEngine.heatLevelOf(heat);
        if (level == null)
            return RuleOutcome.unknown(heat.unavailableReason());

        String detail = String.format(Locale.ROOT, "heat stress %s (heat index %.1f C)", level, heat.value());
        if (!level.atLeast(triggerLevel))
            return RuleOutcome.clear(detail);
        return RuleOutcome.triggered(severityOf(level), detail);
    }

    static AlertSeverity severityOf(HeatStressLevel level) {
        switch (level) {
            case EXTREME:
                return AlertSeverity.EXTREME;
            case SEVERE:
                return AlertSeverity.HIGH;
            case MODERATE:
                return AlertSeverity.MEDIUM;
            default:
                return AlertSeverity.LOW;
        }
    }
}
