package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.analytics.MetricsEngine;
import space.ketterling.agriweather.config.AlertThresholds;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Builds the standard rule set.
 */
public final class AlertRules {

    private AlertRules() {
    }

    /**
     * All rules, in category priority order.
     */
    public static List<AlertRule> standard(AlertThresholds thresholds, MetricsEngine metrics) {
        return ordered(List.of(
                new DiseaseRiskRule(thresholds.diseaseHumidityPct(), thresholds.diseaseMinTemperatureC()),
                new IrrigationAdvisoryRule(metrics, thresholds.irrigationDryDays()),
                new FrostWarningRule(thresholds.frostTemperatureC()),
                new HeatAdvisoryRule(metrics, thresholds.heatAdvisoryLevel()),
                new FloodRiskRule(thresholds.floodRainfallMm())));
    }

    /**
     * Sorts rules by the declaration order of their category.
     */
    public static List<AlertRule> ordered(List<AlertRule> rules) {
        return rules.stream()
                .sorted(Comparator.comparing(AlertRule::category))
                .collect(Collectors.toUnmodifiableList());
    }
}
