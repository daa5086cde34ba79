package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.AlertSeverity;
import space.ketterling.agriweather.model.ForecastPoint;

import java.util.Locale;

/**
 * Forecast rainfall above the threshold within the next 24 hours. Twice the
 * threshold is extreme.
 */
final class FloodRiskRule implements AlertRule {
    private final double thresholdMm;

    FloodRiskRule(double thresholdMm) {
        this.thresholdMm = thresholdMm;
    }

    @Override
    public AlertCategory category() {
        return AlertCategory.FLOOD_RISK;
    }

    @Override
    public RuleOutcome evaluate(EvaluationContext context) {
        ForecastPoint wettest = null;
        for (ForecastPoint p : context.next24h()) {
            Double mm = p.measurements().rainfallMm();
            if (mm == null)
                continue;
            if (wettest == null || mm > wettest.measurements().rainfallMm())
                wettest = p;
        }
        if (wettest == null)
            return RuleOutcome.unknown("no rainfall forecast for the next 24h");

        double mm = wettest.measurements().rainfallMm();
        if (mm <= thresholdMm)
            return RuleOutcome.clear(String.format(Locale.ROOT, "forecast rainfall %.1f mm", mm));

        AlertSeverity severity = mm > 2 * thresholdMm ? AlertSeverity.EXTREME : AlertSeverity.HIGH;
        return RuleOutcome.triggered(severity, String.format(Locale.ROOT,
                "forecast rainfall %.1f mm on %s exceeds %.1f mm", mm, wettest.forecastDate(), thresholdMm));
    }
}
