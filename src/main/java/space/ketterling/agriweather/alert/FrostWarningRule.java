package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.AlertSeverity;
import space.ketterling.agriweather.model.ForecastPoint;

import java.util.Locale;

/**
 * Temperature at or below the frost threshold now (high) or in the 24h
 * forecast (medium).
 */
final class FrostWarningRule implements AlertRule {
    private final double frostC;

    FrostWarningRule(double frostC) {
        this.frostC = frostC;
    }

    @Override
    public AlertCategory category() {
        return AlertCategory.FROST_WARNING;
    }

    @Override
    public RuleOutcome evaluate(EvaluationContext context) {
        Double now = context.current() == null ? null : context.current().measurements().temperatureC();
        if (now != null && now <= frostC) {
            return RuleOutcome.triggered(AlertSeverity.HIGH,
                    String.format(Locale.ROOT, "temperature %.1f C at or below %.1f C", now, frostC));
        }

        Double coldest = null;
        ForecastPoint coldestPoint = null;
        for (ForecastPoint p : context.next24h()) {
            Double t = p.measurements().temperatureC();
            if (t != null && (coldest == null || t < coldest)) {
                coldest = t;
                coldestPoint = p;
            }
        }
        if (coldest != null && coldest <= frostC) {
            return RuleOutcome.triggered(AlertSeverity.MEDIUM, String.format(Locale.ROOT,
                    "forecast temperature %.1f C on %s at or below %.1f C", coldest, coldestPoint.forecastDate(),
                    frostC));
        }
        if (now == null && coldest == null)
            return RuleOutcome.unknown("no current or forecast temperature");
        return RuleOutcome.clear("temperature above frost threshold");
    }
}
