package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.model.AlertCategory;
import space.ketterling.agriweather.model.AlertSeverity;
import space.ketterling.agriweather.model.Measurements;

import java.util.Locale;

/**
 * Warm and humid conditions favouring fungal disease.
 */
final class DiseaseRiskRule implements AlertRule {
    private final double humidityPct;
    private final double minTemperatureC;

    DiseaseRiskRule(double humidityPct, double minTemperatureC) {
        this.humidityPct = humidityPct;
        this.minTemperatureC = minTemperatureC;
    }

    @Override
    public AlertCategory category() {
        return AlertCategory.DISEASE_RISK;
    }

    @Override
    public RuleOutcome evaluate(EvaluationContext context) {
        if (context.current() == null)
            return RuleOutcome.unknown("no current reading");
        Measurements m = context.current().measurements();
        if (m.humidityPct() == null || m.temperatureC() == null)
            return RuleOutcome.unknown("humidity and temperature are both required");

        String detail = String.format(Locale.ROOT, "humidity %.0f%% at %.1f C", m.humidityPct(), m.temperatureC());
        if (m.humidityPct() >= humidityPct && m.temperatureC() >= minTemperatureC)
            return RuleOutcome.triggered(AlertSeverity.MEDIUM, detail);
        return RuleOutcome.clear(detail);
    }
}
