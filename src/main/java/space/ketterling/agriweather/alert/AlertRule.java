package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.model.AlertCategory;

/**
 * One threshold rule. Rules are stateless; the evaluator owns alert state.
 */
public interface AlertRule {

    AlertCategory category();

    RuleOutcome evaluate(EvaluationContext context);
}
