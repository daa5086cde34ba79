package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.model.Alert;

import java.util.List;

/**
 * Alert transitions made by one evaluation, each list in rule priority order.
 */
public record EvaluationOutcome(String locationId, List<Alert> created, List<Alert> refreshed,
        List<Alert> resolved) {

    public EvaluationOutcome {
        created = List.copyOf(created);
        refreshed = List.copyOf(refreshed);
        resolved = List.copyOf(resolved);
    }

    public boolean changedAnything() {
        return !created.isEmpty() || !refreshed.isEmpty() || !resolved.isEmpty();
    }
}
