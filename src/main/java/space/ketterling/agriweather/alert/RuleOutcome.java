package space.ketterling.agriweather.alert;

import space.ketterling.agriweather.model.AlertSeverity;

import java.util.Objects;

/**
 * Result of one rule: the condition holds, does not hold, or cannot be
 * decided because inputs are missing.
 */
public record RuleOutcome(Status status, AlertSeverity severity, String detail) {

    public enum Status {
        TRIGGERED,
        CLEAR,
        UNKNOWN
    }

    public RuleOutcome {
        Objects.requireNonNull(status, "status");
        if (status == Status.TRIGGERED && severity == null)
            throw new IllegalArgumentException("triggered outcome needs a severity");
    }

    public static RuleOutcome triggered(AlertSeverity severity, String detail) {
        return new RuleOutcome(Status.TRIGGERED, severity, detail);
    }

    public static RuleOutcome clear(String detail) {
        return new RuleOutcome(Status.CLEAR, null, detail);
    }

    public static RuleOutcome unknown(String reason) {
        return new RuleOutcome(Status.UNKNOWN, null, reason);
    }
}
