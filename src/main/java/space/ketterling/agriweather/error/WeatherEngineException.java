package space.ketterling.agriweather.error;

/**
 * Base type for failures surfaced by the analytics engine to its callers.
 */
public abstract class WeatherEngineException extends RuntimeException {
    private final ErrorCode code;

    protected WeatherEngineException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected WeatherEngineException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }
}
