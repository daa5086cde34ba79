package space.ketterling.agriweather.error;

/**
 * The persistence backend failed. Never masked by the cache unless degraded
 * availability is enabled and a stale entry exists.
 */
public class BackendUnavailableException extends WeatherEngineException {
    public BackendUnavailableException(String message) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message);
    }

    public BackendUnavailableException(String message, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message, cause);
    }
}
