package space.ketterling.agriweather.error;

/**
 * A repository call did not complete before its deadline. The in-flight load
 * keeps running for other waiters.
 */
public class RepositoryTimeoutException extends WeatherEngineException {
    public RepositoryTimeoutException(String message) {
        super(ErrorCode.TIMEOUT, message);
    }

    public RepositoryTimeoutException(String message, Throwable cause) {
        super(ErrorCode.TIMEOUT, message, cause);
    }
}
