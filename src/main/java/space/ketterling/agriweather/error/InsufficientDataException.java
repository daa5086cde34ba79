package space.ketterling.agriweather.error;

public class InsufficientDataException extends WeatherEngineException {
    public InsufficientDataException(String message) {
        super(ErrorCode.INSUFFICIENT_DATA, message);
    }
}
