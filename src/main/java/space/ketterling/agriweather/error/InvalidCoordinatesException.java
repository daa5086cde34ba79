package space.ketterling.agriweather.error;

public class InvalidCoordinatesException extends WeatherEngineException {
    public InvalidCoordinatesException(String message) {
        super(ErrorCode.INVALID_COORDINATES, message);
    }
}
