package space.ketterling.agriweather.error;

public class NotFoundException extends WeatherEngineException {
    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
