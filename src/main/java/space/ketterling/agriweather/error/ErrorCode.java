package space.ketterling.agriweather.error;

public enum ErrorCode {
    INVALID_COORDINATES,
    NOT_FOUND,
    INSUFFICIENT_DATA,
    BACKEND_UNAVAILABLE,
    TIMEOUT
}
