package space.ketterling.agriweather.db;

/**
 * The backing store failed (connection, SQL, pool exhaustion). Absence of data
 * is never reported with this exception.
 */
public class StoreException extends Exception {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
