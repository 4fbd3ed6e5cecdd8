package minikv.db;

/**
 * A store operation rejected its input. The message is the full error reply, prefix included.
 */
public class StoreException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public static final String NOT_AN_INTEGER = "ERR value is not an integer or out of range";
    public static final String OVERFLOW = "ERR increment or decrement would overflow";

    public StoreException(String message) {
        super(message);
    }
}
