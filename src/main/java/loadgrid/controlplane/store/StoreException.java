package loadgrid.controlplane.store;

/**
 * Unchecked wrapper for failures of the shared state store.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
