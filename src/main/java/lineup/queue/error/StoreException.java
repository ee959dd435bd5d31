package lineup.queue.error;

/**
 * I/O or serialization failure while reading or writing job records.
 * Store writes are never retried automatically by the caller that observed it.
 */
public class StoreException extends QueueException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    public StoreException(String message) {
        super(message);
    }
}
