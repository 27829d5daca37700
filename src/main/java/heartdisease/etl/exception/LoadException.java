package heartdisease.etl.exception;

/**
 * Failure while persisting the transformed table.
 */
public class LoadException extends RuntimeException {

    public LoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
