package heartdisease.etl.exception;

/**
 * Failure while fetching or parsing the raw dataset.
 */
public class ExtractionException extends RuntimeException {

    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
