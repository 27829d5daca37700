package heartdisease.etl.exception;

/**
 * A run was requested while another run is still executing.
 */
public class RunInProgressException extends RuntimeException {

    public RunInProgressException() {
        super("An ETL run is already in progress");
    }
}
