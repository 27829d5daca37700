package heartdisease.etl.exception;

import java.util.UUID;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(UUID runId) {
        super("ETL run not found: " + runId);
    }
}
