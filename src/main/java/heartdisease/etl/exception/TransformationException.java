package heartdisease.etl.exception;

/**
 * Wraps any failure raised inside a transformation step.
 * Carries the name of the step so the run log shows where the pipeline stopped.
 */
public class TransformationException extends RuntimeException {

    private final String stepName;

    public TransformationException(String stepName, Throwable cause) {
        super("Transformation step '" + stepName + "' failed: " + cause.getMessage(), cause);
        this.stepName = stepName;
    }

    public String getStepName() {
        return stepName;
    }
}
