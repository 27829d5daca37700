package heartdisease.etl.transformer;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Row counts and timing of one executed pipeline step.
 */
@Data
@AllArgsConstructor
public class StepMetrics {

    private String stepName;
    private int rowsIn;
    private int rowsOut;
    private long durationMs;

    public int getRowsDropped() {
        return rowsIn - rowsOut;
    }
}
