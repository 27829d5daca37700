package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import lombok.Getter;

import java.util.List;

/**
 * Final table of a pipeline run plus the metrics of every step that ran.
 */
@Getter
public class TransformationResult {

    private final DataTable table;
    private final List<StepMetrics> steps;

    public TransformationResult(DataTable table, List<StepMetrics> steps) {
        this.table = table;
        this.steps = List.copyOf(steps);
    }

    public int getInputRows() {
        return steps.isEmpty() ? table.getRowCount() : steps.get(0).getRowsIn();
    }

    public int getOutputRows() {
        return table.getRowCount();
    }

    public int getRowsDropped(String stepName) {
        return steps.stream()
                .filter(s -> s.getStepName().equals(stepName))
                .mapToInt(StepMetrics::getRowsDropped)
                .sum();
    }
}
