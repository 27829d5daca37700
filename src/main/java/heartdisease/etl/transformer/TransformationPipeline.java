package heartdisease.etl.transformer;

import heartdisease.etl.exception.TransformationException;
import heartdisease.etl.model.DataTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered sequence of table steps.
 *
 * Each step receives the previous step's output. There is no branching between
 * steps and no retry: a failing step aborts the run and nothing from it is kept.
 */
@Slf4j
public class TransformationPipeline {

    private final List<TableTransformStep> steps;

    public TransformationPipeline(List<TableTransformStep> steps) {
        this.steps = List.copyOf(steps);
    }

    /**
     * Run every enabled step in order.
     *
     * @param raw the extracted table (not modified)
     * @return final table and per-step metrics
     * @throws TransformationException wrapping whatever the failing step raised
     */
    public TransformationResult transform(DataTable raw) {
        log.info("Starting data transformation of {} records", raw.getRowCount());

        List<StepMetrics> metrics = new ArrayList<>();
        DataTable current = raw;
        for (TableTransformStep step : steps) {
            if (!step.requiresTransformation()) {
                log.debug("Skipping disabled step: {}", step.getName());
                continue;
            }
            long start = System.currentTimeMillis();
            DataTable next;
            try {
                next = step.apply(current);
            } catch (RuntimeException e) {
                log.error("Error transforming data in step {}: {}", step.getName(), e.getMessage(), e);
                throw new TransformationException(step.getName(), e);
            }
            long duration = System.currentTimeMillis() - start;
            metrics.add(new StepMetrics(step.getName(), current.getRowCount(), next.getRowCount(), duration));
            log.debug("Step {} finished in {}ms: {} -> {} rows",
                    step.getName(), duration, current.getRowCount(), next.getRowCount());
            current = next;
        }

        log.info("Transformation completed. Result has {} records", current.getRowCount());
        return new TransformationResult(current, metrics);
    }

    public List<String> getStepNames() {
        List<String> names = new ArrayList<>();
        for (TableTransformStep step : steps) {
            if (step.requiresTransformation()) {
                names.add(step.getName());
            }
        }
        return names;
    }
}
