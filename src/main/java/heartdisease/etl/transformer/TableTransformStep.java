package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;

/**
 * One stage of the transformation pipeline.
 *
 * Implementations are pure: they read the input table, never modify it, and
 * return a new table. The pipeline hands the result to the next step.
 *
 * Contract:
 * - Unparsable or out-of-domain cells are never an error; steps degrade them to
 *   missing and resolve them as documented per step.
 * - A zero-row table passes through without raising.
 * - Anything a step throws aborts the whole run.
 */
public interface TableTransformStep {

    /**
     * Transform the table.
     *
     * @param table input table (not modified)
     * @return the transformed table
     */
    DataTable apply(DataTable table);

    /**
     * Short name used in logs, metrics and error messages.
     */
    String getName();

    /**
     * Check if this step does anything at all.
     *
     * If false the pipeline skips the step entirely.
     *
     * @return true if apply() will be called
     */
    default boolean requiresTransformation() {
        return true;
    }
}
