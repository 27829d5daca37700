package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import heartdisease.etl.schema.HeartDiseaseSchema;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;

/**
 * Stamps every row with the source tag and a single run timestamp.
 * Existing {@code source} / {@code processed_at} columns are overwritten in place.
 */
@Slf4j
public class LineageAnnotator implements TableTransformStep {

    public static final String NAME = "lineage-annotator";

    private final String sourceTag;
    private final Clock clock;

    public LineageAnnotator(String sourceTag, Clock clock) {
        this.sourceTag = sourceTag;
        this.clock = clock;
    }

    @Override
    public DataTable apply(DataTable table) {
        log.info("Adding metadata columns");

        LocalDateTime processedAt = LocalDateTime.now(clock);
        int rows = table.getRowCount();

        DataTable result = table
                .withColumn(HeartDiseaseSchema.SOURCE, Collections.nCopies(rows, sourceTag))
                .withColumn(HeartDiseaseSchema.PROCESSED_AT, Collections.nCopies(rows, processedAt));

        log.info("Added metadata columns: '{}' = {}, '{}' = {}",
                HeartDiseaseSchema.SOURCE, sourceTag, HeartDiseaseSchema.PROCESSED_AT, processedAt);
        return result;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
