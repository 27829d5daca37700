package heartdisease.etl.transformer;

import heartdisease.etl.exception.MissingColumnException;
import heartdisease.etl.model.DataTable;
import heartdisease.etl.schema.ColumnSpec;
import heartdisease.etl.schema.HeartDiseaseSchema;
import heartdisease.etl.schema.TargetPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Casts declared columns to their semantic types.
 *
 * - BOOLEAN: any present value becomes true/false, missing stays missing
 * - INTEGER: parsed to Long, fractional input rounded
 * - FLOAT: parsed to Double
 * - target: collapsed to 0/1 (BINARY) or kept as 0-4 with a derived has_disease column (MULTI_CLASS)
 *
 * Unparsable cells become missing; nothing in this step raises for bad data.
 * The only failure is a required column that does not exist at all.
 */
@Slf4j
public class TypeCoercer implements TableTransformStep {

    public static final String NAME = "type-coercer";

    private final HeartDiseaseSchema schema;

    public TypeCoercer(HeartDiseaseSchema schema) {
        this.schema = schema;
    }

    @Override
    public DataTable apply(DataTable table) {
        log.info("Converting data types");
        checkRequiredColumns(table);

        DataTable result = table;
        for (ColumnSpec spec : schema.getColumns()) {
            String name = spec.getName();
            if (HeartDiseaseSchema.TARGET.equals(name) || HeartDiseaseSchema.HAS_DISEASE.equals(name)
                    || !result.hasColumn(name)) {
                continue;
            }
            result = coerceColumn(result, spec);
        }

        if (result.hasColumn(HeartDiseaseSchema.TARGET)) {
            result = coerceTarget(result);
        }
        return result;
    }

    private void checkRequiredColumns(DataTable table) {
        for (ColumnSpec spec : schema.getColumns()) {
            if (spec.isRequired() && !table.hasColumn(spec.getName())) {
                log.error("Required column '{}' is missing from the input", spec.getName());
                throw new MissingColumnException(spec.getName(), table.getColumnNames());
            }
        }
    }

    private DataTable coerceColumn(DataTable table, ColumnSpec spec) {
        List<Object> source = table.getColumn(spec.getName());
        List<Object> converted = new ArrayList<>(source.size());
        int degraded = 0;

        for (Object value : source) {
            Object coerced;
            switch (spec.getType()) {
                case BOOLEAN:
                    coerced = ColumnStatistics.toBoolean(value);
                    break;
                case INTEGER:
                    coerced = ColumnStatistics.toLong(ColumnStatistics.toNumber(value));
                    break;
                case FLOAT:
                    Number number = ColumnStatistics.toNumber(value);
                    coerced = number == null ? null : number.doubleValue();
                    break;
                default:
                    throw new IllegalStateException("Unhandled semantic type " + spec.getType());
            }
            if (coerced == null && value != null) {
                degraded++;
            }
            converted.add(coerced);
        }

        if (degraded > 0) {
            log.warn("Column '{}': {} unparsable values set to missing", spec.getName(), degraded);
        }
        log.info("Converted '{}' to {}", spec.getName(), spec.getType().name().toLowerCase(Locale.ROOT));
        return table.withColumn(spec.getName(), converted);
    }

    private DataTable coerceTarget(DataTable table) {
        List<Object> source = table.getColumn(HeartDiseaseSchema.TARGET);
        List<Object> target = new ArrayList<>(source.size());
        for (Object value : source) {
            Number number = ColumnStatistics.toNumber(value);
            if (number == null) {
                target.add(null);
            } else if (schema.getTargetPolicy() == TargetPolicy.BINARY) {
                target.add(number.doubleValue() != 0 ? 1L : 0L);
            } else {
                target.add(ColumnStatistics.toLong(number));
            }
        }
        DataTable result = table.withColumn(HeartDiseaseSchema.TARGET, target);

        if (schema.getTargetPolicy() == TargetPolicy.BINARY) {
            log.info("Converted '{}' to binary (0 = no disease, 1 = disease)", HeartDiseaseSchema.TARGET);
            return result;
        }

        List<Object> hasDisease = deriveHasDisease(target);
        log.info("Converted '{}' to integer (0-4) and added '{}' binary column",
                HeartDiseaseSchema.TARGET, HeartDiseaseSchema.HAS_DISEASE);
        return result.withColumn(HeartDiseaseSchema.HAS_DISEASE, hasDisease);
    }

    /**
     * Presence flag for each severity: 1 when above zero, 0 at zero, missing when missing.
     */
    static List<Object> deriveHasDisease(List<Object> target) {
        List<Object> hasDisease = new ArrayList<>(target.size());
        for (Object severity : target) {
            Number number = ColumnStatistics.toNumber(severity);
            hasDisease.add(number == null ? null : (number.doubleValue() > 0 ? 1L : 0L));
        }
        return hasDisease;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
