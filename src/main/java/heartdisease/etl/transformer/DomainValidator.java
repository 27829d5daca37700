package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import heartdisease.etl.schema.ColumnSpec;
import heartdisease.etl.schema.HeartDiseaseSchema;
import heartdisease.etl.schema.NumericRange;
import heartdisease.etl.schema.SemanticType;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Corrects cells outside their declared domain.
 *
 * Two passes over the declared columns present in the table:
 * 1. numeric ranges (inclusive): out-of-range cells are replaced by the median of the in-range cells
 * 2. category sets: non-member cells are replaced by the mode of the member cells
 *
 * Missing cells are not checked. No rows are dropped and no cell is left missing by
 * this step. When the schema declares {@code has_disease}, it is derived again from the
 * corrected {@code target} so the two always agree. If a column has no valid cell at all, range violations are clamped to
 * the nearest bound and category violations take the smallest allowed value.
 */
@Slf4j
public class DomainValidator implements TableTransformStep {

    public static final String NAME = "domain-validator";

    private final HeartDiseaseSchema schema;

    public DomainValidator(HeartDiseaseSchema schema) {
        this.schema = schema;
    }

    @Override
    public DataTable apply(DataTable table) {
        log.info("Validating data");
        int issues = 0;
        DataTable result = table;

        for (ColumnSpec spec : schema.getColumns()) {
            if (!spec.hasRange() || !result.hasColumn(spec.getName())) {
                continue;
            }
            NumericRange range = spec.getRange();
            Predicate<Object> valid = value -> value instanceof Number
                    && range.contains(((Number) value).doubleValue());
            List<Object> values = result.getColumn(spec.getName());
            int invalid = countInvalid(values, valid);
            if (invalid == 0) {
                continue;
            }
            issues += invalid;
            log.warn("Found {} out-of-range values in '{}' (valid range {})", invalid, spec.getName(), range);

            Optional<Object> median = ColumnStatistics.medianOf(spec, values, valid);
            List<Object> repaired = new ArrayList<>(values.size());
            for (Object value : values) {
                if (value == null || valid.test(value)) {
                    repaired.add(value);
                } else {
                    repaired.add(median.orElseGet(() -> clamp(spec, value)));
                }
            }
            result = result.withColumn(spec.getName(), repaired);
            if (median.isPresent()) {
                log.info("Imputed {} out-of-range values in '{}' with median: {}", invalid, spec.getName(), median.get());
            } else {
                log.warn("No in-range values in '{}', clamped {} values to {}", spec.getName(), invalid, range);
            }
        }

        for (ColumnSpec spec : schema.getColumns()) {
            if (!spec.hasCategories() || !result.hasColumn(spec.getName())) {
                continue;
            }
            Predicate<Object> valid = value -> isMember(spec, value);
            List<Object> values = result.getColumn(spec.getName());
            int invalid = countInvalid(values, valid);
            if (invalid == 0) {
                continue;
            }
            issues += invalid;
            log.warn("Found {} invalid values in '{}' (allowed {})", invalid, spec.getName(), spec.getCategories());

            Object mode = ColumnStatistics.modeOf(values, valid).orElseGet(() -> smallestCategory(spec));
            List<Object> repaired = new ArrayList<>(values.size());
            for (Object value : values) {
                repaired.add(value == null || valid.test(value) ? value : mode);
            }
            result = result.withColumn(spec.getName(), repaired);
            log.info("Imputed {} invalid values in '{}' with mode: {}", invalid, spec.getName(), mode);
        }

        if (schema.declares(HeartDiseaseSchema.HAS_DISEASE) && result.hasColumn(HeartDiseaseSchema.TARGET)) {
            result = rederiveHasDisease(result);
        }

        log.info("Data validation complete: found and fixed {} issues", issues);
        return result;
    }

    private static DataTable rederiveHasDisease(DataTable table) {
        List<Object> derived = TypeCoercer.deriveHasDisease(table.getColumn(HeartDiseaseSchema.TARGET));
        if (table.hasColumn(HeartDiseaseSchema.HAS_DISEASE)) {
            List<Object> current = table.getColumn(HeartDiseaseSchema.HAS_DISEASE);
            int changed = 0;
            for (int row = 0; row < derived.size(); row++) {
                if (!Objects.equals(derived.get(row), current.get(row))) {
                    changed++;
                }
            }
            if (changed > 0) {
                log.info("Re-derived {} '{}' values from corrected '{}'", changed,
                        HeartDiseaseSchema.HAS_DISEASE, HeartDiseaseSchema.TARGET);
            }
        }
        return table.withColumn(HeartDiseaseSchema.HAS_DISEASE, derived);
    }

    private static int countInvalid(List<Object> values, Predicate<Object> valid) {
        int invalid = 0;
        for (Object value : values) {
            if (value != null && !valid.test(value)) {
                invalid++;
            }
        }
        return invalid;
    }

    private static boolean isMember(ColumnSpec spec, Object value) {
        if (!(value instanceof Number)) {
            return false;
        }
        double d = ((Number) value).doubleValue();
        return d == Math.rint(d) && spec.getCategories().contains((long) d);
    }

    private static Object clamp(ColumnSpec spec, Object value) {
        NumericRange range = spec.getRange();
        double bound = range.getMin();
        if (value instanceof Number && ((Number) value).doubleValue() > range.getMax()) {
            bound = range.getMax();
        }
        return spec.getType() == SemanticType.FLOAT ? (Object) bound : (Object) Math.round(bound);
    }

    private static Object smallestCategory(ColumnSpec spec) {
        Long smallest = Collections.min(spec.getCategories());
        return spec.getType() == SemanticType.FLOAT ? (Object) smallest.doubleValue() : (Object) smallest;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
