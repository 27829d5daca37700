package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import heartdisease.etl.schema.ColumnSpec;
import heartdisease.etl.schema.HeartDiseaseSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves missing cells column by column.
 *
 * For each column with missing cells, in column order, against the table as it
 * stands after the previous columns were handled:
 * - missing ratio below the threshold: fill with the median (numeric) or mode (other)
 * - otherwise: drop every row where the column is missing
 *
 * A column with no present value has nothing to take a median or mode from and
 * always drops its rows, whatever the threshold.
 */
@Slf4j
public class MissingValueResolver implements TableTransformStep {

    public static final String NAME = "missing-value-resolver";

    private final HeartDiseaseSchema schema;
    private final double missingRatioThreshold;

    public MissingValueResolver(HeartDiseaseSchema schema, double missingRatioThreshold) {
        if (missingRatioThreshold < 0 || missingRatioThreshold > 1) {
            throw new IllegalArgumentException("Missing ratio threshold must be within [0, 1]: "
                    + missingRatioThreshold);
        }
        this.schema = schema;
        this.missingRatioThreshold = missingRatioThreshold;
    }

    @Override
    public DataTable apply(DataTable table) {
        log.info("Handling missing values");

        long totalMissing = table.countMissing();
        if (totalMissing == 0) {
            log.info("No missing values found in the dataset");
            return table;
        }
        log.info("Found {} missing values in the dataset", totalMissing);

        DataTable result = table;
        for (String column : table.getColumnNames()) {
            long missingCount = result.countMissing(column);
            if (missingCount == 0) {
                continue;
            }

            int rowCount = result.getRowCount();
            double missingRatio = (double) missingCount / rowCount;
            log.info("Column '{}' has {} missing values ({})", column, missingCount, percent(missingRatio));

            List<Object> values = result.getColumn(column);
            ColumnSpec spec = schema.find(column).orElse(null);
            Optional<Object> fill = missingRatio < missingRatioThreshold
                    ? ColumnStatistics.imputationValue(spec, values)
                    : Optional.empty();

            if (fill.isPresent()) {
                result = result.withColumn(column, ColumnStatistics.fillMissing(values, fill.get()));
                log.info("Imputed missing values in '{}' with {}: {}", column,
                        isMedian(spec, values) ? "median" : "mode", fill.get());
            } else {
                log.warn("Column '{}' has {} missing values, dropping affected rows", column, percent(missingRatio));
                result = dropMissingRows(result, values);
                log.info("Dropped {} rows with missing values in '{}'", missingCount, column);
            }
        }
        return result;
    }

    private static DataTable dropMissingRows(DataTable table, List<Object> values) {
        List<Integer> keep = new ArrayList<>(values.size());
        for (int row = 0; row < values.size(); row++) {
            if (values.get(row) != null) {
                keep.add(row);
            }
        }
        return table.selectRows(keep);
    }

    private static boolean isMedian(ColumnSpec spec, List<Object> values) {
        return spec != null ? spec.isImputedWithMedian() : ColumnStatistics.isNumericColumn(values);
    }

    private static String percent(double ratio) {
        return String.format(Locale.ROOT, "%.2f%%", ratio * 100);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
