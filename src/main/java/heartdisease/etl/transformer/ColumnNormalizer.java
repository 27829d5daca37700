package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import heartdisease.etl.schema.HeartDiseaseSchema;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes column names: lower case, spaces replaced by underscores.
 * The dataset's diagnosis column {@code num} is renamed to {@code target}.
 *
 * Normalizing an already normalized table changes nothing. When several columns
 * normalize to the same name (e.g. {@code Age} and {@code age}) the last one is kept
 * and the collision is logged.
 */
@Slf4j
public class ColumnNormalizer implements TableTransformStep {

    public static final String NAME = "column-normalizer";

    @Override
    public DataTable apply(DataTable table) {
        log.info("Standardizing column names");

        findCollisions(table.getColumnNames()).forEach((name, sources) ->
                log.warn("Columns {} all normalize to '{}', keeping only the last one", sources, name));
        DataTable normalized = table.renameColumns(ColumnNormalizer::normalize);

        if (normalized.hasColumn(HeartDiseaseSchema.RAW_TARGET)) {
            if (normalized.hasColumn(HeartDiseaseSchema.TARGET)) {
                log.warn("Both '{}' and '{}' present, '{}' replaces the existing '{}' column",
                        HeartDiseaseSchema.RAW_TARGET, HeartDiseaseSchema.TARGET,
                        HeartDiseaseSchema.RAW_TARGET, HeartDiseaseSchema.TARGET);
                normalized = normalized.withoutColumn(HeartDiseaseSchema.TARGET);
            }
            normalized = normalized.renameColumns(name ->
                    HeartDiseaseSchema.RAW_TARGET.equals(name) ? HeartDiseaseSchema.TARGET : name);
            log.info("Renamed '{}' column to '{}'", HeartDiseaseSchema.RAW_TARGET, HeartDiseaseSchema.TARGET);
        }

        log.info("Standardized column names: {}", String.join(", ", normalized.getColumnNames()));
        return normalized;
    }

    /**
     * Canonical form of a single column name.
     */
    public static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace(' ', '_');
    }

    /**
     * Normalized names shared by more than one input column, with those columns in input order.
     */
    static Map<String, List<String>> findCollisions(List<String> columnNames) {
        Map<String, List<String>> byName = new LinkedHashMap<>();
        for (String column : columnNames) {
            byName.computeIfAbsent(normalize(column), key -> new ArrayList<>()).add(column);
        }
        byName.values().removeIf(sources -> sources.size() < 2);
        return byName;
    }

    @Override
    public String getName() {
        return NAME;
    }
}
