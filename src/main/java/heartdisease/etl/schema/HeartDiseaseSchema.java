package heartdisease.etl.schema;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Fixed column contract for the UCI Heart Disease dataset.
 *
 * This is the single source of truth consulted by type coercion, missing-value
 * resolution, validation and table creation. The column set is hardcoded for this
 * one dataset shape; nothing here is inferred from the data.
 *
 * Columns that are not declared here are carried through the pipeline untouched
 * (apart from name normalization) and are not persisted.
 */
public final class HeartDiseaseSchema {

    public static final String RAW_TARGET = "num";
    public static final String TARGET = "target";
    public static final String HAS_DISEASE = "has_disease";
    public static final String SOURCE = "source";
    public static final String PROCESSED_AT = "processed_at";

    private static final Set<Long> BINARY_VALUES = Set.of(0L, 1L);
    private static final Set<Long> SEVERITY_VALUES = Set.of(0L, 1L, 2L, 3L, 4L);

    private final TargetPolicy targetPolicy;
    private final Map<String, ColumnSpec> columns;

    private HeartDiseaseSchema(TargetPolicy targetPolicy, Map<String, ColumnSpec> columns) {
        this.targetPolicy = targetPolicy;
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static HeartDiseaseSchema forPolicy(TargetPolicy policy) {
        LinkedHashMap<String, ColumnSpec> specs = new LinkedHashMap<>();

        add(specs, ColumnSpec.builder().name("age").type(SemanticType.INTEGER)
                .range(NumericRange.closed(0, 120)).required(true)
                .description("Age in years"));
        add(specs, ColumnSpec.builder().name("sex").type(SemanticType.BOOLEAN).required(true)
                .description("Sex (true = male; false = female)"));
        add(specs, ColumnSpec.builder().name("cp").type(SemanticType.INTEGER)
                .categories(Set.of(1L, 2L, 3L, 4L))
                .description("Chest pain type (1-4)"));
        add(specs, ColumnSpec.builder().name("trestbps").type(SemanticType.INTEGER)
                .range(NumericRange.closed(0, 300))
                .description("Resting blood pressure in mm Hg"));
        add(specs, ColumnSpec.builder().name("chol").type(SemanticType.INTEGER)
                .range(NumericRange.closed(0, 600))
                .description("Serum cholesterol in mg/dl"));
        add(specs, ColumnSpec.builder().name("fbs").type(SemanticType.BOOLEAN)
                .description("Fasting blood sugar > 120 mg/dl"));
        add(specs, ColumnSpec.builder().name("restecg").type(SemanticType.INTEGER)
                .categories(Set.of(0L, 1L, 2L))
                .description("Resting electrocardiographic results (0-2)"));
        add(specs, ColumnSpec.builder().name("thalach").type(SemanticType.INTEGER)
                .range(NumericRange.closed(0, 250))
                .description("Maximum heart rate achieved"));
        add(specs, ColumnSpec.builder().name("exang").type(SemanticType.BOOLEAN)
                .description("Exercise induced angina"));
        add(specs, ColumnSpec.builder().name("oldpeak").type(SemanticType.FLOAT)
                .range(NumericRange.closed(0, 10))
                .description("ST depression induced by exercise relative to rest"));
        add(specs, ColumnSpec.builder().name("slope").type(SemanticType.INTEGER)
                .range(NumericRange.closed(1, 3))
                .description("Slope of the peak exercise ST segment (1-3)"));
        add(specs, ColumnSpec.builder().name("ca").type(SemanticType.INTEGER)
                .range(NumericRange.closed(0, 3))
                .description("Number of major vessels colored by fluoroscopy (0-3)"));
        add(specs, ColumnSpec.builder().name("thal").type(SemanticType.INTEGER)
                .range(NumericRange.closed(3, 7))
                .description("Thalassemia (3 = normal; 6 = fixed defect; 7 = reversible defect)"));

        if (policy == TargetPolicy.MULTI_CLASS) {
            add(specs, ColumnSpec.builder().name(TARGET).type(SemanticType.INTEGER)
                    .range(NumericRange.closed(0, 4)).categories(SEVERITY_VALUES).required(true)
                    .description("Heart disease severity (0 = none, 1-4 = disease)"));
            add(specs, ColumnSpec.builder().name(HAS_DISEASE).type(SemanticType.INTEGER)
                    .categories(BINARY_VALUES)
                    .description("Presence of heart disease (0 = no, 1 = yes)"));
        } else {
            add(specs, ColumnSpec.builder().name(TARGET).type(SemanticType.INTEGER)
                    .categories(BINARY_VALUES).required(true)
                    .description("Diagnosis of heart disease (0 = no, 1 = yes)"));
        }

        return new HeartDiseaseSchema(policy, specs);
    }

    private static void add(Map<String, ColumnSpec> specs, ColumnSpec.ColumnSpecBuilder builder) {
        ColumnSpec spec = builder.build();
        specs.put(spec.getName(), spec);
    }

    public TargetPolicy getTargetPolicy() {
        return targetPolicy;
    }

    /**
     * Declared columns in persistence order.
     */
    public Collection<ColumnSpec> getColumns() {
        return columns.values();
    }

    /**
     * Columns of the persisted table, identical under both target policies so that one
     * table accepts runs of either. A binary run leaves {@code has_disease} empty.
     */
    public List<ColumnSpec> getStorageColumns() {
        List<ColumnSpec> storage = new ArrayList<>(columns.values());
        if (!declares(HAS_DISEASE)) {
            storage.add(forPolicy(TargetPolicy.MULTI_CLASS).find(HAS_DISEASE).orElseThrow());
        }
        return storage;
    }

    public Optional<ColumnSpec> find(String columnName) {
        return Optional.ofNullable(columns.get(columnName));
    }

    public boolean declares(String columnName) {
        return columns.containsKey(columnName);
    }
}
