package heartdisease.etl.transformer;

import heartdisease.etl.config.EtlConfig;
import heartdisease.etl.exception.MissingColumnException;
import heartdisease.etl.exception.TransformationException;
import heartdisease.etl.model.DataTable;
import heartdisease.etl.schema.TargetPolicy;
import heartdisease.etl.service.TransformationPipelineFactory;
import heartdisease.etl.util.TestTables;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static heartdisease.etl.util.TestTables.rawHeartDiseaseTable;
import static heartdisease.etl.util.TestTables.rawTable;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End-to-end behaviour of the step sequence on small raw tables.
 */
class TransformationPipelineTest {

    private static TransformationPipeline pipeline(TargetPolicy policy, Clock clock) {
        return new TransformationPipelineFactory(new EtlConfig(), clock).getPipeline(policy);
    }

    private static TransformationPipeline pipeline(TargetPolicy policy) {
        return pipeline(policy, TestTables.FIXED_CLOCK);
    }

    @Test
    void testOutOfDomainCategory_ReplacedByModeOfValidValues_MultiClass() {
        DataTable raw = rawTable("age,sex,cp,num",
                "45,1,9,0",
                "50,0,3,2",
                "55,1,3,1",
                "60,1,2,0");

        DataTable result = pipeline(TargetPolicy.MULTI_CLASS).transform(raw).getTable();

        assertThat(result.getRow(0).subList(0, 4)).containsExactly(45L, true, 3L, 0L);
        assertThat(result.getValue(0, "has_disease")).isEqualTo(0L);
    }

    @Test
    void testOutOfDomainCategory_ReplacedByModeOfValidValues_Binary() {
        DataTable raw = rawTable("age,sex,cp,num",
                "45,1,9,0",
                "50,0,3,2",
                "55,1,3,1",
                "60,1,2,0");

        DataTable result = pipeline(TargetPolicy.BINARY).transform(raw).getTable();

        assertThat(result.getValue(0, "cp")).isEqualTo(3L);
        assertThat(result.getColumn("target")).containsExactly(0L, 1L, 1L, 0L);
        assertThat(result.hasColumn("has_disease")).isFalse();
    }

    @Test
    void testColumnWithSixtyPercentMissing_DropsRows() {
        DataTable raw = rawTable("age,sex,ca,num",
                "40,1,?,0",
                "41,1,1,0",
                "42,0,?,1",
                "43,0,2,1",
                "44,1,?,0");

        TransformationResult result = pipeline(TargetPolicy.BINARY).transform(raw);

        assertThat(result.getTable().getColumn("age")).containsExactly(41L, 43L);
        assertThat(result.getRowsDropped(MissingValueResolver.NAME)).isEqualTo(3);
    }

    @Test
    void testIdenticalRows_OutputContainsOne() {
        DataTable raw = rawTable(TestTables.RAW_HEADER,
                TestTables.RAW_ROW_1, TestTables.RAW_ROW_1, TestTables.RAW_ROW_2);

        DataTable result = pipeline(TargetPolicy.MULTI_CLASS).transform(raw).getTable();

        assertThat(result.getRowCount()).isEqualTo(2);
        assertThat(result.getColumn("chol")).containsExactly(233L, 286L);
    }

    @Test
    void testAllOldpeakMissing_DropsRowsWithoutCrashing() {
        DataTable raw = rawTable("age,sex,oldpeak,num",
                "40,1,,0",
                "41,0,?,1");

        TransformationResult result = pipeline(TargetPolicy.MULTI_CLASS).transform(raw);

        assertThat(result.getOutputRows()).isZero();
        assertThat(result.getTable().getColumnNames()).contains("oldpeak", "source", "processed_at");
    }

    @Test
    void testFullPipeline_LeavesNoMissingValuesAndAddsLineage() {
        DataTable raw = rawTable(TestTables.RAW_HEADER,
                TestTables.RAW_ROW_1, TestTables.RAW_ROW_2, TestTables.RAW_ROW_3,
                "37,1,3,130,250,0,0,187,0,3.5,3,?,3,0",
                "41,0,2,130,204,0,2,172,0,1.4,1,0,3,0");

        DataTable result = pipeline(TargetPolicy.MULTI_CLASS).transform(raw).getTable();

        // 'ca' was 20% missing -> that row is dropped
        assertThat(result.getRowCount()).isEqualTo(4);
        assertThat(result.countMissing()).isZero();
        assertThat(result.getColumnNames()).endsWith("target", "has_disease", "source", "processed_at");
    }

    @Test
    void testRunningOnOwnOutput_IsFixedPointExceptTimestamp() {
        Clock later = Clock.fixed(Instant.parse("2025-01-01T00:00:00Z"), ZoneOffset.UTC);
        for (TargetPolicy policy : TargetPolicy.values()) {
            DataTable once = pipeline(policy).transform(rawHeartDiseaseTable()).getTable();
            DataTable twice = pipeline(policy, later).transform(once).getTable();

            assertThat(twice.contentEquals(once, "processed_at")).as(policy.name()).isTrue();
            assertThat(twice.getValue(0, "processed_at")).isNotEqualTo(once.getValue(0, "processed_at"));
        }
    }

    @Test
    void testOutOfRangeTarget_HasDiseaseMatchesCorrectedTarget() {
        DataTable raw = rawTable("age,sex,num",
                "40,1,0",
                "41,1,0",
                "42,0,0",
                "43,0,7");

        DataTable once = pipeline(TargetPolicy.MULTI_CLASS).transform(raw).getTable();

        assertThat(once.getColumn("target")).containsExactly(0L, 0L, 0L, 0L);
        assertThat(once.getColumn("has_disease")).containsExactly(0L, 0L, 0L, 0L);

        DataTable twice = pipeline(TargetPolicy.MULTI_CLASS).transform(once).getTable();
        assertThat(twice.contentEquals(once, "processed_at")).isTrue();
    }

    @Test
    void testImputedTarget_HasDiseaseMatchesTarget() {
        List<String> rows = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            rows.add((40 + i) + ",1," + (i % 2 == 0 ? "0" : "3"));
        }
        rows.add("70,1,?");

        DataTable result = pipeline(TargetPolicy.MULTI_CLASS)
                .transform(rawTable("age,sex,num", rows.toArray(new String[0]))).getTable();

        List<Object> target = result.getColumn("target");
        List<Object> hasDisease = result.getColumn("has_disease");
        assertThat(result.getRowCount()).isEqualTo(31);
        for (int row = 0; row < target.size(); row++) {
            assertThat(hasDisease.get(row)).isEqualTo((Long) target.get(row) > 0 ? 1L : 0L);
        }
    }

    @Test
    void testExtraColumnsPassThrough() {
        DataTable raw = rawTable("Age,Sex,Patient Note,num", "50,1,stable,0");

        DataTable result = pipeline(TargetPolicy.BINARY).transform(raw).getTable();

        assertThat(result.getValue(0, "patient_note")).isEqualTo("stable");
    }

    @Test
    void testMissingRequiredColumn_AbortsWithStepName() {
        DataTable raw = rawTable("age,num", "50,0");

        assertThatThrownBy(() -> pipeline(TargetPolicy.BINARY).transform(raw))
                .isInstanceOf(TransformationException.class)
                .hasCauseInstanceOf(MissingColumnException.class)
                .satisfies(e -> assertThat(((TransformationException) e).getStepName())
                        .isEqualTo(TypeCoercer.NAME));
    }

    @Test
    void testEmptyTable_PassesThrough() {
        DataTable raw = rawTable(TestTables.RAW_HEADER);

        TransformationResult result = pipeline(TargetPolicy.MULTI_CLASS).transform(raw);

        assertThat(result.getOutputRows()).isZero();
        assertThat(result.getInputRows()).isZero();
    }

    @Test
    void testMetricsListEnabledStepsInOrder() {
        TransformationResult result = pipeline(TargetPolicy.BINARY).transform(rawHeartDiseaseTable());

        assertThat(result.getSteps()).extracting(StepMetrics::getStepName).containsExactly(
                ColumnNormalizer.NAME, TypeCoercer.NAME, MissingValueResolver.NAME,
                DomainValidator.NAME, Deduplicator.NAME, LineageAnnotator.NAME);
        assertThat(result.getInputRows()).isEqualTo(5);
    }

    @Test
    void testStepsDoNotModifyTheirInput() {
        DataTable raw = rawHeartDiseaseTable();
        List<String> before = raw.getColumnNames();

        pipeline(TargetPolicy.MULTI_CLASS).transform(raw);

        assertThat(raw.getColumnNames()).isEqualTo(before);
        assertThat(raw.getValue(0, "num")).isEqualTo("0");
    }
}
