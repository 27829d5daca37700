package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static heartdisease.etl.util.TestTables.table;
import static heartdisease.etl.util.TestTables.values;
import static org.assertj.core.api.Assertions.assertThat;

class DeduplicatorTest {

    private final Deduplicator deduplicator = new Deduplicator();

    @Test
    void testIdenticalRows_KeepsExactlyOne() {
        DataTable table = table("age", values(63L, 63L), "sex", values(true, true));

        DataTable result = deduplicator.apply(table);

        assertThat(result.getRowCount()).isEqualTo(1);
    }

    @Test
    void testKeepsFirstOccurrenceAndOrder() {
        DataTable table = table(
                "id", values(1L, 2L, 1L, 3L, 2L),
                "tag", values("a", "b", "a", "c", "x"));

        DataTable result = deduplicator.apply(table);

        assertThat(result.getColumn("id")).containsExactly(1L, 2L, 3L, 2L);
        assertThat(result.getColumn("tag")).containsExactly("a", "b", "c", "x");
    }

    @Test
    void testRowsDifferingInOneColumnAreKept() {
        DataTable table = table("age", values(63L, 63L), "chol", values(200L, 201L));

        assertThat(deduplicator.apply(table).getRowCount()).isEqualTo(2);
    }

    @Test
    void testMissingCellsCompareEqual() {
        DataTable table = table("age", values(63L, 63L), "ca", values(null, null));

        assertThat(deduplicator.apply(table).getRowCount()).isEqualTo(1);
    }

    @Test
    void testResultHasNoDuplicateRows() {
        DataTable table = table("a", values(1L, 1L, 2L, 2L, 1L), "b", values(0L, 0L, 0L, 1L, 0L));

        DataTable result = deduplicator.apply(table);

        Set<List<Object>> seen = new HashSet<>();
        for (int row = 0; row < result.getRowCount(); row++) {
            assertThat(seen.add(result.getRow(row))).isTrue();
        }
    }

    @Test
    void testEmptyTable() {
        assertThat(deduplicator.apply(table("a", List.of())).getRowCount()).isZero();
    }
}
