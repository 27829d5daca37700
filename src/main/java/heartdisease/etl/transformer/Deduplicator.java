package heartdisease.etl.transformer;

import heartdisease.etl.model.DataTable;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Removes exact full-row duplicates, keeping the first occurrence of each
 * and the relative order of the surviving rows.
 */
@Slf4j
public class Deduplicator implements TableTransformStep {

    public static final String NAME = "deduplicator";

    @Override
    public DataTable apply(DataTable table) {
        log.info("Checking for duplicate records");

        Set<List<Object>> seen = new HashSet<>();
        List<Integer> keep = new ArrayList<>(table.getRowCount());
        for (int row = 0; row < table.getRowCount(); row++) {
            if (seen.add(table.getRow(row))) {
                keep.add(row);
            }
        }

        int duplicates = table.getRowCount() - keep.size();
        if (duplicates == 0) {
            log.info("No duplicate records found");
            return table;
        }
        log.info("Removed {} duplicate records", duplicates);
        return table.selectRows(keep);
    }

    @Override
    public String getName() {
        return NAME;
    }
}
