package heartdisease.etl.model;

import heartdisease.etl.exception.MissingColumnException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * Immutable in-memory table: an ordered set of named columns of equal length.
 *
 * Cell values are one of:
 * - null (missing)
 * - Boolean
 * - Long (integer)
 * - Double (float)
 * - String
 * - LocalDateTime (lineage timestamp)
 *
 * Rows have no identity of their own; they are addressed by position.
 * Every mutating operation returns a new table and leaves the receiver untouched.
 */
public final class DataTable {

    private final LinkedHashMap<String, List<Object>> columns;
    private final int rowCount;

    private DataTable(LinkedHashMap<String, List<Object>> columns, int rowCount) {
        this.columns = columns;
        this.rowCount = rowCount;
    }

    /**
     * Create a table from column data. Values are copied.
     *
     * @param data column name -> values, in column order
     * @return new table
     * @throws IllegalArgumentException if columns differ in length
     */
    public static DataTable of(Map<String, ? extends List<?>> data) {
        LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>();
        int expected = -1;
        for (Map.Entry<String, ? extends List<?>> entry : data.entrySet()) {
            List<Object> values = Collections.unmodifiableList(new ArrayList<>(entry.getValue()));
            if (expected < 0) {
                expected = values.size();
            } else if (values.size() != expected) {
                throw new IllegalArgumentException("Column '" + entry.getKey() + "' has " + values.size()
                        + " values, expected " + expected);
            }
            copy.put(entry.getKey(), values);
        }
        return new DataTable(copy, Math.max(expected, 0));
    }

    /**
     * Create a table from header names and row-major data.
     * Short rows are padded with missing cells, long rows are truncated.
     */
    public static DataTable fromRows(List<String> headers, List<? extends List<?>> rows) {
        LinkedHashMap<String, List<Object>> data = new LinkedHashMap<>();
        for (String header : headers) {
            data.put(header, new ArrayList<>(rows.size()));
        }
        for (List<?> row : rows) {
            for (int i = 0; i < headers.size(); i++) {
                data.get(headers.get(i)).add(i < row.size() ? row.get(i) : null);
            }
        }
        return of(data);
    }

    public static DataTable empty() {
        return new DataTable(new LinkedHashMap<>(), 0);
    }

    public int getRowCount() {
        return rowCount;
    }

    public int getColumnCount() {
        return columns.size();
    }

    public List<String> getColumnNames() {
        return List.copyOf(columns.keySet());
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * @throws MissingColumnException if the column does not exist
     */
    public List<Object> getColumn(String name) {
        List<Object> values = columns.get(name);
        if (values == null) {
            throw new MissingColumnException(name, getColumnNames());
        }
        return values;
    }

    public Object getValue(int row, String column) {
        return getColumn(column).get(row);
    }

    /**
     * Row view in column order.
     */
    public List<Object> getRow(int row) {
        if (row < 0 || row >= rowCount) {
            throw new IndexOutOfBoundsException("Row " + row + " out of range [0, " + rowCount + ")");
        }
        List<Object> values = new ArrayList<>(columns.size());
        for (List<Object> column : columns.values()) {
            values.add(column.get(row));
        }
        return values;
    }

    public long countMissing(String column) {
        return getColumn(column).stream().filter(Objects::isNull).count();
    }

    public long countMissing() {
        long total = 0;
        for (String name : columns.keySet()) {
            total += countMissing(name);
        }
        return total;
    }

    /**
     * Replace an existing column in place, or append a new one at the end.
     *
     * @throws IllegalArgumentException if the value count does not match the row count
     */
    public DataTable withColumn(String name, List<?> values) {
        if (!columns.isEmpty() && values.size() != rowCount) {
            throw new IllegalArgumentException("Column '" + name + "' has " + values.size()
                    + " values, table has " + rowCount + " rows");
        }
        LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.put(name, Collections.unmodifiableList(new ArrayList<>(values)));
        return new DataTable(copy, values.size());
    }

    /**
     * Drop a column. Dropping an absent column returns this table.
     */
    public DataTable withoutColumn(String name) {
        if (!columns.containsKey(name)) {
            return this;
        }
        LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>(columns);
        copy.remove(name);
        return new DataTable(copy, copy.isEmpty() ? 0 : rowCount);
    }

    /**
     * Rename every column through the given function, keeping order.
     * When two columns map to the same name the later one wins the slot of the earlier.
     */
    public DataTable renameColumns(UnaryOperator<String> renamer) {
        LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            copy.put(renamer.apply(entry.getKey()), entry.getValue());
        }
        return new DataTable(copy, rowCount);
    }

    /**
     * Keep only the given row positions, in the given order.
     */
    public DataTable selectRows(List<Integer> rowIndexes) {
        LinkedHashMap<String, List<Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : columns.entrySet()) {
            List<Object> source = entry.getValue();
            List<Object> selected = new ArrayList<>(rowIndexes.size());
            for (Integer index : rowIndexes) {
                selected.add(source.get(index));
            }
            copy.put(entry.getKey(), Collections.unmodifiableList(selected));
        }
        return new DataTable(copy, rowIndexes.size());
    }

    /**
     * Content equality ignoring the given columns.
     */
    public boolean contentEquals(DataTable other, String... ignoredColumns) {
        List<String> ignored = List.of(ignoredColumns);
        List<String> mine = new ArrayList<>(getColumnNames());
        List<String> theirs = new ArrayList<>(other.getColumnNames());
        mine.removeAll(ignored);
        theirs.removeAll(ignored);
        if (!mine.equals(theirs) || rowCount != other.rowCount) {
            return false;
        }
        for (String name : mine) {
            if (!columns.get(name).equals(other.columns.get(name))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataTable)) return false;
        DataTable that = (DataTable) o;
        return rowCount == that.rowCount && columns.equals(that.columns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns, rowCount);
    }

    @Override
    public String toString() {
        return "DataTable{rows=" + rowCount + ", columns=" + columns.keySet() + "}";
    }
}
