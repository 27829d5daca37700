package heartdisease.etl.exception;

import java.util.List;

/**
 * Raised when a step needs a column that the table does not have.
 * This is a structural failure: the run is aborted, the column is never invented.
 */
public class MissingColumnException extends RuntimeException {

    private final String columnName;

    public MissingColumnException(String columnName, List<String> availableColumns) {
        super("Required column '" + columnName + "' not found. Available columns: " + availableColumns);
        this.columnName = columnName;
    }

    public String getColumnName() {
        return columnName;
    }
}
