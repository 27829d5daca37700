package heartdisease.etl.schema;

/**
 * Declared type of a schema column.
 */
public enum SemanticType {
    BOOLEAN("BOOLEAN"),
    INTEGER("INTEGER"),
    FLOAT("DOUBLE PRECISION");

    private final String sqlType;

    SemanticType(String sqlType) {
        this.sqlType = sqlType;
    }

    public boolean isNumeric() {
        return this != BOOLEAN;
    }

    /**
     * PostgreSQL column type used when the target table is created.
     */
    public String getSqlType() {
        return sqlType;
    }
}
