package heartdisease.etl.service;

import heartdisease.etl.exception.LoadException;
import heartdisease.etl.schema.ColumnSpec;
import heartdisease.etl.schema.HeartDiseaseSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Service responsible for the target table DDL.
 *
 * Table layout:
 * - id: identity primary key
 * - one column per storage column, SQL type from the semantic type, NOT NULL when required
 *   (the same columns whatever the target policy, so an existing table fits every run)
 * - source: lineage tag (NOT NULL)
 * - processed_at: lineage timestamp (NOT NULL)
 */
@Service
public class HeartDiseaseTableManager {

    private static final Logger logger = LoggerFactory.getLogger(HeartDiseaseTableManager.class);

    // PostgreSQL identifier limit
    private static final int POSTGRESQL_MAX_IDENTIFIER_LENGTH = 63;
    private static final Pattern IDENTIFIER = Pattern.compile("[a-z_][a-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;

    public HeartDiseaseTableManager(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Create the table and its column comments if the table does not exist yet.
     *
     * @throws LoadException if the DDL fails
     */
    public void createTableIfNotExists(String tableName, HeartDiseaseSchema schema) {
        String createTableSql = buildCreateTableSql(tableName, schema);
        logger.info("Ensuring table {} exists", tableName);
        logger.debug("Create table SQL: {}", createTableSql);

        try {
            jdbcTemplate.execute(createTableSql);
            for (String commentSql : buildColumnComments(tableName, schema)) {
                jdbcTemplate.execute(commentSql);
            }
        } catch (DataAccessException e) {
            logger.error("Failed to create table {}: {}", tableName, e.getMessage(), e);
            throw new LoadException("Failed to create table " + tableName, e);
        }
    }

    /**
     * Build CREATE TABLE IF NOT EXISTS for the schema.
     *
     * @throws IllegalArgumentException if the table name is not a plain lower-case identifier
     */
    public static String buildCreateTableSql(String tableName, HeartDiseaseSchema schema) {
        requireIdentifier(tableName);

        StringBuilder sql = new StringBuilder();
        sql.append("CREATE TABLE IF NOT EXISTS ").append(tableName).append(" (\n");
        sql.append("    id INTEGER GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY");
        for (ColumnSpec spec : schema.getStorageColumns()) {
            sql.append(",\n    ").append(spec.getName()).append(' ').append(spec.getType().getSqlType());
            if (spec.isRequired()) {
                sql.append(" NOT NULL");
            }
        }
        sql.append(",\n    ").append(HeartDiseaseSchema.SOURCE).append(" VARCHAR(255) NOT NULL");
        sql.append(",\n    ").append(HeartDiseaseSchema.PROCESSED_AT).append(" TIMESTAMP NOT NULL");
        sql.append("\n)");
        return sql.toString();
    }

    static List<String> buildColumnComments(String tableName, HeartDiseaseSchema schema) {
        List<String> comments = new ArrayList<>();
        for (ColumnSpec spec : schema.getStorageColumns()) {
            if (spec.getDescription() != null) {
                comments.add("COMMENT ON COLUMN " + tableName + "." + spec.getName()
                        + " IS '" + spec.getDescription().replace("'", "''") + "'");
            }
        }
        comments.add("COMMENT ON COLUMN " + tableName + "." + HeartDiseaseSchema.SOURCE + " IS 'Source of the data'");
        comments.add("COMMENT ON COLUMN " + tableName + "." + HeartDiseaseSchema.PROCESSED_AT
                + " IS 'Timestamp when the record was processed'");
        return comments;
    }

    static void requireIdentifier(String tableName) {
        if (tableName == null || tableName.length() > POSTGRESQL_MAX_IDENTIFIER_LENGTH
                || !IDENTIFIER.matcher(tableName).matches()) {
            throw new IllegalArgumentException("Invalid table name: " + tableName);
        }
    }
}
