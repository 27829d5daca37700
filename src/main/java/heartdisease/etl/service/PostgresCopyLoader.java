package heartdisease.etl.service;

import heartdisease.etl.config.EtlConfig;
import heartdisease.etl.exception.LoadException;
import heartdisease.etl.model.DataTable;
import heartdisease.etl.schema.ColumnSpec;
import heartdisease.etl.schema.HeartDiseaseSchema;
import org.postgresql.copy.CopyManager;
import org.postgresql.core.BaseConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.StringReader;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Service responsible for loading the validated table with PostgreSQL COPY.
 *
 * Handles:
 * - Choosing the columns the target table declares (schema columns plus lineage)
 * - Converting rows to tab-delimited COPY lines
 * - Sending the rows in fixed-size batches over one connection
 *
 * All batches run in one transaction: either every row is loaded or none is.
 * Columns the table does not declare (e.g. unknown CSV columns) are not written.
 */
@Service
public class PostgresCopyLoader {

    private static final Logger logger = LoggerFactory.getLogger(PostgresCopyLoader.class);

    private final DataSource dataSource;
    private final EtlConfig etlConfig;
    private final HeartDiseaseTableManager tableManager;

    public PostgresCopyLoader(DataSource dataSource, EtlConfig etlConfig, HeartDiseaseTableManager tableManager) {
        this.dataSource = dataSource;
        this.etlConfig = etlConfig;
        this.tableManager = tableManager;
    }

    /**
     * Load the table into the configured target table.
     *
     * @param table  validated table with lineage columns
     * @param schema schema the table was transformed against
     * @return number of rows loaded
     * @throws LoadException if table creation or any COPY batch fails
     */
    public long load(DataTable table, HeartDiseaseSchema schema) {
        EtlConfig.Load settings = etlConfig.getLoad();
        String tableName = settings.getTableName();

        if (settings.isCreateTable()) {
            tableManager.createTableIfNotExists(tableName, schema);
        }

        if (table.getRowCount() == 0) {
            logger.warn("No rows to load into {}", tableName);
            return 0;
        }

        List<String> columns = selectColumns(table, schema);
        String copyCommand = buildCopyCommand(tableName, columns);
        List<String> batches = buildBatches(table, columns, settings.getBatchSize());
        logger.info("Loading {} records into table {} in {} chunks", table.getRowCount(), tableName, batches.size());
        logger.debug("Using COPY command: {}", copyCommand);

        long recordCount = 0;
        try (Connection connection = dataSource.getConnection()) {
            boolean autoCommit = connection.getAutoCommit();
            connection.setAutoCommit(false);
            try {
                CopyManager copyManager = createCopyManager(connection);
                for (int i = 0; i < batches.size(); i++) {
                    recordCount += copyBatch(copyManager, copyCommand, batches.get(i));
                    logger.info("Loaded chunk {}/{}", i + 1, batches.size());
                }
                connection.commit();
            } catch (SQLException | IOException | RuntimeException e) {
                rollback(connection, e);
                throw e;
            } finally {
                connection.setAutoCommit(autoCommit);
            }
        } catch (SQLException | IOException e) {
            logger.error("Error loading data into {}: {}", tableName, e.getMessage(), e);
            throw new LoadException("Failed to load data into " + tableName + ": " + e.getMessage(), e);
        }

        logger.info("Successfully loaded {} records into table {}", recordCount, tableName);
        return recordCount;
    }

    /**
     * Columns to write: declared schema columns and lineage columns present in the table,
     * in table declaration order.
     */
    static List<String> selectColumns(DataTable table, HeartDiseaseSchema schema) {
        List<String> columns = new ArrayList<>();
        for (ColumnSpec spec : schema.getColumns()) {
            if (table.hasColumn(spec.getName())) {
                columns.add(spec.getName());
            }
        }
        for (String lineage : List.of(HeartDiseaseSchema.SOURCE, HeartDiseaseSchema.PROCESSED_AT)) {
            if (table.hasColumn(lineage)) {
                columns.add(lineage);
            }
        }
        return columns;
    }

    /**
     * Build PostgreSQL COPY command.
     *
     * PostgreSQL-specific syntax:
     * - COPY FROM STDIN for streaming input
     * - FORMAT CSV with tab delimiter
     * - NULL '' for missing cells
     */
    public static String buildCopyCommand(String tableName, List<String> columns) {
        HeartDiseaseTableManager.requireIdentifier(tableName);

        StringBuilder copyCommand = new StringBuilder();
        copyCommand.append("COPY ").append(tableName);
        copyCommand.append(" (");
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) copyCommand.append(", ");
            copyCommand.append(columns.get(i));
        }
        copyCommand.append(") FROM STDIN WITH (FORMAT CSV, DELIMITER E'\\t', NULL '')");
        return copyCommand.toString();
    }

    /**
     * Split the table into COPY payloads of at most batchSize lines each.
     *
     * @throws IllegalArgumentException if batchSize is not positive
     */
    static List<String> buildBatches(DataTable table, List<String> columns, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("Batch size must be positive: " + batchSize);
        }
        List<List<Object>> columnValues = new ArrayList<>(columns.size());
        for (String column : columns) {
            columnValues.add(table.getColumn(column));
        }

        List<String> batches = new ArrayList<>();
        StringBuilder batch = new StringBuilder();
        int linesInBatch = 0;
        for (int row = 0; row < table.getRowCount(); row++) {
            for (int i = 0; i < columnValues.size(); i++) {
                if (i > 0) batch.append('\t');
                batch.append(formatValue(columnValues.get(i).get(row)));
            }
            batch.append('\n');
            if (++linesInBatch == batchSize) {
                batches.add(batch.toString());
                batch = new StringBuilder();
                linesInBatch = 0;
            }
        }
        if (linesInBatch > 0) {
            batches.add(batch.toString());
        }
        return batches;
    }

    /**
     * Format one cell for the COPY CSV stream.
     * Missing is the empty field; text containing quotes, tabs or line breaks is quoted.
     */
    static String formatValue(Object value) {
        if (value == null) {
            return "";
        }
        String text = value.toString();
        if (value instanceof String && (text.isEmpty() || text.indexOf('"') >= 0
                || text.indexOf('\t') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0)) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }

    /**
     * Unwrap the pooled connection and open a CopyManager on it.
     */
    protected CopyManager createCopyManager(Connection connection) throws SQLException {
        if (!connection.isWrapperFor(BaseConnection.class)) {
            throw new SQLException("Unable to unwrap connection to PostgreSQL BaseConnection");
        }
        return new CopyManager(connection.unwrap(BaseConnection.class));
    }

    protected long copyBatch(CopyManager copyManager, String copyCommand, String payload)
            throws SQLException, IOException {
        return copyManager.copyIn(copyCommand, new StringReader(payload));
    }

    private static void rollback(Connection connection, Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException rollbackFailure) {
            logger.error("Rollback failed: {}", rollbackFailure.getMessage());
            cause.addSuppressed(rollbackFailure);
        }
    }
}
