package heartdisease.etl.config;

import heartdisease.etl.schema.TargetPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * ETL pipeline settings.
 *
 * Maps directly to properties in application.properties:
 * - etl.run-on-startup
 * - etl.extract.*
 * - etl.transform.*
 * - etl.load.*
 */
@Configuration
@ConfigurationProperties(prefix = "etl")
@Validated
@Data
public class EtlConfig {

    /** Run the pipeline once when the application is ready, then exit (etl.run-on-startup) */
    private boolean runOnStartup = false;

    // ========================================
    // EXTRACT (etl.extract.*)
    // ========================================

    @Valid
    private Extract extract = new Extract();

    @Data
    public static class Extract {
        /** UCI ML Repository dataset id; 45 is Heart Disease */
        @Min(1)
        private int datasetId = 45;

        /** Dataset metadata endpoint, queried with ?id={datasetId} */
        @NotBlank
        private String apiUrl = "https://archive.ics.uci.edu/api/dataset";

        /** Timeout for each HTTP call */
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);

        /** Raw cell texts read as missing */
        private List<String> missingMarkers = new ArrayList<>(List.of("", "?"));
    }

    // ========================================
    // TRANSFORM (etl.transform.*)
    // ========================================

    @Valid
    private Transform transform = new Transform();

    @Data
    public static class Transform {
        /** How the diagnosis column is stored: MULTI_CLASS (0-4 + has_disease) or BINARY (0/1) */
        @NotNull
        private TargetPolicy targetPolicy = TargetPolicy.MULTI_CLASS;

        /** Columns missing less than this share of rows are imputed, others drop rows */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double missingRatioThreshold = 0.05;

        /** Value written to the lineage 'source' column */
        @NotBlank
        private String sourceTag = "uci_ml_repo";

        /** Enable the date standardization step */
        private boolean standardizeDates = false;
    }

    // ========================================
    // LOAD (etl.load.*)
    // ========================================

    @Valid
    private Load load = new Load();

    @Data
    public static class Load {
        /** Target table in the default schema */
        @NotBlank
        private String tableName = "heart_disease";

        /** Rows per COPY batch */
        @Min(1)
        private int batchSize = 1000;

        /** Create the target table when it does not exist */
        private boolean createTable = true;
    }
}
