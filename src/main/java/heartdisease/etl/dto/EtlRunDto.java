package heartdisease.etl.dto;

import heartdisease.etl.model.EtlRun;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * DTO for run summaries
 */
@Data
@NoArgsConstructor
public class EtlRunDto {

    private UUID runId;
    private String status;
    private String targetPolicy;
    private String tableName;
    private Long extractedRecords;
    private Long transformedRecords;
    private Long loadedRecords;
    private Long rowsDropped;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private Long processingDurationMs;
    private String errorMessage;

    public EtlRunDto(EtlRun run) {
        this.runId = run.getRunId();
        this.status = run.getStatus().name();
        this.targetPolicy = run.getTargetPolicy().name();
        this.tableName = run.getTableName();
        this.extractedRecords = run.getExtractedRecords();
        this.transformedRecords = run.getTransformedRecords();
        this.loadedRecords = run.getLoadedRecords();
        this.rowsDropped = run.getRowsDropped();
        this.startedAt = run.getStartedAt();
        this.completedAt = run.getCompletedAt();
        this.processingDurationMs = run.getProcessingDurationMs();
        this.errorMessage = run.getErrorMessage();
    }
}
