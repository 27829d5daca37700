package heartdisease.etl.model;

import heartdisease.etl.schema.TargetPolicy;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Status and counters of one extract-transform-load run.
 * Maps to the etl_run table in the default schema.
 */
@Entity
@Table(name = "etl_run")
@Getter
@Setter
public class EtlRun {

    public enum Status {
        PENDING, RUNNING, COMPLETED, FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "run_id", nullable = false, unique = true, columnDefinition = "UUID")
    private UUID runId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private Status status;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_policy", nullable = false, length = 20)
    private TargetPolicy targetPolicy;

    @Column(name = "table_name", length = 63)
    private String tableName;

    // Row counts per phase
    @Column(name = "extracted_records")
    private Long extractedRecords;

    @Column(name = "transformed_records")
    private Long transformedRecords;

    @Column(name = "loaded_records")
    private Long loadedRecords;

    @Column(name = "rows_dropped")
    private Long rowsDropped;

    // Timing information
    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "processing_duration_ms")
    private Long processingDurationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    // Audit fields
    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public EtlRun() {
        this.runId = UUID.randomUUID();
        this.status = Status.PENDING;
        this.targetPolicy = TargetPolicy.MULTI_CLASS;
        this.extractedRecords = 0L;
        this.transformedRecords = 0L;
        this.loadedRecords = 0L;
        this.rowsDropped = 0L;
    }

    public EtlRun(TargetPolicy targetPolicy, String tableName) {
        this();
        this.targetPolicy = targetPolicy;
        this.tableName = tableName;
    }

    public void markAsRunning() {
        this.status = Status.RUNNING;
        this.startedAt = LocalDateTime.now();
    }

    public void markAsCompleted(long loadedRecords) {
        this.status = Status.COMPLETED;
        this.loadedRecords = loadedRecords;
        this.completedAt = LocalDateTime.now();
        updateDuration();
    }

    public void markAsFailed(String errorMessage) {
        this.status = Status.FAILED;
        this.completedAt = LocalDateTime.now();
        this.errorMessage = errorMessage;
        updateDuration();
    }

    /**
     * Record the transform outcome; rows dropped is the difference between extracted and transformed.
     */
    public void recordTransformation(long extracted, long transformed) {
        this.extractedRecords = extracted;
        this.transformedRecords = transformed;
        this.rowsDropped = extracted - transformed;
    }

    private void updateDuration() {
        if (this.startedAt != null) {
            this.processingDurationMs = Duration.between(startedAt, completedAt).toMillis();
        }
    }

    public boolean isRunning() {
        return Status.RUNNING.equals(this.status);
    }

    public boolean isCompleted() {
        return Status.COMPLETED.equals(this.status);
    }

    public boolean isFailed() {
        return Status.FAILED.equals(this.status);
    }
}
