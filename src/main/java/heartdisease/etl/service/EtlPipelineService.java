package heartdisease.etl.service;

import heartdisease.etl.config.EtlConfig;
import heartdisease.etl.exception.RunInProgressException;
import heartdisease.etl.model.DataTable;
import heartdisease.etl.model.EtlRun;
import heartdisease.etl.schema.HeartDiseaseSchema;
import heartdisease.etl.schema.TargetPolicy;
import heartdisease.etl.transformer.StepMetrics;
import heartdisease.etl.transformer.TransformationResult;
import heartdisease.etl.util.CorrelationIdUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs the pipeline end to end: extract, transform, load.
 *
 * Each run is recorded as an EtlRun and logs under its run id (MDC correlationId).
 * Failures never escape: the run is marked FAILED with the error message and returned.
 * The load phase is only reached after the whole transformation succeeded.
 * Only one run executes at a time.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EtlPipelineService {

    private final EtlConfig etlConfig;
    private final HeartDiseaseExtractor extractor;
    private final TransformationPipelineFactory pipelineFactory;
    private final PostgresCopyLoader loader;
    private final EtlRunService runService;

    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * Run the pipeline with the configured target policy.
     */
    public EtlRun runPipeline() {
        return runPipeline(etlConfig.getTransform().getTargetPolicy());
    }

    /**
     * Run the pipeline with the given target policy.
     *
     * @return the finished run, COMPLETED or FAILED
     * @throws RunInProgressException if another run is in progress
     */
    public EtlRun runPipeline(TargetPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Target policy must not be null");
        }
        if (!running.compareAndSet(false, true)) {
            throw new RunInProgressException();
        }
        try {
            EtlRun run = runService.save(new EtlRun(policy, etlConfig.getLoad().getTableName()));
            try (CorrelationIdUtil.Scope ignored = CorrelationIdUtil.openScope(run.getRunId().toString())) {
                return execute(run, policy);
            }
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private EtlRun execute(EtlRun run, TargetPolicy policy) {
        log.info("Starting Heart Disease ETL pipeline (run {}, target policy {})", run.getRunId(), policy);
        run.markAsRunning();
        run = runService.update(run);

        try {
            log.info("Starting extraction phase");
            DataTable raw = extractor.extract();
            log.info("Extracted {} records", raw.getRowCount());

            log.info("Starting transformation phase");
            TransformationResult result = pipelineFactory.getPipeline(policy).transform(raw);
            run.recordTransformation(raw.getRowCount(), result.getOutputRows());
            log.info("Transformed data has {} records", result.getOutputRows());
            for (StepMetrics step : result.getSteps()) {
                log.debug("  {}: {} -> {} rows in {}ms",
                        step.getStepName(), step.getRowsIn(), step.getRowsOut(), step.getDurationMs());
            }
            run = runService.update(run);

            log.info("Starting loading phase");
            long loaded = loader.load(result.getTable(), HeartDiseaseSchema.forPolicy(policy));
            log.info("Loaded {} records into the database", loaded);

            run.markAsCompleted(loaded);
            log.info("ETL pipeline completed successfully in {}ms", run.getProcessingDurationMs());
        } catch (Exception e) {
            log.error("ETL pipeline failed: {}", e.getMessage(), e);
            run.markAsFailed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
        return runService.update(run);
    }
}
