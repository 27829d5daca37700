package heartdisease.etl.controller;

import heartdisease.etl.dto.EtlRunDto;
import heartdisease.etl.exception.RunNotFoundException;
import heartdisease.etl.model.EtlRun;
import heartdisease.etl.schema.TargetPolicy;
import heartdisease.etl.service.EtlPipelineService;
import heartdisease.etl.service.EtlRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Controller for pipeline runs.
 * A POST runs the whole pipeline synchronously and returns the finished run.
 */
@RestController
@RequestMapping("/api/v1/etl")
@Tag(name = "ETL Runs", description = "Trigger and inspect Heart Disease ETL runs")
public class EtlController {

    private static final Logger logger = LoggerFactory.getLogger(EtlController.class);

    private final EtlPipelineService pipelineService;
    private final EtlRunService runService;

    public EtlController(EtlPipelineService pipelineService, EtlRunService runService) {
        this.pipelineService = pipelineService;
        this.runService = runService;
    }

    @PostMapping("/runs")
    @Operation(summary = "Run the pipeline",
            description = "Extract, transform and load the dataset; returns the finished run (COMPLETED or FAILED)")
    @ApiResponse(responseCode = "200", description = "Run finished; check status for the outcome")
    @ApiResponse(responseCode = "409", description = "Another run is in progress")
    public ResponseEntity<EtlRunDto> triggerRun(
            @Parameter(description = "Target policy for this run; defaults to etl.transform.target-policy")
            @RequestParam(value = "targetPolicy", required = false) TargetPolicy targetPolicy) {
        logger.info("ETL run requested (target policy: {})", targetPolicy != null ? targetPolicy : "configured");
        EtlRun run = targetPolicy != null
                ? pipelineService.runPipeline(targetPolicy)
                : pipelineService.runPipeline();
        return ResponseEntity.ok(new EtlRunDto(run));
    }

    @GetMapping("/runs/{runId}")
    @Operation(summary = "Get a run")
    @ApiResponse(responseCode = "200", description = "Run found")
    @ApiResponse(responseCode = "404", description = "Unknown run id")
    public ResponseEntity<EtlRunDto> getRun(@PathVariable UUID runId) {
        EtlRun run = runService.findByRunId(runId).orElseThrow(() -> new RunNotFoundException(runId));
        return ResponseEntity.ok(new EtlRunDto(run));
    }

    @GetMapping("/runs")
    @Operation(summary = "List runs", description = "All recorded runs, latest first")
    public ResponseEntity<List<EtlRunDto>> listRuns() {
        List<EtlRunDto> runs = runService.findAll().stream().map(EtlRunDto::new).toList();
        return ResponseEntity.ok(runs);
    }
}
