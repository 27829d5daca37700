package heartdisease.etl.controller;

import heartdisease.etl.exception.RunInProgressException;
import heartdisease.etl.model.EtlRun;
import heartdisease.etl.schema.TargetPolicy;
import heartdisease.etl.service.EtlPipelineService;
import heartdisease.etl.service.EtlRunService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class EtlControllerTest {

    @Mock
    private EtlPipelineService pipelineService;

    @Mock
    private EtlRunService runService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new EtlController(pipelineService, runService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static EtlRun completedRun(TargetPolicy policy) {
        EtlRun run = new EtlRun(policy, "heart_disease");
        run.markAsRunning();
        run.recordTransformation(303, 303);
        run.markAsCompleted(303);
        return run;
    }

    @Test
    void testTriggerRun_UsesConfiguredPolicy() throws Exception {
        // Given
        EtlRun run = completedRun(TargetPolicy.MULTI_CLASS);
        when(pipelineService.runPipeline()).thenReturn(run);

        // When / Then
        mockMvc.perform(post("/api/v1/etl/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.runId").value(run.getRunId().toString()))
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.targetPolicy").value("MULTI_CLASS"))
                .andExpect(jsonPath("$.loadedRecords").value(303));
        verify(pipelineService, never()).runPipeline(any());
    }

    @Test
    void testTriggerRun_WithTargetPolicy() throws Exception {
        // Given
        when(pipelineService.runPipeline(TargetPolicy.BINARY)).thenReturn(completedRun(TargetPolicy.BINARY));

        // When / Then
        mockMvc.perform(post("/api/v1/etl/runs").param("targetPolicy", "BINARY"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.targetPolicy").value("BINARY"));
    }

    @Test
    void testTriggerRun_FailedRunStillReturnsOk() throws Exception {
        // Given
        EtlRun run = new EtlRun();
        run.markAsFailed("Request failed with status 503");
        when(pipelineService.runPipeline()).thenReturn(run);

        // When / Then
        mockMvc.perform(post("/api/v1/etl/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("FAILED"))
                .andExpect(jsonPath("$.errorMessage").value("Request failed with status 503"));
    }

    @Test
    void testTriggerRun_InvalidPolicy_BadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/etl/runs").param("targetPolicy", "TERNARY"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("BAD_REQUEST"));
        verifyNoInteractions(pipelineService);
    }

    @Test
    void testTriggerRun_AlreadyRunning_Conflict() throws Exception {
        // Given
        when(pipelineService.runPipeline()).thenThrow(new RunInProgressException());

        // When / Then
        mockMvc.perform(post("/api/v1/etl/runs"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("RUN_IN_PROGRESS"));
    }

    @Test
    void testUnrelatedStateError_IsNotReportedAsRunInProgress() throws Exception {
        // Given
        when(runService.findAll()).thenThrow(new IllegalStateException("EntityManager is closed"));

        // When / Then
        mockMvc.perform(get("/api/v1/etl/runs"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("INTERNAL_ERROR"));
    }

    @Test
    void testGetRun_Found() throws Exception {
        // Given
        EtlRun run = completedRun(TargetPolicy.MULTI_CLASS);
        when(runService.findByRunId(run.getRunId())).thenReturn(Optional.of(run));

        // When / Then
        mockMvc.perform(get("/api/v1/etl/runs/{runId}", run.getRunId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"));
    }

    @Test
    void testGetRun_Unknown_NotFound() throws Exception {
        // Given
        UUID runId = UUID.randomUUID();
        when(runService.findByRunId(runId)).thenReturn(Optional.empty());

        // When / Then
        mockMvc.perform(get("/api/v1/etl/runs/{runId}", runId))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("RUN_NOT_FOUND"))
                .andExpect(jsonPath("$.message").value("ETL run not found: " + runId));
    }

    @Test
    void testGetRun_MalformedId_BadRequest() throws Exception {
        mockMvc.perform(get("/api/v1/etl/runs/{runId}", "not-a-uuid"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void testListRuns() throws Exception {
        // Given
        when(runService.findAll()).thenReturn(List.of(completedRun(TargetPolicy.BINARY), new EtlRun()));

        // When / Then
        mockMvc.perform(get("/api/v1/etl/runs"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2))
                .andExpect(jsonPath("$[1].status").value("PENDING"));
    }
}
