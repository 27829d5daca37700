package heartdisease.etl.model;

import heartdisease.etl.schema.TargetPolicy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EtlRunTest {

    @Test
    void testNewRun_IsPendingWithZeroCounts() {
        EtlRun run = new EtlRun(TargetPolicy.BINARY, "heart_disease");

        assertNotNull(run.getRunId());
        assertEquals(EtlRun.Status.PENDING, run.getStatus());
        assertEquals(TargetPolicy.BINARY, run.getTargetPolicy());
        assertEquals(0L, run.getLoadedRecords());
        assertNull(run.getStartedAt());
    }

    @Test
    void testRunsGetDistinctIds() {
        assertNotEquals(new EtlRun().getRunId(), new EtlRun().getRunId());
    }

    @Test
    void testMarkAsRunningThenCompleted() {
        EtlRun run = new EtlRun();

        run.markAsRunning();
        assertTrue(run.isRunning());
        assertNotNull(run.getStartedAt());

        run.recordTransformation(303, 297);
        run.markAsCompleted(297);

        assertTrue(run.isCompleted());
        assertEquals(303L, run.getExtractedRecords());
        assertEquals(297L, run.getTransformedRecords());
        assertEquals(6L, run.getRowsDropped());
        assertEquals(297L, run.getLoadedRecords());
        assertNotNull(run.getCompletedAt());
        assertNotNull(run.getProcessingDurationMs());
        assertTrue(run.getProcessingDurationMs() >= 0);
    }

    @Test
    void testMarkAsFailed() {
        EtlRun run = new EtlRun();
        run.markAsRunning();

        run.markAsFailed("connection refused");

        assertTrue(run.isFailed());
        assertFalse(run.isCompleted());
        assertEquals("connection refused", run.getErrorMessage());
        assertNotNull(run.getProcessingDurationMs());
    }

    @Test
    void testMarkAsFailedBeforeStart_HasNoDuration() {
        EtlRun run = new EtlRun();

        run.markAsFailed("boom");

        assertNull(run.getProcessingDurationMs());
    }
}
