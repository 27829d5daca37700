package heartdisease.etl.service;

import heartdisease.etl.model.EtlRun;
import heartdisease.etl.repository.EtlRunRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EtlRunServiceTest {

    @Mock
    private EtlRunRepository repository;

    @InjectMocks
    private EtlRunService service;

    private EtlRun run;

    @BeforeEach
    void setUp() {
        run = new EtlRun();
        run.setId(1L);
    }

    @Test
    void testSave_Success() {
        when(repository.save(any(EtlRun.class))).thenReturn(run);

        EtlRun result = service.save(run);

        assertSame(run, result);
        verify(repository, times(1)).save(run);
    }

    @Test
    void testSave_Exception_ReturnsRunUnsaved() {
        EtlRun fresh = new EtlRun();
        when(repository.save(any(EtlRun.class))).thenThrow(new RuntimeException("DB error"));

        EtlRun result = service.save(fresh);

        assertSame(fresh, result);
        assertNotNull(result.getRunId());
    }

    @Test
    void testUpdate_Exception_ReturnsRunAsIs() {
        run.markAsRunning();
        when(repository.save(any(EtlRun.class))).thenThrow(new RuntimeException("DB error"));

        EtlRun result = service.update(run);

        assertSame(run, result);
        assertTrue(result.isRunning());
    }

    @Test
    void testFindByRunId() {
        when(repository.findByRunId(run.getRunId())).thenReturn(Optional.of(run));

        assertEquals(Optional.of(run), service.findByRunId(run.getRunId()));
    }

    @Test
    void testFindByRunId_Exception_ReturnsEmpty() {
        when(repository.findByRunId(any())).thenThrow(new RuntimeException("DB error"));

        assertTrue(service.findByRunId(run.getRunId()).isEmpty());
    }

    @Test
    void testFindAll_LatestFirst() {
        EtlRun older = new EtlRun();
        when(repository.findAllByOrderByCreatedAtDesc()).thenReturn(List.of(run, older));

        assertEquals(List.of(run, older), service.findAll());
    }

    @Test
    void testFindAll_Exception_ReturnsEmptyList() {
        when(repository.findAllByOrderByCreatedAtDesc()).thenThrow(new RuntimeException("DB error"));

        assertTrue(service.findAll().isEmpty());
    }

    @Test
    void testFindByStatus() {
        when(repository.findByStatusOrderByCreatedAtDesc(EtlRun.Status.FAILED)).thenReturn(List.of(run));

        assertEquals(1, service.findByStatus(EtlRun.Status.FAILED).size());
    }
}
