package heartdisease.etl.service;

import heartdisease.etl.model.EtlRun;
import heartdisease.etl.repository.EtlRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for managing ETL run records.
 *
 * Run bookkeeping never fails a run: repository errors are logged and the
 * in-memory run is returned as-is.
 */
@Service
@Transactional
public class EtlRunService {

    private static final Logger logger = LoggerFactory.getLogger(EtlRunService.class);

    private final EtlRunRepository repository;

    @Autowired
    public EtlRunService(EtlRunRepository repository) {
        this.repository = repository;
    }

    /**
     * Save a new run
     */
    public EtlRun save(EtlRun run) {
        try {
            EtlRun saved = repository.save(run);
            logger.info("Saved ETL run with ID {} for run {}", saved.getId(), saved.getRunId());
            return saved;
        } catch (Exception e) {
            logger.error("Error saving ETL run: {}", e.getMessage(), e);
            return run;
        }
    }

    /**
     * Update an existing run
     */
    public EtlRun update(EtlRun run) {
        try {
            EtlRun updated = repository.save(run);
            logger.debug("Updated ETL run {} with status {}", updated.getRunId(), updated.getStatus());
            return updated;
        } catch (Exception e) {
            logger.warn("Could not update ETL run in database: {}", e.getMessage());
            return run;
        }
    }

    @Transactional(readOnly = true)
    public Optional<EtlRun> findByRunId(UUID runId) {
        try {
            return repository.findByRunId(runId);
        } catch (Exception e) {
            logger.error("Error finding ETL run {}: {}", runId, e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * All runs, latest first
     */
    @Transactional(readOnly = true)
    public List<EtlRun> findAll() {
        try {
            return repository.findAllByOrderByCreatedAtDesc();
        } catch (Exception e) {
            logger.error("Error listing ETL runs: {}", e.getMessage(), e);
            return List.of();
        }
    }

    @Transactional(readOnly = true)
    public List<EtlRun> findByStatus(EtlRun.Status status) {
        try {
            return repository.findByStatusOrderByCreatedAtDesc(status);
        } catch (Exception e) {
            logger.error("Error finding ETL runs by status {}: {}", status, e.getMessage(), e);
            return List.of();
        }
    }
}
