package heartdisease.etl.repository;

import heartdisease.etl.model.EtlRun;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for EtlRun entity
 */
@Repository
public interface EtlRunRepository extends JpaRepository<EtlRun, Long> {

    Optional<EtlRun> findByRunId(UUID runId);

    /**
     * Latest runs first
     */
    List<EtlRun> findAllByOrderByCreatedAtDesc();

    List<EtlRun> findByStatusOrderByCreatedAtDesc(EtlRun.Status status);

    long countByStatus(EtlRun.Status status);
}
