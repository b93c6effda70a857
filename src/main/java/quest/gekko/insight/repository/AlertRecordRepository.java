package quest.gekko.insight.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.AlertRecord;

import java.util.List;

public interface AlertRecordRepository extends JpaRepository<AlertRecord, Long> {
    List<AlertRecord> findByRunIdOrderByIdAsc(final Long runId);
    List<AlertRecord> findByAcknowledgedFalseOrderByCreatedAtDesc(final Pageable pageable);
}
