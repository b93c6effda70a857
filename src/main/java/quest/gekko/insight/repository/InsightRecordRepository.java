package quest.gekko.insight.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.InsightRecord;

import java.util.List;

public interface InsightRecordRepository extends JpaRepository<InsightRecord, Long> {
    List<InsightRecord> findByRunIdOrderByIdAsc(final Long runId);
    List<InsightRecord> findAllByOrderByCreatedAtDesc(final Pageable pageable);
}
