package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.MomentumRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface MomentumRecordRepository extends JpaRepository<MomentumRecord, Long> {
    Optional<MomentumRecord> findByVideoIdAndMetricDate(final String videoId, final LocalDate metricDate);
    List<MomentumRecord> findByHitTrueAndMetricDateGreaterThanEqualOrderByVelocity24hDesc(final LocalDate since);
}
