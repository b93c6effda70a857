package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.CompetitorSnapshot;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

public interface CompetitorSnapshotRepository extends JpaRepository<CompetitorSnapshot, Long> {
    Optional<CompetitorSnapshot> findByVideoIdAndSnapshotDate(final String videoId, final LocalDate snapshotDate);
    List<CompetitorSnapshot> findByVideoIdOrderBySnapshotDateAsc(final String videoId);
}
