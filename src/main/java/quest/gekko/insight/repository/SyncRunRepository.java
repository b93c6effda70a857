package quest.gekko.insight.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.SyncRun;

import java.util.List;
import java.util.Optional;

public interface SyncRunRepository extends JpaRepository<SyncRun, Long> {
    Optional<SyncRun> findTopByOrderByStartedAtDesc();
    List<SyncRun> findAllByOrderByStartedAtDesc(final Pageable pageable);
}
