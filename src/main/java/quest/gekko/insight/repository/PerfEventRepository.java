package quest.gekko.insight.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.PerfEvent;

import java.util.List;

public interface PerfEventRepository extends JpaRepository<PerfEvent, Long> {
    List<PerfEvent> findAllByOrderByDurationMsDesc(final Pageable pageable);
}
