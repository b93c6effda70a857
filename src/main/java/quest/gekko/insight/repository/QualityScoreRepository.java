package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.QualityScore;

import java.util.List;
import java.util.Optional;

public interface QualityScoreRepository extends JpaRepository<QualityScore, Long> {
    Optional<QualityScore> findByVideoId(final String videoId);
    List<QualityScore> findAllByOrderByScoreDesc();
}
