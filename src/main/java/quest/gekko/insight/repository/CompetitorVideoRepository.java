package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.CompetitorVideo;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface CompetitorVideoRepository extends JpaRepository<CompetitorVideo, Long> {
    Optional<CompetitorVideo> findByVideoId(final String videoId);
    List<CompetitorVideo> findByVideoIdIn(final Collection<String> videoIds);
}
