package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.CompetitorChannel;

import java.util.Optional;

public interface CompetitorChannelRepository extends JpaRepository<CompetitorChannel, Long> {
    Optional<CompetitorChannel> findByChannelId(final String channelId);
}
