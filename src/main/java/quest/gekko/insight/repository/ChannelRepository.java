package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.Channel;

import java.util.Optional;

public interface ChannelRepository extends JpaRepository<Channel, Long> {
    Optional<Channel> findByChannelId(final String channelId);
    Optional<Channel> findTopByOrderBySyncedAtDesc();
}
