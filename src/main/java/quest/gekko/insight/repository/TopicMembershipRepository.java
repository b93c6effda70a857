package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.TopicMembership;

import java.util.Optional;

public interface TopicMembershipRepository extends JpaRepository<TopicMembership, Long> {
    Optional<TopicMembership> findByVideoId(final String videoId);
}
