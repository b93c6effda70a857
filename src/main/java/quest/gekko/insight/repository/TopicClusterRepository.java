package quest.gekko.insight.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import quest.gekko.insight.domain.TopicCluster;

import java.util.List;

public interface TopicClusterRepository extends JpaRepository<TopicCluster, Long> {
    List<TopicCluster> findByGapScoreNotNullOrderByGapScoreDesc();
}
