package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** A title cluster. Gap fields are set only when competitors dominate the cluster. */
@Entity
@Table(name = "topic_cluster")
@Getter @Setter
public class TopicCluster {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false)
    String name;

    @Column(length = 1000)
    String description;

    int memberCount;
    double competitorShare;

    Double gapScore;
    String gapReason;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
