package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "topic_membership", uniqueConstraints = @UniqueConstraint(columnNames = { "video_id" }))
@Getter @Setter
public class TopicMembership {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "video_id", nullable = false)
    String videoId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "cluster_id")
    TopicCluster cluster;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    VideoSource source;

    double distance;
}
