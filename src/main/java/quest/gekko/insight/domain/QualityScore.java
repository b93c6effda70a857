package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** Current quality score of a video; one row per video, overwritten on every sync. */
@Entity
@Table(name = "quality_score", uniqueConstraints = @UniqueConstraint(columnNames = { "video_id" }))
@Getter @Setter
public class QualityScore {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "video_id", nullable = false)
    String videoId;

    double score;
    double velocityScore;
    double efficiencyScore;
    double conversionScore;

    @Column(length = 4000)
    String explainJson;

    @Column(nullable = false)
    Instant computedAt = Instant.now();
}
