package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "insight", indexes = @Index(name = "idx_insight_run_id", columnList = "run_id"))
@Getter @Setter
public class InsightRecord {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "run_id", nullable = false)
    Long runId;

    @Column(name = "insight_type", nullable = false)
    String insightType;

    @Column(nullable = false)
    String title;

    @Column(length = 2000)
    String description;

    @Column(length = 20000)
    String evidenceJson;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
