package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "momentum_record", uniqueConstraints = @UniqueConstraint(columnNames = { "video_id", "metric_date" }),
        indexes = @Index(name = "idx_momentum_hit", columnList = "hit"))
@Getter @Setter
public class MomentumRecord {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "video_id", nullable = false)
    String videoId;

    @Column(name = "metric_date", nullable = false)
    LocalDate metricDate;

    long velocity24h;
    long velocity7d;
    double momentumScore;
    boolean hit;

    double acceleration;

    @Enumerated(EnumType.STRING)
    AccelerationTrend accelerationTrend = AccelerationTrend.STABLE;

    int sustainedDays;
    boolean sustained;
}
