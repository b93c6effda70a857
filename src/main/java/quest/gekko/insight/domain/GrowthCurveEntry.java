package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "growth_curve", uniqueConstraints = @UniqueConstraint(columnNames = { "cluster_id", "duration_bucket", "day_number" }))
@Getter @Setter
public class GrowthCurveEntry {
    public static final int ALL_CLUSTERS = 0;
    public static final String ALL_DURATIONS = "all";

    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "cluster_id", nullable = false)
    int clusterId;

    @Column(name = "duration_bucket", nullable = false)
    String durationBucket;

    @Column(name = "day_number", nullable = false)
    int dayNumber;

    double medianPct;
    double p25Pct;
    double p75Pct;
}
