package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "video_day_metric", uniqueConstraints = @UniqueConstraint(columnNames = { "video_id", "metric_date" }),
        indexes = @Index(name = "idx_video_day_metric_date", columnList = "metric_date"))
@Getter @Setter
public class VideoDayMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "video_id", nullable = false)
    String videoId;

    @Column(name = "metric_date", nullable = false)
    LocalDate metricDate;

    long views;
    double watchTimeMinutes;
    double avgViewDurationSec;
    long impressions;
    double ctr;
    long likes;
    long comments;
}
