package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

@Entity
@Table(name = "channel_day_metric", uniqueConstraints = @UniqueConstraint(columnNames = { "channel_id", "metric_date" }))
@Getter @Setter
public class ChannelDayMetric {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "channel_id", nullable = false)
    String channelId;

    @Column(name = "metric_date", nullable = false)
    LocalDate metricDate;

    long views;
    double watchTimeMinutes;
    double avgViewDurationSec;
    long impressions;
    double ctr;
    long subsGained;
    long subsLost;
}
