package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "competitor_channel", uniqueConstraints = @UniqueConstraint(columnNames = { "channel_id" }))
@Getter @Setter
public class CompetitorChannel {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "channel_id", nullable = false)
    String channelId;

    String title;
    String customUrl;
    Long subscriberCount;

    @Column(nullable = false)
    Instant addedAt = Instant.now();
}
