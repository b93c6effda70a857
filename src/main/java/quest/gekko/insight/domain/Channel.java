package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** The owned channel whose analytics are synced. */
@Entity
@Table(name = "channel", uniqueConstraints = @UniqueConstraint(columnNames = { "channel_id" }))
@Getter @Setter
public class Channel {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "channel_id", nullable = false)
    String channelId;

    @Column(nullable = false)
    String title;

    Instant createdAt;
    Long subscriberCount;

    @Column(nullable = false)
    Instant syncedAt = Instant.now();
}
