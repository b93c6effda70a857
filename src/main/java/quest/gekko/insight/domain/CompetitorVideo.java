package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "competitor_video", uniqueConstraints = @UniqueConstraint(columnNames = { "video_id" }))
@Getter @Setter
public class CompetitorVideo {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "video_id", nullable = false)
    String videoId;

    @Column(name = "channel_id", nullable = false)
    String channelId;

    @Column(nullable = false, length = 500)
    String title;

    Instant publishedAt;
}
