package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDate;

/** Cumulative public view count of a competitor video on one day. */
@Entity
@Table(name = "competitor_snapshot", uniqueConstraints = @UniqueConstraint(columnNames = { "video_id", "snapshot_date" }))
@Getter @Setter
public class CompetitorSnapshot {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "video_id", nullable = false)
    String videoId;

    @Column(name = "snapshot_date", nullable = false)
    LocalDate snapshotDate;

    long viewCount;
}
