package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "perf_event", indexes = @Index(name = "idx_perf_created_at", columnList = "created_at"))
@Getter @Setter
public class PerfEvent {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false)
    String name;

    long durationMs;

    @Column(name = "created_at", nullable = false)
    Instant createdAt = Instant.now();

    @Column(length = 2000)
    String meta;
}
