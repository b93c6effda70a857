package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/**
 * One orchestrator execution. {@code checkpoint} names the last completed stage and is kept for
 * diagnostics only; a new run always starts from the first stage.
 */
@Entity
@Table(name = "sync_run")
@Getter @Setter
public class SyncRun {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(nullable = false)
    Instant startedAt = Instant.now();

    Instant finishedAt;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    SyncStatus status = SyncStatus.RUNNING;

    String mode;
    String checkpoint;

    @Column(length = 2000)
    String message;
}
