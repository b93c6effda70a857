package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

@Entity
@Table(name = "alert")
@Getter @Setter
public class AlertRecord {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "run_id", nullable = false)
    Long runId;

    @Column(name = "alert_type", nullable = false)
    String alertType;

    @Enumerated(EnumType.STRING) @Column(nullable = false)
    AlertSeverity severity;

    @Column(nullable = false, length = 1000)
    String message;

    String entityId;

    @Column(length = 4000)
    String actionJson;

    boolean acknowledged;

    @Column(nullable = false)
    Instant createdAt = Instant.now();
}
