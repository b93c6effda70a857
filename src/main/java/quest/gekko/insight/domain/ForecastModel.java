package quest.gekko.insight.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;

/** A trained model variant. At most one row per {@code modelType} is active. */
@Entity
@Table(name = "forecast_model", uniqueConstraints = @UniqueConstraint(columnNames = { "model_id" }))
@Getter @Setter
public class ForecastModel {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "model_id", nullable = false)
    String modelId;

    @Column(name = "model_type", nullable = false)
    String modelType;

    @Column(nullable = false)
    String modelName;

    String modelVersion;
    Instant trainedAt;

    double smape;
    double mae;
    int residualsCount;

    @Column(length = 2000)
    String metricsJson;

    @Column(name = "active", nullable = false)
    boolean active;
}
