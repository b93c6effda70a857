package quest.gekko.insight.ml.anomaly;

import java.time.LocalDate;

public record Anomaly(LocalDate date, double value, double zScore, Direction direction, Severity severity) {

    public enum Direction { SPIKE, DROP }

    public enum Severity { WARNING, CRITICAL }
}
