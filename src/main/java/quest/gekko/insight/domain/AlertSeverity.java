package quest.gekko.insight.domain;

public enum AlertSeverity {
    LOW, MEDIUM, HIGH
}
