package quest.gekko.insight.service.plugin;

import quest.gekko.insight.domain.AlertSeverity;

import java.util.List;

/**
 * One finding of a plugin. {@code evidence} is serialized to JSON as-is. An insight may carry an
 * alert, which is stored alongside it under the same run.
 */
public record Insight(String type, String title, String description, Object evidence, Alert alert) {

    public Insight(String type, String title, String description, Object evidence) {
        this(type, title, description, evidence, null);
    }

    public boolean hasAlert() {
        return alert != null;
    }

    public record Alert(AlertSeverity severity, String message, String entityId, Playbook action) {}

    /** Remediation steps attached to an alert. */
    public record Playbook(String title, List<String> steps) {}
}
