package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.AlertRecord;
import quest.gekko.insight.domain.AlertSeverity;

import java.time.Instant;

public record AlertDTO(Long id, Long runId, String type, AlertSeverity severity, String message,
                       String entityId, String actionJson, boolean acknowledged, Instant createdAt) {

    public static AlertDTO from(AlertRecord a) {
        return new AlertDTO(a.getId(), a.getRunId(), a.getAlertType(), a.getSeverity(), a.getMessage(),
                a.getEntityId(), a.getActionJson(), a.isAcknowledged(), a.getCreatedAt());
    }
}
