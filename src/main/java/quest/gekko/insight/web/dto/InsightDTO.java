package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.InsightRecord;

import java.time.Instant;

public record InsightDTO(Long id, Long runId, String type, String title, String description,
                         String evidenceJson, Instant createdAt) {

    public static InsightDTO from(InsightRecord r) {
        return new InsightDTO(r.getId(), r.getRunId(), r.getInsightType(), r.getTitle(), r.getDescription(),
                r.getEvidenceJson(), r.getCreatedAt());
    }
}
