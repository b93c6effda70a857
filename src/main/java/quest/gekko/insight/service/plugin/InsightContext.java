package quest.gekko.insight.service.plugin;

import quest.gekko.insight.util.DateRange;

public record InsightContext(long runId, String entityId, DateRange range, InsightDataAccess data) {
}
