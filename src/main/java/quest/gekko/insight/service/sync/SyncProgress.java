package quest.gekko.insight.service.sync;

public record SyncProgress(SyncStage stage, int progress, String message) {
}
