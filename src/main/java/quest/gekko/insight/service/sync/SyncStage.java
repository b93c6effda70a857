package quest.gekko.insight.service.sync;

/** Pipeline stages in execution order, with the checkpoint label and progress reported on entry. */
public enum SyncStage {
    CHANNEL_PROFILE("channel_profile", 10, "Syncing channel profile..."),
    VIDEO_METADATA("video_metadata", 20, "Syncing video metadata..."),
    CHANNEL_METRICS("channel_metrics", 40, "Syncing channel metrics..."),
    VIDEO_METRICS("video_metrics", 60, "Syncing video metrics..."),
    ADVANCED_ANALYTICS("advanced_analytics", 70, "Calculating nowcast and quality scores..."),
    COMPETITORS("competitors", 80, "Syncing competitors..."),
    INSIGHTS("insights", 95, "Running insight plugins..."),
    COMPLETE("complete", 100, "Sync complete"),
    FAILED("failed", 0, "Sync failed");

    private final String checkpoint;
    private final int progress;
    private final String message;

    SyncStage(String checkpoint, int progress, String message) {
        this.checkpoint = checkpoint;
        this.progress = progress;
        this.message = message;
    }

    public String checkpoint() { return checkpoint; }

    public int progress() { return progress; }

    public String message() { return message; }

    /** Name of the perf event recorded for this stage. */
    public String perfName() {
        return "sync_stage_" + checkpoint;
    }
}
