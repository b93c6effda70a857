package quest.gekko.insight.service.sync;

import java.util.List;

public record SyncResult(
        long runId,
        String channelId,
        int videos,
        int channelDays,
        int videoDays,
        int competitorVideos,
        int insights,
        int alerts,
        List<String> failedPlugins) {
}
