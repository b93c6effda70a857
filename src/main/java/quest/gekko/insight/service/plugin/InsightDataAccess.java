package quest.gekko.insight.service.plugin;

import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.domain.TopicCluster;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.service.store.CompetitorHit;
import quest.gekko.insight.util.DateRange;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/** Read-only view of the stored analytics handed to plugins. */
public interface InsightDataAccess {

    List<Video> getAllVideos();

    List<VideoDayMetric> getVideoStats(String videoId, DateRange range);

    List<ChannelDayMetric> getChannelStats(String channelId, DateRange range);

    List<CompetitorHit> getCompetitorHits(LocalDate since);

    List<TopicCluster> getTopicGaps();

    Optional<Long> getTopicClusterId(String videoId);
}
