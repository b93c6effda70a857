package quest.gekko.insight.provider;

import quest.gekko.insight.util.DateRange;

import java.util.List;
import java.util.Map;

/**
 * Remote source of channel, video and daily analytics data. Failures surface as
 * {@link quest.gekko.insight.error.AppException} with a network, auth or quota code.
 */
public interface DataProvider {

    /** Use {@code "MINE"} for the authenticated channel. */
    ChannelInfo getChannel(String channelId);

    /** Most recent uploads first, at most {@code maxResults}. */
    List<VideoInfo> listVideos(String channelId, int maxResults);

    List<MetricRow> getChannelDailyMetrics(String channelId, DateRange range);

    /** Keyed by video id; every requested id is present, possibly with an empty list. */
    Map<String, List<MetricRow>> getVideoDailyMetrics(List<String> videoIds, DateRange range);

    default ChannelInfo getPublicChannel(String channelId) {
        return getChannel(channelId);
    }

    default List<VideoInfo> getPublicVideos(String channelId, int maxResults) {
        return listVideos(channelId, maxResults);
    }
}
