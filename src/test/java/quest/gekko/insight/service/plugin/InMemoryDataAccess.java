package quest.gekko.insight.service.plugin;

import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.domain.TopicCluster;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.service.store.CompetitorHit;
import quest.gekko.insight.util.DateRange;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Plugin test fixture backed by plain collections. */
public class InMemoryDataAccess implements InsightDataAccess {
    public final List<Video> videos = new ArrayList<>();
    public final Map<String, List<VideoDayMetric>> videoStats = new HashMap<>();
    public final List<ChannelDayMetric> channelStats = new ArrayList<>();
    public final List<CompetitorHit> hits = new ArrayList<>();
    public final List<TopicCluster> gaps = new ArrayList<>();
    public final Map<String, Long> clusterOf = new HashMap<>();

    public Video video(String id, String title, Instant publishedAt) {
        Video v = new Video();
        v.setVideoId(id);
        v.setChannelId("UC_owned");
        v.setTitle(title);
        v.setPublishedAt(publishedAt);
        videos.add(v);
        return v;
    }

    public VideoDayMetric videoDay(String videoId, LocalDate day, long views, long likes, long comments) {
        VideoDayMetric m = new VideoDayMetric();
        m.setVideoId(videoId);
        m.setMetricDate(day);
        m.setViews(views);
        m.setLikes(likes);
        m.setComments(comments);
        videoStats.computeIfAbsent(videoId, k -> new ArrayList<>()).add(m);
        return m;
    }

    public ChannelDayMetric channelDay(LocalDate day, long views, long impressions) {
        ChannelDayMetric m = new ChannelDayMetric();
        m.setChannelId("UC_owned");
        m.setMetricDate(day);
        m.setViews(views);
        m.setImpressions(impressions);
        channelStats.add(m);
        return m;
    }

    public TopicCluster gap(long id, String name, double score) {
        TopicCluster cluster = new TopicCluster();
        cluster.setId(id);
        cluster.setName(name);
        cluster.setGapScore(score);
        gaps.add(cluster);
        return cluster;
    }

    @Override
    public List<Video> getAllVideos() {
        return videos;
    }

    @Override
    public List<VideoDayMetric> getVideoStats(String videoId, DateRange range) {
        return videoStats.getOrDefault(videoId, List.of()).stream()
                .filter(m -> !m.getMetricDate().isBefore(range.from()) && !m.getMetricDate().isAfter(range.to()))
                .toList();
    }

    @Override
    public List<ChannelDayMetric> getChannelStats(String channelId, DateRange range) {
        return channelStats.stream()
                .filter(m -> !m.getMetricDate().isBefore(range.from()) && !m.getMetricDate().isAfter(range.to()))
                .toList();
    }

    @Override
    public List<CompetitorHit> getCompetitorHits(LocalDate since) {
        return hits.stream().filter(h -> !h.day().isBefore(since)).toList();
    }

    @Override
    public List<TopicCluster> getTopicGaps() {
        return gaps;
    }

    @Override
    public Optional<Long> getTopicClusterId(String videoId) {
        return Optional.ofNullable(clusterOf.get(videoId));
    }
}
