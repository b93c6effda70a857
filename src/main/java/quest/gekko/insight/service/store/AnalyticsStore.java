package quest.gekko.insight.service.store;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insight.domain.Channel;
import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.domain.GrowthCurveEntry;
import quest.gekko.insight.domain.QualityScore;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.ml.nowcast.GrowthCurvePoint;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.VideoInfo;
import quest.gekko.insight.repository.ChannelDayMetricRepository;
import quest.gekko.insight.repository.ChannelRepository;
import quest.gekko.insight.repository.GrowthCurveRepository;
import quest.gekko.insight.repository.QualityScoreRepository;
import quest.gekko.insight.repository.VideoDayMetricRepository;
import quest.gekko.insight.repository.VideoRepository;
import quest.gekko.insight.util.DateRange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Owned-channel dimension and fact tables. Every upsert is keyed on the natural key, so writing
 * the same (entity, day) twice leaves a single row holding the latest values.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class AnalyticsStore {

    private final ChannelRepository channelRepository;
    private final VideoRepository videoRepository;
    private final ChannelDayMetricRepository channelDayRepository;
    private final VideoDayMetricRepository videoDayRepository;
    private final QualityScoreRepository qualityScoreRepository;
    private final GrowthCurveRepository growthCurveRepository;

    @Transactional
    public Channel upsertChannel(ChannelInfo info) {
        Channel channel = channelRepository.findByChannelId(info.id()).orElseGet(Channel::new);
        channel.setChannelId(info.id());
        channel.setTitle(info.title() != null ? info.title() : "Unknown");
        if (info.createdAt() != null) channel.setCreatedAt(info.createdAt());
        channel.setSubscriberCount(info.subscriberCount());
        channel.setSyncedAt(Instant.now());
        return channelRepository.save(channel);
    }

    /** Inserts new videos and refreshes title/duration of known ones in one transaction. */
    @Transactional
    public List<Video> upsertVideos(String channelId, Collection<VideoInfo> videos) {
        Map<String, Video> existing = videoRepository.findByVideoIdIn(videos.stream().map(VideoInfo::id).toList())
                .stream()
                .collect(Collectors.toMap(Video::getVideoId, Function.identity()));

        List<Video> toSave = new ArrayList<>(videos.size());
        for (VideoInfo info : videos) {
            Video video = existing.getOrDefault(info.id(), new Video());
            video.setVideoId(info.id());
            video.setChannelId(channelId);
            video.setTitle(info.title() != null ? info.title() : "");
            if (info.publishedAt() != null) video.setPublishedAt(info.publishedAt());
            video.setDurationSec(info.durationSec());
            toSave.add(video);
        }
        return videoRepository.saveAll(toSave);
    }

    @Transactional
    public int upsertChannelDays(Collection<ChannelDayMetric> facts) {
        for (ChannelDayMetric fact : facts) {
            ChannelDayMetric row = channelDayRepository
                    .findByChannelIdAndMetricDate(fact.getChannelId(), fact.getMetricDate())
                    .orElseGet(ChannelDayMetric::new);
            row.setChannelId(fact.getChannelId());
            row.setMetricDate(fact.getMetricDate());
            row.setViews(fact.getViews());
            row.setWatchTimeMinutes(fact.getWatchTimeMinutes());
            row.setAvgViewDurationSec(fact.getAvgViewDurationSec());
            row.setImpressions(fact.getImpressions());
            row.setCtr(fact.getCtr());
            row.setSubsGained(fact.getSubsGained());
            row.setSubsLost(fact.getSubsLost());
            channelDayRepository.save(row);
        }
        return facts.size();
    }

    @Transactional
    public int upsertVideoDays(Collection<VideoDayMetric> facts) {
        for (VideoDayMetric fact : facts) {
            VideoDayMetric row = videoDayRepository
                    .findByVideoIdAndMetricDate(fact.getVideoId(), fact.getMetricDate())
                    .orElseGet(VideoDayMetric::new);
            row.setVideoId(fact.getVideoId());
            row.setMetricDate(fact.getMetricDate());
            row.setViews(fact.getViews());
            row.setWatchTimeMinutes(fact.getWatchTimeMinutes());
            row.setAvgViewDurationSec(fact.getAvgViewDurationSec());
            row.setImpressions(fact.getImpressions());
            row.setCtr(fact.getCtr());
            row.setLikes(fact.getLikes());
            row.setComments(fact.getComments());
            videoDayRepository.save(row);
        }
        return facts.size();
    }

    /** The owned channel written by the most recent sync. */
    public Optional<Channel> getOwnedChannel() {
        return channelRepository.findTopByOrderBySyncedAtDesc();
    }

    public List<ChannelDayMetric> getChannelStats(String channelId, DateRange range) {
        return channelDayRepository.findByChannelIdAndMetricDateBetweenOrderByMetricDateAsc(channelId, range.from(), range.to());
    }

    public List<VideoDayMetric> getVideoStats(String videoId, DateRange range) {
        return videoDayRepository.findByVideoIdAndMetricDateBetweenOrderByMetricDateAsc(videoId, range.from(), range.to());
    }

    public List<Video> getAllVideos() {
        return videoRepository.findAll();
    }

    /** Single current row per video; earlier scores are overwritten. */
    @Transactional
    public QualityScore upsertQualityScore(QualityScore computed) {
        QualityScore row = qualityScoreRepository.findByVideoId(computed.getVideoId()).orElseGet(QualityScore::new);
        row.setVideoId(computed.getVideoId());
        row.setScore(computed.getScore());
        row.setVelocityScore(computed.getVelocityScore());
        row.setEfficiencyScore(computed.getEfficiencyScore());
        row.setConversionScore(computed.getConversionScore());
        row.setExplainJson(computed.getExplainJson());
        row.setComputedAt(Instant.now());
        return qualityScoreRepository.save(row);
    }

    public List<QualityScore> getQualityRanking() {
        return qualityScoreRepository.findAllByOrderByScoreDesc();
    }

    /** Drops the stored curve for the (cluster, bucket) pair and writes the new points. */
    @Transactional
    public int replaceGrowthCurve(int clusterId, String durationBucket, List<GrowthCurvePoint> points) {
        growthCurveRepository.deleteCurve(clusterId, durationBucket);
        List<GrowthCurveEntry> rows = points.stream().map(p -> {
            GrowthCurveEntry row = new GrowthCurveEntry();
            row.setClusterId(clusterId);
            row.setDurationBucket(durationBucket);
            row.setDayNumber(p.day());
            row.setMedianPct(p.medianPct());
            row.setP25Pct(p.p25Pct());
            row.setP75Pct(p.p75Pct());
            return row;
        }).toList();
        growthCurveRepository.saveAll(rows);
        return rows.size();
    }

    public List<GrowthCurvePoint> getGrowthCurve(int clusterId, String durationBucket) {
        return growthCurveRepository.findByClusterIdAndDurationBucketOrderByDayNumberAsc(clusterId, durationBucket).stream()
                .map(e -> new GrowthCurvePoint(e.getDayNumber(), e.getMedianPct(), e.getP25Pct(), e.getP75Pct()))
                .toList();
    }

    public Optional<Video> getVideo(String videoId) {
        return videoRepository.findByVideoId(videoId);
    }
}
