package quest.gekko.insight.service.store;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insight.domain.CompetitorChannel;
import quest.gekko.insight.domain.CompetitorSnapshot;
import quest.gekko.insight.domain.CompetitorVideo;
import quest.gekko.insight.domain.MomentumRecord;
import quest.gekko.insight.provider.ChannelInfo;
import quest.gekko.insight.provider.VideoInfo;
import quest.gekko.insight.repository.CompetitorChannelRepository;
import quest.gekko.insight.repository.CompetitorSnapshotRepository;
import quest.gekko.insight.repository.CompetitorVideoRepository;
import quest.gekko.insight.repository.MomentumRecordRepository;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class CompetitorStore {

    private final CompetitorChannelRepository channelRepository;
    private final CompetitorVideoRepository videoRepository;
    private final CompetitorSnapshotRepository snapshotRepository;
    private final MomentumRecordRepository momentumRepository;

    public List<CompetitorChannel> getCompetitors() {
        return channelRepository.findAll();
    }

    @Transactional
    public CompetitorChannel addCompetitor(ChannelInfo info) {
        CompetitorChannel channel = channelRepository.findByChannelId(info.id()).orElseGet(CompetitorChannel::new);
        channel.setChannelId(info.id());
        channel.setTitle(info.title());
        channel.setCustomUrl(info.customUrl());
        channel.setSubscriberCount(info.subscriberCount());
        return channelRepository.save(channel);
    }

    @Transactional
    public CompetitorVideo upsertVideo(String channelId, VideoInfo info) {
        CompetitorVideo video = videoRepository.findByVideoId(info.id()).orElseGet(CompetitorVideo::new);
        video.setVideoId(info.id());
        video.setChannelId(channelId);
        video.setTitle(info.title() != null ? info.title() : "");
        if (info.publishedAt() != null) video.setPublishedAt(info.publishedAt());
        return videoRepository.save(video);
    }

    @Transactional
    public CompetitorSnapshot upsertSnapshot(String videoId, LocalDate day, long viewCount) {
        CompetitorSnapshot snapshot = snapshotRepository.findByVideoIdAndSnapshotDate(videoId, day)
                .orElseGet(CompetitorSnapshot::new);
        snapshot.setVideoId(videoId);
        snapshot.setSnapshotDate(day);
        snapshot.setViewCount(viewCount);
        return snapshotRepository.save(snapshot);
    }

    public List<CompetitorSnapshot> getSnapshots(String videoId) {
        return snapshotRepository.findByVideoIdOrderBySnapshotDateAsc(videoId);
    }

    /** Replaces any earlier computation for the same (video, day). */
    @Transactional
    public MomentumRecord upsertMomentum(MomentumRecord computed) {
        MomentumRecord row = momentumRepository.findByVideoIdAndMetricDate(computed.getVideoId(), computed.getMetricDate())
                .orElseGet(MomentumRecord::new);
        row.setVideoId(computed.getVideoId());
        row.setMetricDate(computed.getMetricDate());
        row.setVelocity24h(computed.getVelocity24h());
        row.setVelocity7d(computed.getVelocity7d());
        row.setMomentumScore(computed.getMomentumScore());
        row.setHit(computed.isHit());
        row.setAcceleration(computed.getAcceleration());
        row.setAccelerationTrend(computed.getAccelerationTrend());
        row.setSustainedDays(computed.getSustainedDays());
        row.setSustained(computed.isSustained());
        return momentumRepository.save(row);
    }

    public List<CompetitorHit> getRecentHits(LocalDate since) {
        List<MomentumRecord> hits = momentumRepository.findByHitTrueAndMetricDateGreaterThanEqualOrderByVelocity24hDesc(since);
        Map<String, CompetitorVideo> videos = videoRepository.findByVideoIdIn(hits.stream().map(MomentumRecord::getVideoId).toList())
                .stream()
                .collect(Collectors.toMap(CompetitorVideo::getVideoId, Function.identity()));
        return hits.stream()
                .filter(h -> videos.containsKey(h.getVideoId()))
                .map(h -> new CompetitorHit(h.getVideoId(), videos.get(h.getVideoId()).getTitle(),
                        videos.get(h.getVideoId()).getChannelId(), h.getMetricDate(), h.getVelocity24h()))
                .toList();
    }

    public List<CompetitorVideo> getAllVideos() {
        return videoRepository.findAll();
    }
}
