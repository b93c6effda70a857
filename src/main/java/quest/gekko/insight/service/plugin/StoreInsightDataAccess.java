package quest.gekko.insight.service.plugin;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.domain.TopicCluster;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.repository.TopicMembershipRepository;
import quest.gekko.insight.service.analytics.TopicEngine;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.service.store.CompetitorHit;
import quest.gekko.insight.service.store.CompetitorStore;
import quest.gekko.insight.util.DateRange;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class StoreInsightDataAccess implements InsightDataAccess {
    private final AnalyticsStore store;
    private final CompetitorStore competitorStore;
    private final TopicEngine topicEngine;
    private final TopicMembershipRepository membershipRepository;

    @Override
    public List<Video> getAllVideos() {
        return store.getAllVideos();
    }

    @Override
    public List<VideoDayMetric> getVideoStats(String videoId, DateRange range) {
        return store.getVideoStats(videoId, range);
    }

    @Override
    public List<ChannelDayMetric> getChannelStats(String channelId, DateRange range) {
        return store.getChannelStats(channelId, range);
    }

    @Override
    public List<CompetitorHit> getCompetitorHits(LocalDate since) {
        return competitorStore.getRecentHits(since);
    }

    @Override
    public List<TopicCluster> getTopicGaps() {
        return topicEngine.getGaps();
    }

    @Override
    public Optional<Long> getTopicClusterId(String videoId) {
        return membershipRepository.findByVideoId(videoId).map(m -> m.getCluster().getId());
    }
}
