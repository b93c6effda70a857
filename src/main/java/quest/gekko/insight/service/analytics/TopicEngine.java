package quest.gekko.insight.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insight.domain.CompetitorVideo;
import quest.gekko.insight.domain.TopicCluster;
import quest.gekko.insight.domain.TopicMembership;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoSource;
import quest.gekko.insight.ml.text.ClusterAssignment;
import quest.gekko.insight.ml.text.TextClusterer;
import quest.gekko.insight.ml.text.TextDocument;
import quest.gekko.insight.repository.TopicClusterRepository;
import quest.gekko.insight.repository.TopicMembershipRepository;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.service.store.CompetitorStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Clusters owned and competitor titles and flags clusters dominated by competitors as content
 * gaps. Each run replaces all stored clusters and memberships.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TopicEngine {
    public static final int MIN_VIDEOS = 5;
    public static final int MIN_CLUSTERS = 3;
    public static final double GAP_SHARE = 0.7;
    public static final int GAP_MIN_MEMBERS = 3;

    private final AnalyticsStore store;
    private final CompetitorStore competitorStore;
    private final TopicClusterRepository clusterRepository;
    private final TopicMembershipRepository membershipRepository;
    private final ClusterNamer namer;

    @Transactional
    public List<TopicCluster> runClustering() {
        Map<String, TitledVideo> videos = new LinkedHashMap<>();
        for (Video v : store.getAllVideos()) {
            videos.put(v.getVideoId(), new TitledVideo(v.getVideoId(), v.getTitle(), VideoSource.OWNED));
        }
        for (CompetitorVideo v : competitorStore.getAllVideos()) {
            videos.putIfAbsent(v.getVideoId(), new TitledVideo(v.getVideoId(), v.getTitle(), VideoSource.COMPETITOR));
        }
        if (videos.size() < MIN_VIDEOS) {
            log.info("Only {} titles, need {} to cluster topics", videos.size(), MIN_VIDEOS);
            return List.of();
        }

        TextClusterer clusterer = new TextClusterer();
        List<ClusterAssignment> assignments = clusterer.kMeans(
                clusterer.fitTransform(videos.values().stream().map(v -> new TextDocument(v.id(), v.title())).toList()),
                clusterCount(videos.size()));

        Map<Integer, List<ClusterAssignment>> byCluster = new TreeMap<>();
        for (ClusterAssignment a : assignments) {
            byCluster.computeIfAbsent(a.clusterId(), k -> new ArrayList<>()).add(a);
        }

        membershipRepository.deleteAllInBatch();
        clusterRepository.deleteAllInBatch();

        List<TopicCluster> saved = new ArrayList<>();
        for (List<ClusterAssignment> members : byCluster.values()) {
            List<String> titles = members.stream().map(a -> videos.get(a.documentId()).title()).toList();
            long competitorCount = members.stream()
                    .filter(a -> videos.get(a.documentId()).source() == VideoSource.COMPETITOR)
                    .count();

            ClusterNamer.ClusterLabel label = label(titles);
            TopicCluster cluster = new TopicCluster();
            cluster.setName(label.name());
            cluster.setDescription(label.description());
            scoreGap(cluster, members.size(), competitorCount);
            cluster = clusterRepository.save(cluster);

            for (ClusterAssignment a : members) {
                TopicMembership membership = new TopicMembership();
                membership.setVideoId(a.documentId());
                membership.setCluster(cluster);
                membership.setSource(videos.get(a.documentId()).source());
                membership.setDistance(a.distance());
                membershipRepository.save(membership);
            }
            saved.add(cluster);
        }
        log.info("Stored {} topic clusters over {} titles, {} gaps", saved.size(), videos.size(),
                saved.stream().filter(c -> c.getGapScore() != null).count());
        return saved;
    }

    public List<TopicCluster> getGaps() {
        return clusterRepository.findByGapScoreNotNullOrderByGapScoreDesc();
    }

    /** A gap needs more than 70% competitor titles and at least three members. */
    static void scoreGap(TopicCluster cluster, int members, long competitorMembers) {
        double share = (double) competitorMembers / members;
        cluster.setMemberCount(members);
        cluster.setCompetitorShare(share);
        if (share > GAP_SHARE && members >= GAP_MIN_MEMBERS) {
            cluster.setGapScore(share * 10);
            cluster.setGapReason(String.format(Locale.ROOT, "Competitors own %d%% of this topic.", Math.round(share * 100)));
        }
    }

    static int clusterCount(int videos) {
        return Math.max(MIN_CLUSTERS, (int) Math.floor(Math.sqrt(videos / 2.0)));
    }

    private ClusterNamer.ClusterLabel label(List<String> titles) {
        try {
            return namer.name(titles);
        } catch (RuntimeException e) {
            log.warn("Cluster naming failed, using keyword name", e);
            return new KeywordClusterNamer().name(titles);
        }
    }

    private record TitledVideo(String id, String title, VideoSource source) {}
}
