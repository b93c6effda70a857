package quest.gekko.insight.service.plugin.standard;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import quest.gekko.insight.domain.AlertSeverity;
import quest.gekko.insight.domain.TopicCluster;
import quest.gekko.insight.ml.text.TextProcessing;
import quest.gekko.insight.service.plugin.Insight;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.service.plugin.InsightPlugin;
import quest.gekko.insight.service.store.CompetitorHit;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Alerts on recent competitor hits that fall into a topic gap. A hit matches the gap its video was
 * clustered into; unclustered hits match the gap whose name shares the most words with the title.
 */
@Component
@Order(70)
public class CompetitorGapHitPlugin implements InsightPlugin {
    static final int HIT_LOOKBACK_DAYS = 3;
    static final double MIN_GAP_SCORE = 5;

    @Override
    public String name() { return "CompetitorGapHit"; }

    @Override
    public List<Insight> analyze(InsightContext ctx) {
        List<TopicCluster> gaps = ctx.data().getTopicGaps().stream()
                .filter(g -> g.getGapScore() != null && g.getGapScore() > MIN_GAP_SCORE)
                .toList();
        if (gaps.isEmpty()) return List.of();

        List<Insight> out = new ArrayList<>();
        for (CompetitorHit hit : ctx.data().getCompetitorHits(ctx.range().to().minusDays(HIT_LOOKBACK_DAYS))) {
            Optional<TopicCluster> gap = matchGap(hit, gaps, ctx);
            if (gap.isEmpty()) continue;

            Insight.Playbook playbook = new Insight.Playbook("Counter Competitor Hit", List.of(
                    "Watch competitor video: " + hit.title(),
                    "Identify missing angles or outdated info.",
                    "Script a response or \"better version\" video."));
            out.add(new Insight("alert_competitor_gap", "Competitor Hit In Content Gap",
                    "A competitor video is breaking out in the \"" + gap.get().getName() + "\" topic you do not cover.",
                    Map.of("videoId", hit.videoId(), "title", hit.title(), "velocity24h", hit.velocity24h(),
                            "topic", gap.get().getName(), "gapScore", gap.get().getGapScore()),
                    new Insight.Alert(AlertSeverity.MEDIUM,
                            "Competitor hit detected in your content gap: " + hit.title(), hit.videoId(), playbook)));
        }
        return out;
    }

    private static Optional<TopicCluster> matchGap(CompetitorHit hit, List<TopicCluster> gaps, InsightContext ctx) {
        Optional<Long> clusterId = ctx.data().getTopicClusterId(hit.videoId());
        if (clusterId.isPresent()) {
            return gaps.stream().filter(g -> clusterId.get().equals(g.getId())).findFirst();
        }
        return gaps.stream()
                .filter(g -> TextProcessing.similarity(hit.title(), g.getName()) > 0)
                .max(Comparator.comparingDouble(g -> TextProcessing.similarity(hit.title(), g.getName())));
    }
}
