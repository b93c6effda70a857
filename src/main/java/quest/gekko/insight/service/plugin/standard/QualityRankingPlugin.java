package quest.gekko.insight.service.plugin.standard;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import quest.gekko.insight.domain.Video;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.service.plugin.Insight;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.service.plugin.InsightPlugin;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Engagement-weighted ranking: a comment counts double a like, a like a hundred views. */
@Component
@Order(50)
public class QualityRankingPlugin implements InsightPlugin {
    static final double VIEW_WEIGHT = 0.1;
    static final double LIKE_WEIGHT = 10;
    static final double COMMENT_WEIGHT = 20;
    static final int TOP = 5;

    @Override
    public String name() { return "QualityRanking"; }

    @Override
    public List<Insight> analyze(InsightContext ctx) {
        List<Ranked> ranked = new ArrayList<>();
        for (Video video : ctx.data().getAllVideos()) {
            double score = 0;
            for (VideoDayMetric day : ctx.data().getVideoStats(video.getVideoId(), ctx.range())) {
                score += day.getViews() * VIEW_WEIGHT + day.getLikes() * LIKE_WEIGHT + day.getComments() * COMMENT_WEIGHT;
            }
            if (score > 0) ranked.add(new Ranked(video.getVideoId(), video.getTitle(), score));
        }
        if (ranked.isEmpty()) return List.of();

        List<Ranked> top = ranked.stream()
                .sorted(Comparator.comparingDouble(Ranked::score).reversed())
                .limit(TOP)
                .toList();
        return List.of(new Insight("quality_rank", "Quality Ranking",
                "Top videos based on engagement weighted score.", top));
    }

    record Ranked(String videoId, String title, double score) {}
}
