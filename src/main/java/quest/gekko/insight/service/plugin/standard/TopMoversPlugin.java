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
import java.util.stream.Collectors;

@Component
@Order(10)
public class TopMoversPlugin implements InsightPlugin {
    static final long MIN_VIEWS = 100;
    static final int TOP = 3;

    @Override
    public String name() { return "TopMovers"; }

    @Override
    public List<Insight> analyze(InsightContext ctx) {
        List<Mover> movers = new ArrayList<>();
        for (Video video : ctx.data().getAllVideos()) {
            List<VideoDayMetric> stats = ctx.data().getVideoStats(video.getVideoId(), ctx.range());
            if (stats.size() < 2) continue;
            long total = stats.stream().mapToLong(VideoDayMetric::getViews).sum();
            if (total > MIN_VIEWS) movers.add(new Mover(video.getVideoId(), video.getTitle(), total));
        }
        if (movers.isEmpty()) return List.of();

        List<Mover> top = movers.stream()
                .sorted(Comparator.comparingLong(Mover::views).reversed())
                .limit(TOP)
                .toList();
        return List.of(new Insight("top_movers", "Top Performing Videos",
                "Top " + top.size() + " videos by views in this period: "
                        + top.stream().map(Mover::title).collect(Collectors.joining(", ")),
                top));
    }

    record Mover(String videoId, String title, long views) {}
}
