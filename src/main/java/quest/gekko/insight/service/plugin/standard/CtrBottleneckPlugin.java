package quest.gekko.insight.service.plugin.standard;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.service.plugin.Insight;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.service.plugin.InsightPlugin;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Channel-wide click-through rate below the 2% benchmark. */
@Component
@Order(20)
public class CtrBottleneckPlugin implements InsightPlugin {
    static final double CTR_BENCHMARK = 2.0;

    @Override
    public String name() { return "CtrBottleneck"; }

    @Override
    public List<Insight> analyze(InsightContext ctx) {
        List<ChannelDayMetric> stats = ctx.data().getChannelStats(ctx.entityId(), ctx.range());
        long impressions = stats.stream().mapToLong(ChannelDayMetric::getImpressions).sum();
        long views = stats.stream().mapToLong(ChannelDayMetric::getViews).sum();
        if (impressions == 0) return List.of();

        double ctr = views * 100.0 / impressions;
        if (ctr >= CTR_BENCHMARK) return List.of();
        return List.of(new Insight("bottleneck", "Low CTR Detected",
                String.format(Locale.ROOT, "CTR is %.1f%%, which is below the %.0f%% benchmark. Consider improving thumbnails.",
                        ctr, CTR_BENCHMARK),
                Map.of("impressions", impressions, "views", views, "ctr", ctr)));
    }
}
