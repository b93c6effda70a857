package quest.gekko.insight.service.plugin.standard;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import quest.gekko.insight.domain.AlertSeverity;
import quest.gekko.insight.domain.ChannelDayMetric;
import quest.gekko.insight.service.plugin.Insight;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.service.plugin.InsightPlugin;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Alerts when the last three days' CTR is more than 20% below the three days before. */
@Component
@Order(60)
public class CtrDropPlugin implements InsightPlugin {
    static final int DAYS = 3;
    static final double DROP_RATIO = 0.8;

    static final Insight.Playbook PLAYBOOK = new Insight.Playbook("Fix CTR Drop", List.of(
            "Check thumbnail contrast and readability.",
            "Verify title matches thumbnail promise.",
            "A/B test a new title variant."));

    @Override
    public String name() { return "CtrDrop"; }

    @Override
    public List<Insight> analyze(InsightContext ctx) {
        List<ChannelDayMetric> stats = ctx.data().getChannelStats(ctx.entityId(), ctx.range());
        if (stats.size() < 2 * DAYS) return List.of();

        int n = stats.size();
        double recentCtr = ctr(stats.subList(n - DAYS, n));
        double previousCtr = ctr(stats.subList(n - 2 * DAYS, n - DAYS));
        if (Double.isNaN(recentCtr) || Double.isNaN(previousCtr) || recentCtr >= previousCtr * DROP_RATIO) {
            return List.of();
        }

        double dropPercent = (previousCtr - recentCtr) / previousCtr * 100;
        Insight.Alert alert = new Insight.Alert(AlertSeverity.HIGH,
                String.format(Locale.ROOT, "CTR dropped by %.1f%% in last %d days.", dropPercent, DAYS),
                ctx.entityId(), PLAYBOOK);
        return List.of(new Insight("alert_ctr", "CTR Drop Alert",
                "Significant drop in Click-Through Rate detected.",
                Map.of("recentCtr", recentCtr, "previousCtr", previousCtr),
                alert));
    }

    /** Views per impression in percent; NaN without impressions. */
    static double ctr(List<ChannelDayMetric> days) {
        long impressions = days.stream().mapToLong(ChannelDayMetric::getImpressions).sum();
        long views = days.stream().mapToLong(ChannelDayMetric::getViews).sum();
        return impressions == 0 ? Double.NaN : views * 100.0 / impressions;
    }
}
