package quest.gekko.insight.service.plugin.standard;

import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import quest.gekko.insight.ml.anomaly.Anomaly;
import quest.gekko.insight.ml.anomaly.AnomalyDetector;
import quest.gekko.insight.ml.anomaly.TrendBreak;
import quest.gekko.insight.ml.forecast.TimeSeriesPoint;
import quest.gekko.insight.service.plugin.Insight;
import quest.gekko.insight.service.plugin.InsightContext;
import quest.gekko.insight.service.plugin.InsightPlugin;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/** Rolling z-score anomalies and a CUSUM trend break over the channel's daily views. */
@Component
@Order(30)
@RequiredArgsConstructor
public class AnomalyDaysPlugin implements InsightPlugin {
    private final AnomalyDetector detector;

    @Override
    public String name() { return "AnomalyDays"; }

    @Override
    public List<Insight> analyze(InsightContext ctx) {
        List<TimeSeriesPoint> views = ctx.data().getChannelStats(ctx.entityId(), ctx.range()).stream()
                .map(d -> new TimeSeriesPoint(d.getMetricDate(), d.getViews()))
                .toList();

        List<Insight> out = new ArrayList<>();
        List<Anomaly> anomalies = detector.detectAnomalies(views);
        if (!anomalies.isEmpty()) {
            long critical = anomalies.stream().filter(a -> a.severity() == Anomaly.Severity.CRITICAL).count();
            out.add(new Insight("anomaly", "Traffic Anomalies Detected",
                    "Found " + anomalies.size() + " days with unusual traffic patterns (" + critical + " critical).",
                    anomalies));
        }

        Optional<TrendBreak> trendBreak = detector.detectTrendBreak(views);
        trendBreak.ifPresent(b -> out.add(new Insight("trend_break",
                b.changePercent() >= 0 ? "Traffic Stepped Up" : "Traffic Stepped Down",
                String.format(Locale.ROOT, "Daily views moved from %.0f to %.0f (%+.1f%%) around %s.",
                        b.meanBefore(), b.meanAfter(), b.changePercent(), b.breakDate()),
                b)));
        return out;
    }
}
