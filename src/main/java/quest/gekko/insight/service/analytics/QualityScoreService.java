package quest.gekko.insight.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.insight.domain.QualityScore;
import quest.gekko.insight.domain.VideoDayMetric;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.util.DateRange;
import quest.gekko.insight.util.JsonPayloads;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 0-100 quality score over a trailing window: velocity (views/day), efficiency (watch minutes per
 * view) and conversion (likes+comments per 1000 views), each capped against a fixed benchmark.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class QualityScoreService {
    public static final int WINDOW_DAYS = 28;
    static final double VELOCITY_BENCHMARK = 100;
    static final double EFFICIENCY_BENCHMARK = 3;
    static final double CONVERSION_BENCHMARK = 50;

    private final AnalyticsStore store;
    private final JsonPayloads json;

    public Optional<QualityScore> recompute(String videoId, DateRange window) {
        List<VideoDayMetric> stats = store.getVideoStats(videoId, window);
        if (stats.isEmpty()) {
            log.debug("No stats for {} in {}, skipping quality score", videoId, window);
            return Optional.empty();
        }
        Breakdown b = score(stats);

        QualityScore row = new QualityScore();
        row.setVideoId(videoId);
        row.setScore(b.score());
        row.setVelocityScore(b.velocityScore());
        row.setEfficiencyScore(b.efficiencyScore());
        row.setConversionScore(b.conversionScore());
        row.setExplainJson(json.write(explain(b)));
        return Optional.of(store.upsertQualityScore(row));
    }

    public static Breakdown score(List<VideoDayMetric> stats) {
        long views = 0;
        double watchMinutes = 0;
        long engagement = 0;
        for (VideoDayMetric day : stats) {
            views += day.getViews();
            watchMinutes += day.getWatchTimeMinutes();
            engagement += day.getLikes() + day.getComments();
        }

        double velocity = (double) views / stats.size();
        double efficiency = views > 0 ? watchMinutes / views : 0;
        double conversion = views > 0 ? engagement * 1000.0 / views : 0;

        double v = normalize(velocity, VELOCITY_BENCHMARK);
        double e = normalize(efficiency, EFFICIENCY_BENCHMARK);
        double c = normalize(conversion, CONVERSION_BENCHMARK);
        return new Breakdown(velocity, efficiency, conversion, v, e, c, 0.4 * v + 0.4 * e + 0.2 * c);
    }

    static double normalize(double value, double benchmark) {
        return Math.min(100, value / benchmark * 100);
    }

    static String verdict(double score) {
        if (score > 70) return "High Quality";
        if (score > 40) return "Average";
        return "Needs Improvement";
    }

    private static Map<String, Object> explain(Breakdown b) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("velocity", String.format(Locale.ROOT, "%.1f views/day (Score: %.0f, Benchmark: %.0f)",
                b.velocity(), b.velocityScore(), VELOCITY_BENCHMARK));
        out.put("efficiency", String.format(Locale.ROOT, "%.1f min avg (Score: %.0f, Benchmark: %.1f)",
                b.efficiency(), b.efficiencyScore(), EFFICIENCY_BENCHMARK));
        out.put("conversion", String.format(Locale.ROOT, "%.1f eng/1k (Score: %.0f, Benchmark: %.0f)",
                b.conversion(), b.conversionScore(), CONVERSION_BENCHMARK));
        out.put("verdict", verdict(b.score()));
        return out;
    }

    public record Breakdown(double velocity, double efficiency, double conversion,
                            double velocityScore, double efficiencyScore, double conversionScore, double score) {}
}
