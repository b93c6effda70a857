package quest.gekko.insight.ml.nowcast;

import org.springframework.stereotype.Component;
import quest.gekko.insight.util.Stats;

import java.util.ArrayList;
import java.util.List;

/**
 * Fits empirical cumulative-views curves over the first 28 days of life and projects young
 * videos to their day-7 total.
 */
@Component
public class GrowthCurveEstimator {
    public static final int CURVE_DAYS = 28;
    public static final int TARGET_DAY = 7;

    public List<GrowthCurvePoint> fit(List<VideoViewHistory> videos) {
        List<double[]> curves = new ArrayList<>();
        for (VideoViewHistory video : videos) {
            double[] daily = video.dailyViews();
            if (daily == null || daily.length < CURVE_DAYS) continue;

            double[] cumulative = new double[CURVE_DAYS];
            double sum = 0;
            for (int d = 0; d < CURVE_DAYS; d++) {
                sum += daily[d];
                cumulative[d] = sum;
            }
            double total = cumulative[CURVE_DAYS - 1];
            if (total == 0) continue;

            for (int d = 0; d < CURVE_DAYS; d++) {
                cumulative[d] /= total;
            }
            curves.add(cumulative);
        }
        if (curves.isEmpty()) return List.of();

        List<GrowthCurvePoint> result = new ArrayList<>(CURVE_DAYS);
        for (int d = 0; d < CURVE_DAYS; d++) {
            double[] atDay = new double[curves.size()];
            for (int v = 0; v < curves.size(); v++) {
                atDay[v] = curves.get(v)[d];
            }
            result.add(new GrowthCurvePoint(d + 1,
                    Stats.median(atDay),
                    Stats.quantile(atDay, 0.25),
                    Stats.quantile(atDay, 0.75)));
        }
        return result;
    }

    /**
     * Projects cumulative views at {@code daysSincePublish} to day 7. Videos already at or past day 7,
     * or days missing from the curve, get the current value back with a zero-width range.
     */
    public NowcastPrediction predict(double currentCumulativeViews, int daysSincePublish, List<GrowthCurvePoint> curve) {
        GrowthCurvePoint point = find(curve, daysSincePublish);
        GrowthCurvePoint target = find(curve, TARGET_DAY);
        if (point == null || target == null || point.medianPct() == 0 || daysSincePublish >= TARGET_DAY) {
            return NowcastPrediction.flat(currentCumulativeViews);
        }

        double median = currentCumulativeViews / point.medianPct() * target.medianPct();
        double conservative = point.p75Pct() > 0 ? currentCumulativeViews / point.p75Pct() * target.p25Pct() : median;
        double optimistic = point.p25Pct() > 0 ? currentCumulativeViews / point.p25Pct() * target.p75Pct() : median;
        return new NowcastPrediction(Math.round(median), Math.round(conservative), Math.round(optimistic));
    }

    private static GrowthCurvePoint find(List<GrowthCurvePoint> curve, int day) {
        for (GrowthCurvePoint p : curve) {
            if (p.day() == day) return p;
        }
        return null;
    }
}
