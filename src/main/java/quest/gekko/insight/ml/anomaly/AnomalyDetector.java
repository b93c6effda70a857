package quest.gekko.insight.ml.anomaly;

import org.springframework.stereotype.Component;
import quest.gekko.insight.ml.forecast.TimeSeriesPoint;
import quest.gekko.insight.util.Stats;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Component
public class AnomalyDetector {
    public static final int WINDOW = 14;
    public static final double DEFAULT_SENSITIVITY = 2.5;
    public static final double CRITICAL_Z = 3.5;
    static final int MIN_TREND_POINTS = 10;
    private static final double MIN_STD = 1e-10;

    public List<Anomaly> detectAnomalies(List<TimeSeriesPoint> data) {
        return detectAnomalies(data, DEFAULT_SENSITIVITY);
    }

    /**
     * Flags points whose z-score against the preceding 14 points exceeds {@code sensitivity}.
     * Flat windows are skipped.
     */
    public List<Anomaly> detectAnomalies(List<TimeSeriesPoint> data, double sensitivity) {
        if (data.size() <= WINDOW) return List.of();

        double[] values = data.stream().mapToDouble(TimeSeriesPoint::value).toArray();
        List<Anomaly> anomalies = new ArrayList<>();
        for (int i = WINDOW; i < values.length; i++) {
            double[] window = Arrays.copyOfRange(values, i - WINDOW, i);
            double std = Stats.sampleStdDev(window);
            if (std < MIN_STD) continue;

            double z = (values[i] - Stats.mean(window)) / std;
            double absZ = Math.abs(z);
            if (absZ > sensitivity) {
                anomalies.add(new Anomaly(
                        data.get(i).date(),
                        values[i],
                        z,
                        z > 0 ? Anomaly.Direction.SPIKE : Anomaly.Direction.DROP,
                        absZ > CRITICAL_Z ? Anomaly.Severity.CRITICAL : Anomaly.Severity.WARNING));
            }
        }
        return anomalies;
    }

    /**
     * CUSUM break search: the candidate is the interior index with the largest absolute cumulative
     * deviation from the global mean. It is reported only when the before/after means differ by at
     * least one global standard deviation.
     */
    public Optional<TrendBreak> detectTrendBreak(List<TimeSeriesPoint> data) {
        if (data.size() < MIN_TREND_POINTS) return Optional.empty();

        double[] values = data.stream().mapToDouble(TimeSeriesPoint::value).toArray();
        int n = values.length;
        double globalMean = Stats.mean(values);

        double cusum = 0;
        double maxAbs = 0;
        int breakIdx = -1;
        for (int i = 0; i < n - 1; i++) {
            cusum += values[i] - globalMean;
            if (i >= 1 && Math.abs(cusum) > maxAbs) {
                maxAbs = Math.abs(cusum);
                breakIdx = i;
            }
        }
        if (breakIdx < 0) return Optional.empty();

        double meanBefore = Stats.mean(Arrays.copyOfRange(values, 0, breakIdx + 1));
        double meanAfter = Stats.mean(Arrays.copyOfRange(values, breakIdx + 1, n));
        double globalStd = Stats.sampleStdDev(values);
        if (globalStd > 0 && Math.abs(meanAfter - meanBefore) < globalStd) {
            return Optional.empty();
        }

        double changePercent = meanBefore != 0 ? (meanAfter - meanBefore) / Math.abs(meanBefore) * 100 : 0;
        return Optional.of(new TrendBreak(data.get(breakIdx + 1).date(), meanBefore, meanAfter, changePercent));
    }
}
