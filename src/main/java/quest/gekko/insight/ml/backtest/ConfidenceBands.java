package quest.gekko.insight.ml.backtest;

import quest.gekko.insight.ml.forecast.TimeSeriesPoint;
import quest.gekko.insight.util.Stats;

import java.util.List;

/** Residual-quantile bands around a forecast: {@code p + Q25(residuals)} and {@code p + Q75(residuals)}, floored at 0. */
public record ConfidenceBands(List<TimeSeriesPoint> lower, List<TimeSeriesPoint> upper) {

    public static ConfidenceBands fromResiduals(List<TimeSeriesPoint> predictions, double[] residuals) {
        double q25 = Stats.quantile(residuals, 0.25);
        double q75 = Stats.quantile(residuals, 0.75);
        List<TimeSeriesPoint> lower = predictions.stream()
                .map(p -> new TimeSeriesPoint(p.date(), Math.max(0, p.value() + q25)))
                .toList();
        List<TimeSeriesPoint> upper = predictions.stream()
                .map(p -> new TimeSeriesPoint(p.date(), Math.max(0, p.value() + q75)))
                .toList();
        return new ConfidenceBands(lower, upper);
    }
}
