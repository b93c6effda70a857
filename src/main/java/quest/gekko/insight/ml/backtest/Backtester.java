package quest.gekko.insight.ml.backtest;

import org.springframework.stereotype.Component;
import quest.gekko.insight.ml.forecast.ForecastResult;
import quest.gekko.insight.ml.forecast.Forecaster;
import quest.gekko.insight.ml.forecast.TimeSeriesPoint;
import quest.gekko.insight.util.Stats;

import java.util.ArrayList;
import java.util.List;

/**
 * Rolling-origin backtest. The first origin sits at {@code windowSize}; each window forecasts
 * {@code horizon} points, is scored against the held-out actuals and the origin moves by
 * {@code step} until fewer than {@code horizon} points remain.
 */
@Component
public class Backtester {
    public static final int DEFAULT_WINDOW = 28;
    public static final int DEFAULT_HORIZON = 7;
    public static final int DEFAULT_STEP = 7;

    public BacktestResult run(List<TimeSeriesPoint> data, Forecaster forecaster) {
        return run(data, forecaster, DEFAULT_WINDOW, DEFAULT_HORIZON, DEFAULT_STEP);
    }

    public BacktestResult run(List<TimeSeriesPoint> data, Forecaster forecaster, int windowSize, int horizon, int step) {
        if (windowSize < 1 || horizon < 1 || step < 1) {
            throw new IllegalArgumentException("windowSize, horizon and step must be positive");
        }
        List<Double> smapes = new ArrayList<>();
        List<Double> maes = new ArrayList<>();
        List<Double> residuals = new ArrayList<>();

        for (int i = windowSize; i <= data.size() - horizon; i += step) {
            List<TimeSeriesPoint> history = data.subList(0, i);
            double[] actual = data.subList(i, i + horizon).stream().mapToDouble(TimeSeriesPoint::value).toArray();

            ForecastResult result = forecaster.forecast(history, horizon);
            double[] predicted = result.values();

            smapes.add(Stats.smape(actual, predicted));
            maes.add(Stats.mae(actual, predicted));
            for (int j = 0; j < actual.length; j++) {
                residuals.add(actual[j] - predicted[j]);
            }
        }

        if (smapes.isEmpty()) return BacktestResult.empty(forecaster.name());
        return new BacktestResult(
                forecaster.name(),
                average(smapes),
                average(maes),
                List.copyOf(residuals),
                smapes.size());
    }

    private static double average(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0);
    }
}
