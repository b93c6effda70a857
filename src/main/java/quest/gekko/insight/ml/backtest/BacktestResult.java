package quest.gekko.insight.ml.backtest;

import java.util.List;

/**
 * Rolling-origin evaluation outcome. {@code residuals} are {@code actual - predicted}, flattened
 * across all windows in order.
 */
public record BacktestResult(String modelName, double smape, double mae, List<Double> residuals, int windows) {

    public static BacktestResult empty(String modelName) {
        return new BacktestResult(modelName, 0, 0, List.of(), 0);
    }

    public double[] residualArray() {
        return residuals.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
