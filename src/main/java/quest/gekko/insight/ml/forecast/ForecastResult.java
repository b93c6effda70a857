package quest.gekko.insight.ml.forecast;

import java.util.List;

/**
 * Output of a {@link Forecaster}. Bounds are optional and empty when the model does not produce them.
 */
public record ForecastResult(
        List<TimeSeriesPoint> predictions,
        List<TimeSeriesPoint> lowerBound,
        List<TimeSeriesPoint> upperBound,
        String modelName
) {
    public ForecastResult(List<TimeSeriesPoint> predictions, String modelName) {
        this(predictions, List.of(), List.of(), modelName);
    }

    public boolean hasBounds() {
        return !lowerBound.isEmpty() && !upperBound.isEmpty();
    }

    public double[] values() {
        return predictions.stream().mapToDouble(TimeSeriesPoint::value).toArray();
    }
}
