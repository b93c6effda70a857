package quest.gekko.insight.ml.forecast;

import java.util.List;

/**
 * Common contract of every forecasting strategy.
 * <p>
 * {@code history} must be non-empty and chronologically ordered; the result holds exactly
 * {@code horizon} points dated on the days following the last observation, all non-negative.
 * A single-point history is always accepted.
 */
public interface Forecaster {

    /** Stable model name, also used as the registry key. */
    String name();

    ForecastResult forecast(List<TimeSeriesPoint> history, int horizon);
}
