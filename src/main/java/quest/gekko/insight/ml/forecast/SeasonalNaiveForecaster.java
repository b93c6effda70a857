package quest.gekko.insight.ml.forecast;

import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Repeats the most recent 7-day block: step {@code i} takes the value at {@code n - 7 + (i % 7)}.
 * Shorter histories fall back to the last value.
 */
@Component
public class SeasonalNaiveForecaster implements Forecaster {
    public static final String NAME = "SeasonalNaive";
    static final int SEASON = 7;

    @Override
    public String name() { return NAME; }

    @Override
    public ForecastResult forecast(List<TimeSeriesPoint> history, int horizon) {
        Forecasts.validate(history, horizon);
        int n = history.size();
        double last = Forecasts.lastValue(history);
        double[] values = new double[horizon];
        for (int i = 0; i < horizon; i++) {
            values[i] = n >= SEASON ? history.get(n - SEASON + (i % SEASON)).value() : last;
        }
        return new ForecastResult(Forecasts.series(Forecasts.lastDate(history), values), NAME);
    }
}
