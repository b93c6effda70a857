package quest.gekko.insight.ml.forecast;

import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;

/** Repeats the last observed value. */
@Component
public class NaiveForecaster implements Forecaster {
    public static final String NAME = "Naive";

    @Override
    public String name() { return NAME; }

    @Override
    public ForecastResult forecast(List<TimeSeriesPoint> history, int horizon) {
        Forecasts.validate(history, horizon);
        double[] values = new double[horizon];
        Arrays.fill(values, Forecasts.lastValue(history));
        return new ForecastResult(Forecasts.series(Forecasts.lastDate(history), values), NAME);
    }
}
