package quest.gekko.insight.ml.forecast;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.insight.util.Stats;

import java.util.Arrays;
import java.util.List;

/**
 * Blend of {@link TrendSeasonalForecaster} and {@link HoltWintersForecaster} weighted by inverse
 * sMAPE on a 14-day holdout. Weights are equal when the history is too short for the holdout or
 * when either model fails on it. A model that fails on the full history is dropped; if both fail
 * the result comes from {@link NaiveForecaster}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EnsembleForecaster implements Forecaster {
    public static final String NAME = "Ensemble";
    static final int HOLDOUT = 14;
    static final int MIN_TRAINING = 28;
    private static final double EPSILON = 1e-6;

    private final TrendSeasonalForecaster trendSeasonal;
    private final HoltWintersForecaster holtWinters;
    private final NaiveForecaster naive;

    @Override
    public String name() { return NAME; }

    @Override
    public ForecastResult forecast(List<TimeSeriesPoint> history, int horizon) {
        Forecasts.validate(history, horizon);

        ForecastResult first = tryForecast(trendSeasonal, history, horizon);
        ForecastResult second = tryForecast(holtWinters, history, horizon);
        if (first == null && second == null) return naive.forecast(history, horizon);
        if (first == null) return second;
        if (second == null) return first;

        double[] weights = holdoutWeights(history);
        double[] a = first.values();
        double[] b = second.values();
        double[] blended = new double[horizon];
        for (int i = 0; i < horizon; i++) {
            blended[i] = weights[0] * a[i] + weights[1] * b[i];
        }
        return new ForecastResult(Forecasts.series(Forecasts.lastDate(history), blended), NAME);
    }

    double[] holdoutWeights(List<TimeSeriesPoint> history) {
        double[] equal = {0.5, 0.5};
        if (history.size() < MIN_TRAINING + HOLDOUT) return equal;

        List<TimeSeriesPoint> train = history.subList(0, history.size() - HOLDOUT);
        double[] actual = Forecasts.values(history.subList(history.size() - HOLDOUT, history.size()));

        ForecastResult first = tryForecast(trendSeasonal, train, HOLDOUT);
        ForecastResult second = tryForecast(holtWinters, train, HOLDOUT);
        if (first == null || second == null) return equal;

        double inverseFirst = 1.0 / Math.max(EPSILON, Stats.smape(actual, first.values()));
        double inverseSecond = 1.0 / Math.max(EPSILON, Stats.smape(actual, second.values()));
        double total = inverseFirst + inverseSecond;
        return new double[]{inverseFirst / total, inverseSecond / total};
    }

    private static ForecastResult tryForecast(Forecaster model, List<TimeSeriesPoint> history, int horizon) {
        try {
            ForecastResult result = model.forecast(history, horizon);
            if (result == null || result.predictions().size() != horizon
                    || Arrays.stream(result.values()).anyMatch(v -> !Double.isFinite(v))) {
                log.warn("Ensemble member {} returned an unusable forecast", model.name());
                return null;
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Ensemble member {} failed: {}", model.name(), e.getMessage());
            return null;
        }
    }
}
