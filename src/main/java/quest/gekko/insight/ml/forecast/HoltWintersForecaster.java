package quest.gekko.insight.ml.forecast;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.insight.util.Stats;

import java.time.LocalDate;
import java.util.List;

/**
 * Additive triple exponential smoothing with a weekly season.
 * <p>
 * Alpha, beta and gamma are picked from {0.1, 0.3, 0.5, 0.7, 0.9} by minimising the in-sample
 * one-step-ahead MAE. Bands are {@code prediction ± 1.96·σ} where σ is the standard deviation of
 * the one-step residuals of the chosen fit. Histories shorter than three seasons are handed to
 * {@link TrendSeasonalForecaster}.
 */
@Component
@RequiredArgsConstructor
public class HoltWintersForecaster implements Forecaster {
    public static final String NAME = "HoltWinters";
    static final int SEASON = 7;
    static final double[] GRID = {0.1, 0.3, 0.5, 0.7, 0.9};
    static final double Z = 1.96;

    private final TrendSeasonalForecaster fallback;

    @Override
    public String name() { return NAME; }

    @Override
    public ForecastResult forecast(List<TimeSeriesPoint> history, int horizon) {
        Forecasts.validate(history, horizon);
        if (history.size() < 3 * SEASON) return fallback.forecast(history, horizon);

        double[] y = Forecasts.values(history);
        Fit best = null;
        for (double alpha : GRID) {
            for (double beta : GRID) {
                for (double gamma : GRID) {
                    Fit fit = fit(y, alpha, beta, gamma);
                    if (best == null || fit.mae < best.mae) best = fit;
                }
            }
        }

        double sigma = Stats.sampleStdDev(best.residuals);
        double[] point = new double[horizon];
        double[] lower = new double[horizon];
        double[] upper = new double[horizon];
        int n = y.length;
        for (int h = 1; h <= horizon; h++) {
            double seasonal = best.seasonal[n - SEASON + ((h - 1) % SEASON)];
            double value = best.level + h * best.trend + seasonal;
            point[h - 1] = value;
            lower[h - 1] = value - Z * sigma;
            upper[h - 1] = value + Z * sigma;
        }

        LocalDate last = Forecasts.lastDate(history);
        return new ForecastResult(
                Forecasts.series(last, point),
                Forecasts.series(last, lower),
                Forecasts.series(last, upper),
                NAME);
    }

    static Fit fit(double[] y, double alpha, double beta, double gamma) {
        int n = y.length;
        double firstSeason = 0, secondSeason = 0;
        for (int i = 0; i < SEASON; i++) {
            firstSeason += y[i];
            secondSeason += y[i + SEASON];
        }
        firstSeason /= SEASON;
        secondSeason /= SEASON;

        double level = firstSeason;
        double trend = (secondSeason - firstSeason) / SEASON;
        double[] seasonal = new double[n];
        for (int i = 0; i < SEASON; i++) {
            seasonal[i] = y[i] - firstSeason;
        }

        double[] residuals = new double[n - SEASON];
        double absSum = 0;
        for (int t = SEASON; t < n; t++) {
            double predicted = level + trend + seasonal[t - SEASON];
            double residual = y[t] - predicted;
            residuals[t - SEASON] = residual;
            absSum += Math.abs(residual);

            double prevLevel = level;
            level = alpha * (y[t] - seasonal[t - SEASON]) + (1 - alpha) * (level + trend);
            trend = beta * (level - prevLevel) + (1 - beta) * trend;
            seasonal[t] = gamma * (y[t] - level) + (1 - gamma) * seasonal[t - SEASON];
        }
        return new Fit(level, trend, seasonal, residuals, absSum / residuals.length);
    }

    record Fit(double level, double trend, double[] seasonal, double[] residuals, double mae) {
    }
}
