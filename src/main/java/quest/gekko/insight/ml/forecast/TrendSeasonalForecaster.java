package quest.gekko.insight.ml.forecast;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import quest.gekko.insight.util.Stats;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

/**
 * "ForecastV2": least-squares trend over the last 28 points, multiplied by a day-of-week factor
 * and by the ratio of the last-3 to last-28 average. The momentum term decays by 0.9 per step.
 * Histories shorter than 28 points are forecast with {@link NaiveForecaster}.
 */
@Component
@RequiredArgsConstructor
public class TrendSeasonalForecaster implements Forecaster {
    public static final String NAME = "ForecastV2";
    static final int TREND_WINDOW = 28;
    static final double MOMENTUM_DECAY = 0.9;

    private final NaiveForecaster naive;

    @Override
    public String name() { return NAME; }

    @Override
    public ForecastResult forecast(List<TimeSeriesPoint> history, int horizon) {
        Forecasts.validate(history, horizon);
        if (history.size() < TREND_WINDOW) return naive.forecast(history, horizon);

        double[] all = Forecasts.values(history);
        double[] recent = Arrays.copyOfRange(all, all.length - TREND_WINDOW, all.length);

        int n = recent.length;
        double sumX = 0, sumY = 0, sumXY = 0, sumXX = 0;
        for (int i = 0; i < n; i++) {
            sumX += i;
            sumY += recent[i];
            sumXY += i * recent[i];
            sumXX += (double) i * i;
        }
        double slope = (n * sumXY - sumX * sumY) / (n * sumXX - sumX * sumX);
        double intercept = (sumY - slope * sumX) / n;

        double[] seasonality = dayOfWeekFactors(history, Stats.mean(all));

        double[] last3 = Arrays.copyOfRange(all, all.length - 3, all.length);
        double recentMean = Stats.mean(recent);
        double momentum = recentMean > 0 ? Stats.mean(last3) / recentMean : 1;

        LocalDate lastDate = Forecasts.lastDate(history);
        double[] values = new double[horizon];
        for (int i = 0; i < horizon; i++) {
            int dow = dayIndex(lastDate.plusDays(i + 1L));
            double trend = intercept + slope * (n + i);
            values[i] = trend * seasonality[dow] * (1 + (momentum - 1) * Math.pow(MOMENTUM_DECAY, i));
        }
        return new ForecastResult(Forecasts.series(lastDate, values), NAME);
    }

    private static double[] dayOfWeekFactors(List<TimeSeriesPoint> history, double globalAvg) {
        double[] sums = new double[7];
        int[] counts = new int[7];
        for (TimeSeriesPoint p : history) {
            int dow = dayIndex(p.date());
            sums[dow] += p.value();
            counts[dow]++;
        }
        double base = globalAvg != 0 ? globalAvg : 1;
        double[] factors = new double[7];
        for (int d = 0; d < 7; d++) {
            factors[d] = counts[d] > 0 ? (sums[d] / counts[d]) / base : 1;
        }
        return factors;
    }

    private static int dayIndex(LocalDate date) {
        return date.getDayOfWeek().getValue() % 7;
    }
}
