package quest.gekko.insight.ml.forecast;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ForecastersTest {
    static final LocalDate START = LocalDate.of(2024, 1, 1);

    private final NaiveForecaster naive = new NaiveForecaster();
    private final SeasonalNaiveForecaster seasonalNaive = new SeasonalNaiveForecaster();
    private final TrendSeasonalForecaster trendSeasonal = new TrendSeasonalForecaster(naive);
    private final HoltWintersForecaster holtWinters = new HoltWintersForecaster(trendSeasonal);

    static List<TimeSeriesPoint> series(double... values) {
        List<TimeSeriesPoint> out = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            out.add(new TimeSeriesPoint(START.plusDays(i), values[i]));
        }
        return out;
    }

    static List<TimeSeriesPoint> weekly(int weeks) {
        double[] values = new double[weeks * 7];
        for (int i = 0; i < values.length; i++) {
            values[i] = 100 + 10 * (i % 7) + i;
        }
        return series(values);
    }

    private static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }

    @Test
    @DisplayName("naive repeats the last value on consecutive dates")
    void naiveRepeatsLastValue() {
        ForecastResult result = naive.forecast(series(3, 9, 42), 5);

        assertThat(result.values()).containsOnly(42.0);
        assertThat(result.predictions()).hasSize(5);
        assertThat(result.predictions().get(0).date()).isEqualTo(START.plusDays(3));
        assertThat(result.predictions().get(4).date()).isEqualTo(START.plusDays(7));
        assertThat(result.hasBounds()).isFalse();
    }

    @Test
    @DisplayName("seasonal naive replays the last week")
    void seasonalNaiveReplaysLastWeek() {
        ForecastResult result = seasonalNaive.forecast(
                series(10, 20, 30, 40, 50, 60, 70, 10, 20, 30, 40, 50, 60, 70), 7);

        assertThat(result.values()).containsExactly(10, 20, 30, 40, 50, 60, 70);
    }

    @Test
    @DisplayName("seasonal naive repeats the last week for long horizons")
    void seasonalNaiveWrapsAroundForLongHorizons() {
        ForecastResult result = seasonalNaive.forecast(series(1, 2, 3, 4, 5, 6, 7), 9);

        assertThat(result.values()).containsExactly(1, 2, 3, 4, 5, 6, 7, 1, 2);
    }

    @Test
    @DisplayName("seasonal naive falls back to the last value on short history")
    void seasonalNaiveFallsBackToLastValueOnShortHistory() {
        assertThat(seasonalNaive.forecast(series(5, 8), 3).values()).containsOnly(8.0);
    }

    @Test
    @DisplayName("trend-seasonal delegates to naive below 28 points")
    void trendSeasonalNeedsFourWeeks() {
        assertThat(trendSeasonal.forecast(weekly(3), 7).modelName()).isEqualTo(NaiveForecaster.NAME);
        assertThat(trendSeasonal.forecast(weekly(4), 7).modelName()).isEqualTo(TrendSeasonalForecaster.NAME);
    }

    @Test
    @DisplayName("trend-seasonal follows a linear trend")
    void trendSeasonalFollowsALinearTrend() {
        double[] values = new double[35];
        for (int i = 0; i < values.length; i++) values[i] = 100 + 5 * i;

        double[] forecast = trendSeasonal.forecast(series(values), 7).values();

        assertThat(forecast).hasSize(7);
        assertThat(boxed(forecast)).allSatisfy(v -> assertThat(v).isGreaterThan(values[values.length - 1] * 0.9));
    }

    @Test
    @DisplayName("Holt-Winters falls back below three seasons and adds bands otherwise")
    void holtWintersFallbackAndBands() {
        ForecastResult shortResult = holtWinters.forecast(weekly(2), 7);
        assertThat(shortResult.modelName()).isNotEqualTo(HoltWintersForecaster.NAME);

        ForecastResult result = holtWinters.forecast(weekly(6), 7);
        assertThat(result.modelName()).isEqualTo(HoltWintersForecaster.NAME);
        assertThat(result.hasBounds()).isTrue();
        for (int i = 0; i < 7; i++) {
            assertThat(result.lowerBound().get(i).value()).isLessThanOrEqualTo(result.predictions().get(i).value());
            assertThat(result.upperBound().get(i).value()).isGreaterThanOrEqualTo(result.predictions().get(i).value());
        }
    }

    @Test
    @DisplayName("Holt-Winters tracks a constant series")
    void holtWintersTracksAConstantSeries() {
        double[] values = new double[28];
        Arrays.fill(values, 50);

        assertThat(boxed(holtWinters.forecast(series(values), 7).values())).allSatisfy(v -> assertThat(v).isCloseTo(50, within(1e-6)));
    }

    @Test
    @DisplayName("every forecaster accepts a single point and never predicts negatives")
    void singlePointAndNonNegative() {
        List<Forecaster> all = List.of(naive, seasonalNaive, trendSeasonal, holtWinters,
                new EnsembleForecaster(trendSeasonal, holtWinters, naive));
        for (Forecaster forecaster : all) {
            assertThat(forecaster.forecast(series(12), 3).values()).containsOnly(12.0);
        }

        double[] falling = new double[42];
        for (int i = 0; i < falling.length; i++) falling[i] = Math.max(0, 400 - 12 * i);
        for (Forecaster forecaster : all) {
            assertThat(boxed(forecaster.forecast(series(falling), 14).values())).allSatisfy(v -> assertThat(v).isGreaterThanOrEqualTo(0));
        }
    }

    @Test
    @DisplayName("empty history and non-positive horizon are rejected")
    void rejectsEmptyHistoryAndNonPositiveHorizon() {
        assertThatThrownBy(() -> naive.forecast(List.of(), 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> seasonalNaive.forecast(series(1, 2), 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
