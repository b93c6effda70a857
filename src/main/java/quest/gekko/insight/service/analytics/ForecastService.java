package quest.gekko.insight.service.analytics;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.ml.backtest.BacktestResult;
import quest.gekko.insight.ml.backtest.Backtester;
import quest.gekko.insight.ml.backtest.ConfidenceBands;
import quest.gekko.insight.ml.forecast.ForecastResult;
import quest.gekko.insight.ml.forecast.Forecaster;
import quest.gekko.insight.ml.forecast.TimeSeriesPoint;
import quest.gekko.insight.service.registry.ModelRegistry;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.util.DateRange;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

/**
 * Channel view forecasts from the registry's active model. Bands come from the model's own
 * backtest residuals; when there is too little history for a backtest, any bands the model
 * produced itself are kept.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ForecastService {
    static final int HISTORY_DAYS = 180;

    private final AnalyticsStore store;
    private final ModelRegistry registry;
    private final Backtester backtester;
    private final Clock clock;

    public ForecastResult forecastChannel(String channelId, int horizon) {
        return forecastChannel(channelId, horizon, LocalDate.now(clock));
    }

    public ForecastResult forecastChannel(String channelId, int horizon, LocalDate today) {
        if (horizon < 1) throw AppException.validation("Forecast horizon must be positive");

        List<TimeSeriesPoint> history = store.getChannelStats(channelId, DateRange.lastDays(today, HISTORY_DAYS)).stream()
                .map(d -> new TimeSeriesPoint(d.getMetricDate(), d.getViews()))
                .toList();
        if (history.isEmpty()) throw AppException.notFound("No daily metrics stored for channel " + channelId);

        Forecaster forecaster = registry.activeForecaster(ModelRegistry.TYPE_FORECAST);
        ForecastResult forecast = forecaster.forecast(history, horizon);

        BacktestResult backtest = backtester.run(history, forecaster);
        if (backtest.residuals().isEmpty()) {
            log.debug("No backtest window for {} over {} points", forecaster.name(), history.size());
            return forecast;
        }
        ConfidenceBands bands = ConfidenceBands.fromResiduals(forecast.predictions(), backtest.residualArray());
        return new ForecastResult(forecast.predictions(), bands.lower(), bands.upper(), forecast.modelName());
    }
}
