package quest.gekko.insight.service.registry;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insight.domain.ForecastModel;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.ml.backtest.BacktestResult;
import quest.gekko.insight.ml.backtest.Backtester;
import quest.gekko.insight.ml.forecast.Forecaster;
import quest.gekko.insight.ml.forecast.SeasonalNaiveForecaster;
import quest.gekko.insight.ml.forecast.TimeSeriesPoint;
import quest.gekko.insight.repository.ForecastModelRepository;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.util.DateRange;
import quest.gekko.insight.util.JsonPayloads;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Backtests every registered forecaster on the channel's daily views and promotes the most
 * accurate one. A candidate must match or beat the SeasonalNaive baseline on sMAPE, otherwise
 * the baseline is what ends up active. At most one model per type is active.
 */
@Slf4j
@Service
@Transactional(readOnly = true)
public class ModelRegistry {
    public static final String TYPE_FORECAST = "forecast";
    public static final String MODEL_VERSION = "1.0";
    public static final int MIN_HISTORY_DAYS = 60;
    static final int TRAINING_DAYS = 365;

    private final ForecastModelRepository modelRepository;
    private final AnalyticsStore store;
    private final Backtester backtester;
    private final JsonPayloads json;
    private final Map<String, Forecaster> forecasters = new LinkedHashMap<>();

    public ModelRegistry(ForecastModelRepository modelRepository, AnalyticsStore store, Backtester backtester,
                         JsonPayloads json, List<Forecaster> forecasters) {
        this.modelRepository = modelRepository;
        this.store = store;
        this.backtester = backtester;
        this.json = json;
        forecasters.forEach(f -> this.forecasters.put(f.name(), f));
        if (!this.forecasters.containsKey(SeasonalNaiveForecaster.NAME)) {
            throw new IllegalStateException("The SeasonalNaive baseline forecaster must be registered");
        }
    }

    /**
     * Trains on the trailing year of channel views. Returns the model left active, or empty when
     * there is not enough history to evaluate anything.
     */
    @Transactional
    public Optional<ForecastModel> trainAndEvaluate(String channelId, LocalDate today) {
        List<TimeSeriesPoint> data = store.getChannelStats(channelId, DateRange.lastDays(today, TRAINING_DAYS)).stream()
                .map(d -> new TimeSeriesPoint(d.getMetricDate(), d.getViews()))
                .toList();
        if (data.size() < MIN_HISTORY_DAYS) {
            log.info("Only {} days of history for {}, need {} to train forecast models", data.size(), channelId, MIN_HISTORY_DAYS);
            return Optional.empty();
        }

        List<BacktestResult> results = new ArrayList<>();
        for (Forecaster forecaster : forecasters.values()) {
            BacktestResult result = backtester.run(data, forecaster);
            log.info("Backtest {}: sMAPE {} MAE {} over {} windows", forecaster.name(),
                    format(result.smape()), format(result.mae()), result.windows());
            results.add(result);
        }

        String activeName = selectActive(results);
        modelRepository.deactivateByType(TYPE_FORECAST);

        ForecastModel active = null;
        Instant trainedAt = Instant.now();
        for (BacktestResult result : results) {
            ForecastModel saved = upsertModel(result, trainedAt, result.modelName().equals(activeName));
            if (saved.isActive()) active = saved;
        }
        log.info("Active {} model is now {}", TYPE_FORECAST, activeName);
        return Optional.ofNullable(active);
    }

    /**
     * Lowest sMAPE wins if it is no worse than the SeasonalNaive baseline; otherwise the baseline.
     */
    public static String selectActive(List<BacktestResult> results) {
        BacktestResult baseline = results.stream()
                .filter(r -> r.modelName().equals(SeasonalNaiveForecaster.NAME))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Baseline result missing"));
        BacktestResult best = results.stream()
                .min(Comparator.comparingDouble(BacktestResult::smape))
                .orElse(baseline);

        if (best.smape() <= baseline.smape()) return best.modelName();
        log.warn("Candidate {} failed the baseline gate ({} > {}), keeping {}", best.modelName(),
                format(best.smape()), format(baseline.smape()), baseline.modelName());
        return baseline.modelName();
    }

    public String activeModelName(String type) {
        return modelRepository.findFirstByModelTypeAndActiveTrueOrderByTrainedAtDesc(type)
                .map(ForecastModel::getModelName)
                .filter(forecasters::containsKey)
                .orElse(SeasonalNaiveForecaster.NAME);
    }

    public Forecaster activeForecaster(String type) {
        return forecaster(activeModelName(type));
    }

    public Forecaster forecaster(String name) {
        Forecaster forecaster = forecasters.get(name);
        if (forecaster == null) throw AppException.notFound("Unknown forecast model " + name);
        return forecaster;
    }

    public List<ForecastModel> listModels(String type) {
        return modelRepository.findByModelTypeOrderBySmapeAsc(type);
    }

    private ForecastModel upsertModel(BacktestResult result, Instant trainedAt, boolean active) {
        String modelId = TYPE_FORECAST + "_" + result.modelName().toLowerCase(Locale.ROOT);
        ForecastModel model = modelRepository.findByModelId(modelId).orElseGet(ForecastModel::new);
        model.setModelId(modelId);
        model.setModelType(TYPE_FORECAST);
        model.setModelName(result.modelName());
        model.setModelVersion(MODEL_VERSION);
        model.setTrainedAt(trainedAt);
        model.setSmape(result.smape());
        model.setMae(result.mae());
        model.setResidualsCount(result.residuals().size());
        model.setMetricsJson(json.write(Map.of(
                "smape", result.smape(),
                "mae", result.mae(),
                "windows", result.windows(),
                "residualsCount", result.residuals().size())));
        model.setActive(active);
        return modelRepository.save(model);
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
