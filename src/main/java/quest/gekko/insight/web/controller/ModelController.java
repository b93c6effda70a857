package quest.gekko.insight.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.insight.domain.Channel;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.ml.forecast.ForecastResult;
import quest.gekko.insight.service.analytics.ForecastService;
import quest.gekko.insight.service.registry.ModelRegistry;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.web.dto.ForecastModelDTO;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class ModelController {
    private final ModelRegistry registry;
    private final ForecastService forecastService;
    private final AnalyticsStore store;
    private final Clock clock;

    @GetMapping("/models")
    public Map<String, Object> models() {
        List<ForecastModelDTO> models = registry.listModels(ModelRegistry.TYPE_FORECAST).stream()
                .map(ForecastModelDTO::from)
                .toList();
        return Map.of("active", registry.activeModelName(ModelRegistry.TYPE_FORECAST), "models", models);
    }

    @PostMapping("/models/train")
    public Map<String, Object> train(@RequestParam(required = false) String channelId) {
        String target = resolveChannel(channelId);
        var active = registry.trainAndEvaluate(target, LocalDate.now(clock));
        return Map.of(
                "channelId", target,
                "trained", active.isPresent(),
                "active", registry.activeModelName(ModelRegistry.TYPE_FORECAST));
    }

    @GetMapping("/forecast")
    public ForecastResult forecast(@RequestParam(required = false) String channelId,
                                   @RequestParam(defaultValue = "7") int horizon) {
        return forecastService.forecastChannel(resolveChannel(channelId), horizon);
    }

    private String resolveChannel(String channelId) {
        if (channelId != null && !channelId.isBlank()) return channelId;
        return store.getOwnedChannel()
                .map(Channel::getChannelId)
                .orElseThrow(() -> AppException.notFound("No channel has been synced yet"));
    }
}
