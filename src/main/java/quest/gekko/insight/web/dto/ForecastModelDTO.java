package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.ForecastModel;

import java.time.Instant;

public record ForecastModelDTO(String modelId, String type, String name, String version, Instant trainedAt,
                               double smape, double mae, int residualsCount, boolean active) {

    public static ForecastModelDTO from(ForecastModel m) {
        return new ForecastModelDTO(m.getModelId(), m.getModelType(), m.getModelName(), m.getModelVersion(),
                m.getTrainedAt(), m.getSmape(), m.getMae(), m.getResidualsCount(), m.isActive());
    }
}
