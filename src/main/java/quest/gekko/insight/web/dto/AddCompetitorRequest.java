package quest.gekko.insight.web.dto;

import jakarta.validation.constraints.NotBlank;

public record AddCompetitorRequest(@NotBlank String channelId) {
}
