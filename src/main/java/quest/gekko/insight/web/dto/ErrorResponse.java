package quest.gekko.insight.web.dto;

import quest.gekko.insight.error.ErrorCode;

public record ErrorResponse(ErrorCode code, String message, boolean retryable) {
}
