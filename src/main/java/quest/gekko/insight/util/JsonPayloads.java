package quest.gekko.insight.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.error.ErrorCode;

/** Serializes evidence, playbooks, explanations and metrics into the JSON text columns. */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonPayloads {
    private final ObjectMapper objectMapper;

    public String write(Object payload) {
        if (payload == null) return null;
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize payload of type {}", payload.getClass().getSimpleName(), e);
            throw new AppException(ErrorCode.UNKNOWN_ERROR, "Failed to serialize payload", false, e.getMessage(), e);
        }
    }
}
