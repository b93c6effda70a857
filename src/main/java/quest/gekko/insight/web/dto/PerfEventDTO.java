package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.PerfEvent;

import java.time.Instant;

public record PerfEventDTO(String name, long durationMs, Instant createdAt, String meta) {

    public static PerfEventDTO from(PerfEvent event) {
        return new PerfEventDTO(event.getName(), event.getDurationMs(), event.getCreatedAt(), event.getMeta());
    }
}
