package quest.gekko.insight.web.dto;

/** Whether a run is in flight, plus the most recent run if there has been one. */
public record SyncStatusDTO(boolean running, SyncRunDTO latest) {
}
