package quest.gekko.insight.web.dto;

import quest.gekko.insight.domain.SyncRun;
import quest.gekko.insight.domain.SyncStatus;

import java.time.Instant;

public record SyncRunDTO(Long id, Instant startedAt, Instant finishedAt, SyncStatus status,
                         String mode, String checkpoint, String message) {

    public static SyncRunDTO from(SyncRun run) {
        return new SyncRunDTO(run.getId(), run.getStartedAt(), run.getFinishedAt(), run.getStatus(),
                run.getMode(), run.getCheckpoint(), run.getMessage());
    }
}
