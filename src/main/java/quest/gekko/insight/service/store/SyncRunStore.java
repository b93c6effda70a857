package quest.gekko.insight.service.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insight.domain.SyncRun;
import quest.gekko.insight.domain.SyncStatus;
import quest.gekko.insight.repository.SyncRunRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Diagnostic log of orchestrator runs. The checkpoint is informational and never read back to resume. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class SyncRunStore {
    private final SyncRunRepository repository;

    @Transactional
    public SyncRun start(String mode) {
        SyncRun run = new SyncRun();
        run.setMode(mode);
        run.setStatus(SyncStatus.RUNNING);
        run.setStartedAt(Instant.now());
        return repository.save(run);
    }

    @Transactional
    public void checkpoint(long runId, String label) {
        repository.findById(runId).ifPresent(run -> {
            run.setCheckpoint(label);
            repository.save(run);
        });
    }

    @Transactional
    public void finish(long runId, SyncStatus status, String message) {
        repository.findById(runId).ifPresent(run -> {
            run.setStatus(status);
            run.setFinishedAt(Instant.now());
            run.setMessage(message != null && message.length() > 2000 ? message.substring(0, 2000) : message);
            repository.save(run);
        });
    }

    public Optional<SyncRun> latest() {
        return repository.findTopByOrderByStartedAtDesc();
    }

    public List<SyncRun> recent(int limit) {
        return repository.findAllByOrderByStartedAtDesc(PageRequest.of(0, limit));
    }
}
