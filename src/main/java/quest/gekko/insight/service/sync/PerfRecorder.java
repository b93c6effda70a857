package quest.gekko.insight.service.sync;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import quest.gekko.insight.domain.PerfEvent;
import quest.gekko.insight.repository.PerfEventRepository;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Times named operations and stores one {@link PerfEvent} per call, successful or not.
 * A failed write of the event is logged and never affects the measured operation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PerfRecorder {
    static final String FAILED_META = "{\"failed\":true}";

    private final PerfEventRepository repository;

    public <T> T measure(String name, Supplier<T> operation) {
        return measure(name, null, operation);
    }

    public <T> T measure(String name, String meta, Supplier<T> operation) {
        long start = System.nanoTime();
        boolean ok = false;
        try {
            T result = operation.get();
            ok = true;
            return result;
        } finally {
            long durationMs = (System.nanoTime() - start) / 1_000_000;
            log.debug("{} took {} ms{}", name, durationMs, ok ? "" : " (failed)");
            record(name, durationMs, ok ? meta : FAILED_META);
        }
    }

    public List<PerfEvent> slowest(int limit) {
        return repository.findAllByOrderByDurationMsDesc(PageRequest.of(0, limit));
    }

    private void record(String name, long durationMs, String meta) {
        try {
            PerfEvent event = new PerfEvent();
            event.setName(name);
            event.setDurationMs(durationMs);
            event.setCreatedAt(Instant.now());
            event.setMeta(meta);
            repository.save(event);
        } catch (RuntimeException e) {
            log.warn("Could not store perf event {}: {}", name, e.getMessage());
        }
    }
}
