package quest.gekko.insight.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.service.store.SyncRunStore;
import quest.gekko.insight.service.sync.PerfRecorder;
import quest.gekko.insight.service.sync.SyncOrchestrator;
import quest.gekko.insight.service.sync.SyncResult;
import quest.gekko.insight.util.DateRange;
import quest.gekko.insight.web.dto.PerfEventDTO;
import quest.gekko.insight.web.dto.SyncRunDTO;
import quest.gekko.insight.web.dto.SyncStatusDTO;

import java.time.LocalDate;
import java.util.List;

@RestController
@RequestMapping("/api/sync")
@RequiredArgsConstructor
public class SyncController {
    private final SyncOrchestrator orchestrator;
    private final SyncRunStore syncRuns;
    private final PerfRecorder perf;

    // Runs synchronously; a second call while one is in flight gets 409
    @PostMapping
    public SyncResult sync(@RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
                           @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to) {
        if ((from == null) != (to == null)) {
            throw AppException.validation("Both 'from' and 'to' are required when a range is given");
        }
        return orchestrator.run(from == null ? null : new DateRange(from, to));
    }

    @GetMapping("/status")
    public SyncStatusDTO status() {
        return new SyncStatusDTO(orchestrator.isRunning(), syncRuns.latest().map(SyncRunDTO::from).orElse(null));
    }

    @GetMapping("/runs")
    public List<SyncRunDTO> runs(@RequestParam(defaultValue = "20") int limit) {
        return syncRuns.recent(limit).stream().map(SyncRunDTO::from).toList();
    }

    @GetMapping("/perf")
    public List<PerfEventDTO> slowest(@RequestParam(defaultValue = "20") int limit) {
        return perf.slowest(limit).stream().map(PerfEventDTO::from).toList();
    }
}
