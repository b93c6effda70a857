package quest.gekko.insight.service.scheduling;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.service.registry.ModelRegistry;
import quest.gekko.insight.service.sync.SyncOrchestrator;
import quest.gekko.insight.service.sync.SyncResult;

import java.time.Clock;
import java.time.LocalDate;

@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "insight.sync.scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler {
    private final SyncOrchestrator orchestrator;
    private final ModelRegistry modelRegistry;
    private final Clock clock;

    // 02:10 UTC daily unless overridden
    @Scheduled(cron = "${insight.sync.cron:0 10 2 * * *}", zone = "UTC")
    public void runDailySync() {
        SyncResult result;
        try {
            result = orchestrator.run(null);
        } catch (AppException e) {
            log.warn("Scheduled sync did not complete: {} {}", e.getCode(), e.getMessage());
            return;
        }
        modelRegistry.trainAndEvaluate(result.channelId(), LocalDate.now(clock));
    }
}
