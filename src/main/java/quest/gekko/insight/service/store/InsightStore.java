package quest.gekko.insight.service.store;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import quest.gekko.insight.domain.AlertRecord;
import quest.gekko.insight.domain.InsightRecord;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.repository.AlertRecordRepository;
import quest.gekko.insight.repository.InsightRecordRepository;

import java.util.List;

/** Append-only insight and alert log, tagged with the producing run. */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class InsightStore {
    private final InsightRecordRepository insightRepository;
    private final AlertRecordRepository alertRepository;

    @Transactional
    public InsightRecord insertInsight(InsightRecord record) {
        return insightRepository.save(record);
    }

    @Transactional
    public AlertRecord insertAlert(AlertRecord record) {
        return alertRepository.save(record);
    }

    @Transactional
    public AlertRecord acknowledge(long alertId) {
        AlertRecord alert = alertRepository.findById(alertId)
                .orElseThrow(() -> AppException.notFound("Unknown alert " + alertId));
        alert.setAcknowledged(true);
        return alertRepository.save(alert);
    }

    public List<InsightRecord> getInsights(long runId) {
        return insightRepository.findByRunIdOrderByIdAsc(runId);
    }

    public List<InsightRecord> getRecentInsights(int limit) {
        return insightRepository.findAllByOrderByCreatedAtDesc(PageRequest.of(0, limit));
    }

    public List<AlertRecord> getAlerts(long runId) {
        return alertRepository.findByRunIdOrderByIdAsc(runId);
    }

    public List<AlertRecord> getOpenAlerts(int limit) {
        return alertRepository.findByAcknowledgedFalseOrderByCreatedAtDesc(PageRequest.of(0, limit));
    }
}
