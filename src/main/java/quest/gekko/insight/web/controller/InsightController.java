package quest.gekko.insight.web.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import quest.gekko.insight.ml.nowcast.NowcastPrediction;
import quest.gekko.insight.service.analytics.NowcastService;
import quest.gekko.insight.service.analytics.TopicEngine;
import quest.gekko.insight.service.store.AnalyticsStore;
import quest.gekko.insight.service.store.InsightStore;
import quest.gekko.insight.web.dto.AlertDTO;
import quest.gekko.insight.web.dto.InsightDTO;
import quest.gekko.insight.web.dto.QualityScoreDTO;
import quest.gekko.insight.web.dto.TopicGapDTO;

import java.util.List;

/** Read side of the pipeline's derived data. */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class InsightController {
    private final InsightStore insightStore;
    private final AnalyticsStore store;
    private final TopicEngine topicEngine;
    private final NowcastService nowcast;

    @GetMapping("/insights")
    public List<InsightDTO> insights(@RequestParam(required = false) Long runId,
                                     @RequestParam(defaultValue = "50") int limit) {
        var records = runId != null ? insightStore.getInsights(runId) : insightStore.getRecentInsights(limit);
        return records.stream().map(InsightDTO::from).toList();
    }

    @GetMapping("/alerts")
    public List<AlertDTO> alerts(@RequestParam(required = false) Long runId,
                                 @RequestParam(defaultValue = "50") int limit) {
        var records = runId != null ? insightStore.getAlerts(runId) : insightStore.getOpenAlerts(limit);
        return records.stream().map(AlertDTO::from).toList();
    }

    @PostMapping("/alerts/{id}/ack")
    public AlertDTO acknowledge(@PathVariable long id) {
        return AlertDTO.from(insightStore.acknowledge(id));
    }

    @GetMapping("/quality")
    public List<QualityScoreDTO> qualityRanking() {
        return store.getQualityRanking().stream().map(QualityScoreDTO::from).toList();
    }

    @GetMapping("/topics/gaps")
    public List<TopicGapDTO> gaps() {
        return topicEngine.getGaps().stream().map(TopicGapDTO::from).toList();
    }

    @GetMapping("/videos/{videoId}/nowcast")
    public NowcastPrediction nowcast(@PathVariable String videoId) {
        return nowcast.predict(videoId);
    }
}
