package quest.gekko.insight.service.plugin;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import quest.gekko.insight.domain.AlertRecord;
import quest.gekko.insight.domain.InsightRecord;
import quest.gekko.insight.service.store.InsightStore;
import quest.gekko.insight.util.JsonPayloads;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs every registered plugin in order and persists what each returns under the run id.
 * A failing plugin is logged and skipped; the others still run and keep their results.
 */
@Slf4j
@Service
public class InsightPluginRegistry {
    private final List<InsightPlugin> plugins;
    private final InsightStore insightStore;
    private final JsonPayloads json;

    public InsightPluginRegistry(List<InsightPlugin> plugins, InsightStore insightStore, JsonPayloads json) {
        this.plugins = List.copyOf(plugins);
        this.insightStore = insightStore;
        this.json = json;
    }

    public List<String> pluginNames() {
        return plugins.stream().map(InsightPlugin::name).toList();
    }

    public RunSummary runAll(InsightContext context) {
        log.info("Running {} insight plugins for run {}", plugins.size(), context.runId());
        int insights = 0;
        int alerts = 0;
        List<String> failed = new ArrayList<>();

        for (InsightPlugin plugin : plugins) {
            try {
                for (Insight insight : plugin.analyze(context)) {
                    persist(context.runId(), insight);
                    insights++;
                    if (insight.hasAlert()) alerts++;
                }
            } catch (RuntimeException e) {
                log.error("Insight plugin {} failed in run {}", plugin.name(), context.runId(), e);
                failed.add(plugin.name());
            }
        }
        log.info("Plugins finished for run {}: {} insights, {} alerts, {} failed", context.runId(), insights, alerts, failed.size());
        return new RunSummary(insights, alerts, List.copyOf(failed));
    }

    private void persist(long runId, Insight insight) {
        InsightRecord record = new InsightRecord();
        record.setRunId(runId);
        record.setInsightType(insight.type());
        record.setTitle(insight.title());
        record.setDescription(insight.description());
        record.setEvidenceJson(json.write(insight.evidence()));
        insightStore.insertInsight(record);

        if (insight.hasAlert()) {
            Insight.Alert alert = insight.alert();
            AlertRecord row = new AlertRecord();
            row.setRunId(runId);
            row.setAlertType(insight.type());
            row.setSeverity(alert.severity());
            row.setMessage(alert.message());
            row.setEntityId(alert.entityId());
            row.setActionJson(json.write(alert.action()));
            insightStore.insertAlert(row);
        }
    }

    public record RunSummary(int insights, int alerts, List<String> failedPlugins) {}
}
