package quest.gekko.insight.service.plugin;

import java.util.List;

/**
 * An independent analyzer run once per sync. Returns an empty list when there is nothing to
 * report; exceptions are reserved for real failures and are contained by the registry.
 */
public interface InsightPlugin {

    String name();

    List<Insight> analyze(InsightContext context);
}
