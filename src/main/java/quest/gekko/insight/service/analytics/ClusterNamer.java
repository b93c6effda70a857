package quest.gekko.insight.service.analytics;

import java.util.List;

/** Names a topic cluster from its member titles. */
public interface ClusterNamer {

    ClusterLabel name(List<String> titles);

    record ClusterLabel(String name, String description) {}
}
