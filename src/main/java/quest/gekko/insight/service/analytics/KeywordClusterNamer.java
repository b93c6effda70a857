package quest.gekko.insight.service.analytics;

import org.springframework.stereotype.Component;
import quest.gekko.insight.ml.text.TextProcessing;

import java.util.List;

/** Deterministic naming by the three most frequent title words. */
@Component
public class KeywordClusterNamer implements ClusterNamer {
    static final int NAME_WORDS = 3;

    @Override
    public ClusterLabel name(List<String> titles) {
        String name = TextProcessing.topWords(titles, NAME_WORDS);
        return new ClusterLabel(name.isEmpty() ? "Untitled topic" : name,
                "Cluster containing " + titles.size() + " videos.");
    }
}
