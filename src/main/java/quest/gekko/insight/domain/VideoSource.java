package quest.gekko.insight.domain;

public enum VideoSource {
    OWNED, COMPETITOR
}
