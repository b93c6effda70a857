package quest.gekko.insight.domain;

public enum AccelerationTrend {
    ACCELERATING, DECELERATING, STABLE
}
