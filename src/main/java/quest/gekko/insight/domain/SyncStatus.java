package quest.gekko.insight.domain;

public enum SyncStatus {
    RUNNING, SUCCESS, FAILED
}
