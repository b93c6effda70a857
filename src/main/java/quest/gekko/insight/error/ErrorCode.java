package quest.gekko.insight.error;

public enum ErrorCode {
    UNKNOWN_ERROR,
    NETWORK_ERROR,
    AUTH_ERROR,
    QUOTA_EXCEEDED,
    DB_LOCKED,
    VALIDATION_ERROR,
    NOT_FOUND,
    SYNC_FAILED
}
