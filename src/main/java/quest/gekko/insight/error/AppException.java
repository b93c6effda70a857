package quest.gekko.insight.error;

import lombok.Getter;

import java.util.Locale;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Application-wide failure carrying a machine-readable {@link ErrorCode} and a retry hint.
 * Everything that leaves the sync pipeline is normalized into this type by {@link #from(Throwable)}.
 */
@Getter
public class AppException extends RuntimeException {
    private final ErrorCode code;
    private final boolean retryable;
    private final String details;

    public AppException(ErrorCode code, String message, boolean retryable) {
        this(code, message, retryable, null, null);
    }

    public AppException(ErrorCode code, String message, boolean retryable, String details) {
        this(code, message, retryable, details, null);
    }

    public AppException(ErrorCode code, String message, boolean retryable, String details, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.retryable = retryable;
        this.details = details;
    }

    public static AppException syncFailed(String message) {
        return new AppException(ErrorCode.SYNC_FAILED, message, false);
    }

    public static AppException validation(String message) {
        return new AppException(ErrorCode.VALIDATION_ERROR, message, false);
    }

    public static AppException notFound(String message) {
        return new AppException(ErrorCode.NOT_FOUND, message, false);
    }

    public static AppException from(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof AppException app) return app;

        String message = t.getMessage() != null ? t.getMessage() : "An unexpected error occurred";
        String lower = message.toLowerCase(Locale.ROOT);

        if (t instanceof java.net.ConnectException || t instanceof java.net.SocketTimeoutException
                || lower.contains("fetch") || lower.contains("network") || lower.contains("connection refused")) {
            return new AppException(ErrorCode.NETWORK_ERROR, "Network connection problem", true, message, t);
        }
        if (lower.contains("401") || lower.contains("auth") || lower.contains("token")) {
            return new AppException(ErrorCode.AUTH_ERROR, "Authorization failed, check the access token", false, message, t);
        }
        if (lower.contains("429") || lower.contains("quota")) {
            return new AppException(ErrorCode.QUOTA_EXCEEDED, "API quota exceeded", true, message, t);
        }
        if (lower.contains("locked") || lower.contains("busy")) {
            return new AppException(ErrorCode.DB_LOCKED, "Database is locked", true, message, t);
        }
        if (t instanceof IllegalArgumentException || lower.contains("validation") || lower.contains("parse")) {
            return new AppException(ErrorCode.VALIDATION_ERROR, "Data validation failed", false, message, t);
        }
        return new AppException(ErrorCode.UNKNOWN_ERROR, message, false, t.getClass().getName(), t);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
