package quest.gekko.insight.provider.youtube;

import quest.gekko.insight.error.AppException;
import quest.gekko.insight.error.ErrorCode;

/**
 * Maps a non-2xx response onto the error taxonomy: 401 is auth, 403 is quota when the error
 * reason says so and auth otherwise, everything else is a retryable network error.
 */
public final class HttpErrorClassifier {

    private HttpErrorClassifier() {
    }

    public static AppException classify(int status, String body) {
        if (status == 401) {
            return new AppException(ErrorCode.AUTH_ERROR, "Unauthorized: token expired or invalid", false, body);
        }
        if (status == 403) {
            if (body != null && body.contains("quotaExceeded")) {
                return new AppException(ErrorCode.QUOTA_EXCEEDED, "API quota exceeded", true, body);
            }
            return new AppException(ErrorCode.AUTH_ERROR, "Forbidden access", false, body);
        }
        if (status == 429) {
            return new AppException(ErrorCode.NETWORK_ERROR, "Rate limited by remote API (429)", true, body);
        }
        return new AppException(ErrorCode.NETWORK_ERROR, "HTTP error " + status, true, body);
    }
}
