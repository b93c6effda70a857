package quest.gekko.insight.web.exception;

import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import quest.gekko.insight.error.AppException;
import quest.gekko.insight.error.ErrorCode;
import quest.gekko.insight.web.dto.ErrorResponse;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<ErrorResponse> handleAppException(AppException ex, HttpServletRequest request) {
        HttpStatus status = statusFor(ex.getCode());
        if (status.is5xxServerError()) {
            log.error("{} for URL: {}", ex.getCode(), request.getRequestURL(), ex);
        } else {
            log.warn("{}: {} for URL: {}", ex.getCode(), ex.getMessage(), request.getRequestURL());
        }
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getCode(), ex.getMessage(), ex.isRetryable()));
    }

    @ExceptionHandler({ IllegalArgumentException.class, MethodArgumentTypeMismatchException.class,
            MethodArgumentNotValidException.class })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse handleBadRequest(Exception ex, HttpServletRequest request) {
        log.warn("Bad request: {} for URL: {}", ex.getMessage(), request.getRequestURL());
        return new ErrorResponse(ErrorCode.VALIDATION_ERROR, "Invalid request: " + ex.getMessage(), false);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public ErrorResponse handleGeneralException(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error for URL: {}", request.getRequestURL(), ex);
        return new ErrorResponse(ErrorCode.UNKNOWN_ERROR, "An unexpected error occurred", false);
    }

    static HttpStatus statusFor(ErrorCode code) {
        return switch (code) {
            case SYNC_FAILED -> HttpStatus.CONFLICT;
            case AUTH_ERROR -> HttpStatus.UNAUTHORIZED;
            case QUOTA_EXCEEDED -> HttpStatus.TOO_MANY_REQUESTS;
            case VALIDATION_ERROR -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND -> HttpStatus.NOT_FOUND;
            case NETWORK_ERROR -> HttpStatus.BAD_GATEWAY;
            default -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
