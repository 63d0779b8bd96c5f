package mta.nzb.checker.exception;

import lombok.Getter;

/**
 * HealthCheckCancelledException
 * Thrown when a health check is interrupted or runs past its deadline.
 * No partial result is produced. Results in an HTTP 504 response.
 */
@Getter
public class HealthCheckCancelledException extends RuntimeException {

    private final String type;

    public HealthCheckCancelledException(String type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }

    public static HealthCheckCancelledException interrupted(Throwable cause) {
        return new HealthCheckCancelledException("INTERRUPTED", "Health check was interrupted", cause);
    }

    public static HealthCheckCancelledException deadlineExceeded(long timeoutMs) {
        return new HealthCheckCancelledException("DEADLINE_EXCEEDED",
                "Health check exceeded its deadline of " + timeoutMs + " ms", null);
    }
}
