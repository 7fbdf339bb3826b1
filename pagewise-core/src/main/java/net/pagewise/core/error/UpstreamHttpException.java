package net.pagewise.core.error;

import java.time.Instant;

/** upstream 이 2xx 가 아닌 응답을 준 경우 */
public class UpstreamHttpException extends Exception {
    private final int status;
    private final Integer rateLimitRemaining;
    private final Instant resetAt;

    public UpstreamHttpException(int status, String message) {
        this(status, message, null, null);
    }

    public UpstreamHttpException(int status, String message, Integer rateLimitRemaining, Instant resetAt) {
        super("HTTP " + status + ": " + message);
        this.status = status;
        this.rateLimitRemaining = rateLimitRemaining;
        this.resetAt = resetAt;
    }

    public int getStatus() {
        return status;
    }

    public Integer getRateLimitRemaining() {
        return rateLimitRemaining;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
