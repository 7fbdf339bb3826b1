package net.pagewise.core.error;

import java.time.Instant;

/** upstream quota 소진(remaining == 0). resetAt 까지 잡을 멈춘다 */
public class RateLimitExceededException extends Exception {
    private final Instant resetAt;

    public RateLimitExceededException(String message, Instant resetAt) {
        super(message);
        this.resetAt = resetAt;
    }

    public Instant getResetAt() {
        return resetAt;
    }
}
