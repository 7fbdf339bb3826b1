package net.pagewise.core.model;

import java.time.Instant;

public record RateLimitSnapshot(int remaining, int limit, Instant resetAt) {

    public boolean isExhausted() {
        return remaining <= 0;
    }

    /** remaining < ratio * limit. limit 을 모르면(<=0) 판단하지 않는다 */
    public boolean isBelow(double ratio) {
        return limit > 0 && remaining < ratio * limit;
    }
}
