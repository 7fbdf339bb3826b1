package net.pagewise.core.service;

import java.time.Duration;

public record PagerSettings(
        double lowWaterRatio,   // remaining < ratio * limit 이면 지연 제안
        Duration minDelay,
        Duration maxDelay,
        int maxPageSize
) {
    public static PagerSettings defaults() {
        return new PagerSettings(0.10, Duration.ofSeconds(1), Duration.ofSeconds(60), 100);
    }
}
