package net.pagewise.core.service;

import java.time.Duration;

public record TrackerSettings(
        int maxConsecutiveErrors,
        Duration rateLimitFallback,   // resetAt 을 모를 때 쉬는 시간
        int minChunkSize,
        int maxChunkSize
) {
    public static TrackerSettings defaults() {
        return new TrackerSettings(5, Duration.ofMinutes(15), 5, 100);
    }

    public int clampChunkSize(int size) {
        return Math.max(minChunkSize, Math.min(maxChunkSize, size));
    }
}
