package net.pagewise.core.service;

import java.time.Duration;

public record WorkerSettings(
        Duration lockLease,
        Duration fetchTimeout,
        Duration storeTimeout,
        int growAfterCleanChunks,
        double growthFactor,
        String ownerPrefix
) {
    public static WorkerSettings defaults() {
        return new WorkerSettings(Duration.ofMinutes(5), Duration.ofSeconds(30), Duration.ofSeconds(30), 3, 1.5,
                "worker");
    }
}
