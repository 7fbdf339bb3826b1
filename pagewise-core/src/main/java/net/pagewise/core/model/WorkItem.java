package net.pagewise.core.model;

import java.util.Map;

/**
 * 라우터가 한 번 분류하고 버리는 작업 단위. 저장하지 않는다.
 */
public record WorkItem(
        String sourceEvent,             // 예: "pull_request.edited", "repository.resync"
        JobType jobType,
        String targetId,
        int affectedTargetCount,        // fan-out (영향받는 workspace 수 등)
        DurationClass estimatedDurationClass,
        Long totalEstimate,
        Map<String, String> payload
) {
    public WorkItem {
        estimatedDurationClass = estimatedDurationClass == null ? DurationClass.UNKNOWN : estimatedDurationClass;
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static WorkItem of(String sourceEvent, JobType jobType, String targetId, int affectedTargetCount) {
        return new WorkItem(sourceEvent, jobType, targetId, affectedTargetCount, DurationClass.UNKNOWN, null, Map.of());
    }
}
