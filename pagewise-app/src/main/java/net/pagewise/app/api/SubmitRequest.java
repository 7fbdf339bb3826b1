package net.pagewise.app.api;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import net.pagewise.core.model.DurationClass;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.WorkItem;

import java.util.Map;

public record SubmitRequest(
        @NotBlank String sourceEvent,
        @NotBlank String jobType,
        @NotBlank String targetId,
        @Min(0) Integer affectedTargetCount,
        String estimatedDurationClass,
        Long totalEstimate,
        Map<String, String> payload
) {
    public WorkItem toWorkItem() {
        return new WorkItem(
                sourceEvent,
                JobType.from(jobType),
                targetId,
                affectedTargetCount == null ? 1 : affectedTargetCount,
                DurationClass.from(estimatedDurationClass),
                totalEstimate,
                payload);
    }
}
