package net.pagewise.app.api;

import net.pagewise.core.model.JobRecord;

import java.time.Instant;
import java.util.Map;

/** JobRecord 응답 표현. 리스 컬럼은 내보내지 않는다 */
public record JobView(
        long id,
        String jobType,
        String targetId,
        String status,
        String cursor,
        String lastItemKey,
        Long totalEstimate,
        long processedCount,
        Double progress,
        int chunkSize,
        int errorCount,
        int consecutiveErrorCount,
        String lastError,
        Instant lastErrorAt,
        Instant lastProcessedAt,
        String pauseReason,
        Instant resumeAt,
        Instant nextRunAt,
        boolean locked,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt
) {
    public static JobView from(JobRecord r) {
        Double progress = r.totalKnown()
                ? Math.min(1.0, (double) r.processedCount() / r.totalEstimate())
                : null;
        return new JobView(
                r.id(),
                r.jobType().code(),
                r.targetId(),
                r.status().code(),
                r.cursor(),
                r.lastItemKey(),
                r.totalEstimate(),
                r.processedCount(),
                progress,
                r.chunkSize(),
                r.errorCount(),
                r.consecutiveErrorCount(),
                r.lastError(),
                r.lastErrorAt(),
                r.lastProcessedAt(),
                r.pauseReason() == null ? null : r.pauseReason().code(),
                r.resumeAt(),
                r.nextRunAt(),
                r.lockOwner() != null,
                r.metadata(),
                r.createdAt(),
                r.updatedAt());
    }
}
