package net.pagewise.core.model;

import java.time.Duration;

/**
 * ChunkWorker.runOnce 의 결과. 워커는 예외를 던지지 않고 항상 이 값을 돌려준다.
 */
public record ChunkResult(
        long jobId,
        boolean success,
        ErrorKind errorKind,       // success 면 null
        int itemsProcessed,
        String cursor,
        JobStatus status,          // 처리 후 잡 상태(알 수 없으면 null)
        Duration suggestedDelay,
        String message
) {
    public static ChunkResult success(long jobId, int items, String cursor, JobStatus status, Duration delay) {
        return new ChunkResult(jobId, true, null, items, cursor, status, delay, null);
    }

    public static ChunkResult failure(long jobId, ErrorKind kind, JobStatus status, String message) {
        return new ChunkResult(jobId, false, kind, 0, null, status, Duration.ZERO, message);
    }

    public static ChunkResult lockContention(long jobId) {
        return new ChunkResult(jobId, false, ErrorKind.LOCK_CONTENTION, 0, null, null, Duration.ZERO,
                "job is locked by another worker");
    }

    /** paused/terminal/없는 잡: 처리할 게 없음 (에러 아님) */
    public static ChunkResult skipped(long jobId, JobStatus status, String message) {
        return new ChunkResult(jobId, false, null, 0, null, status, Duration.ZERO, message);
    }

    public boolean contended() {
        return errorKind == ErrorKind.LOCK_CONTENTION;
    }

    public boolean skipped() {
        return !success && errorKind == null;
    }
}
