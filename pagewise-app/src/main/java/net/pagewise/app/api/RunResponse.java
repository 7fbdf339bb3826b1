package net.pagewise.app.api;

import net.pagewise.core.model.ChunkResult;

public record RunResponse(long jobId, boolean success, String errorKind, int itemsProcessed, String cursor,
                          String status, long suggestedDelayMs, String message) {

    public static RunResponse from(ChunkResult r) {
        return new RunResponse(
                r.jobId(),
                r.success(),
                r.errorKind() == null ? null : r.errorKind().name(),
                r.itemsProcessed(),
                r.cursor(),
                r.status() == null ? null : r.status().code(),
                r.suggestedDelay().toMillis(),
                r.message());
    }
}
