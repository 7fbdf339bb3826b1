package net.pagewise.core.model;

import java.time.Duration;
import java.util.Objects;

/** ProgressTracker.recordSuccess 입력 */
public record ChunkProgress(
        int processed,
        String newCursor,
        String lastItemKey,
        boolean exhausted,
        Long totalCount,
        Duration suggestedDelay,
        Origin origin              // 청크를 읽기 시작한 위치. null 이면 검사하지 않음
) {
    public ChunkProgress(int processed, String newCursor, String lastItemKey, boolean exhausted, Long totalCount,
                         Duration suggestedDelay) {
        this(processed, newCursor, lastItemKey, exhausted, totalCount, suggestedDelay, null);
    }

    public static ChunkProgress of(int processed, String newCursor) {
        return new ChunkProgress(processed, newCursor, null, false, null, Duration.ZERO);
    }

    public static ChunkProgress from(Chunk chunk) {
        return new ChunkProgress(chunk.items().size(), chunk.newCursor(), chunk.lastItemKey(),
                chunk.exhausted(), chunk.totalCount(), chunk.suggestedDelay());
    }

    /** job 의 현재 위치에서 읽은 청크 */
    public static ChunkProgress from(Chunk chunk, JobRecord startedFrom) {
        return new ChunkProgress(chunk.items().size(), chunk.newCursor(), chunk.lastItemKey(),
                chunk.exhausted(), chunk.totalCount(), chunk.suggestedDelay(), Origin.of(startedFrom));
    }

    public record Origin(String cursor, int generation) {
        public static Origin of(JobRecord job) {
            return new Origin(job.cursor(), job.generation());
        }

        public boolean matches(JobRecord job) {
            return generation == job.generation() && Objects.equals(cursor, job.cursor());
        }
    }
}
