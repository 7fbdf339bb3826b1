package net.pagewise.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 백필/싱크 잡 한 건. 잡 상태의 유일한 원본(TB_JOB_RECORD 한 행).
 * <p>
 * pauseReason/resumeAt/nextRunAt 은 스케줄링 판단에 쓰는 typed 필드이고,
 * metadata 는 관찰용 부가 정보일 뿐 스케줄링 판단에 쓰지 않는다.
 */
public record JobRecord(
        Long id,
        JobType jobType,
        String targetId,
        JobStatus status,
        String cursor,
        String lastItemKey,
        Long totalEstimate,          // null = 아직 모름
        long processedCount,
        int chunkSize,
        int errorCount,
        int consecutiveErrorCount,
        String lastError,
        Instant lastErrorAt,
        Instant lastProcessedAt,
        PauseReason pauseReason,
        Instant resumeAt,            // rate limit pause 해제 가능 시각
        Instant nextRunAt,           // pager 가 제안한 throttle 지연
        String lockOwner,
        Instant lockUntil,
        Map<String, String> metadata,
        Instant createdAt,
        Instant updatedAt
) {
    public static final String META_PAUSE_REASON = "pauseReason";
    public static final String META_RESUME_AT = "resumeAt";
    public static final String META_THROTTLED_UNTIL = "throttledUntil";
    public static final String META_CLEAN_CHUNKS = "cleanChunks";
    public static final String META_GENERATION = "generation";

    public JobRecord {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static JobRecord ofNew(JobType jobType, String targetId, int chunkSize, Long totalEstimate) {
        return new JobRecord(null, jobType, targetId, JobStatus.QUEUED, null, null, totalEstimate, 0L, chunkSize,
                0, 0, null, null, null, null, null, null, null, null, Map.of(), null, null);
    }

    public boolean totalKnown() {
        return totalEstimate != null && totalEstimate > 0;
    }

    public boolean reachedEstimate() {
        return totalKnown() && processedCount >= totalEstimate;
    }

    public int cleanChunkStreak() {
        String v = metadata.get(META_CLEAN_CHUNKS);
        if (v == null) return 0;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return 0; }
    }

    /** 리셋할 때마다 1씩 올라가는 세대 번호 */
    public int generation() {
        String v = metadata.get(META_GENERATION);
        if (v == null) return 0;
        try { return Integer.parseInt(v); } catch (NumberFormatException e) { return 0; }
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /** 트래커가 다음 상태를 계산할 때 쓰는 가변 빌더 */
    public static final class Builder {
        private Long id;
        private JobType jobType;
        private String targetId;
        private JobStatus status;
        private String cursor;
        private String lastItemKey;
        private Long totalEstimate;
        private long processedCount;
        private int chunkSize;
        private int errorCount;
        private int consecutiveErrorCount;
        private String lastError;
        private Instant lastErrorAt;
        private Instant lastProcessedAt;
        private PauseReason pauseReason;
        private Instant resumeAt;
        private Instant nextRunAt;
        private String lockOwner;
        private Instant lockUntil;
        private final Map<String, String> metadata;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder(JobRecord r) {
            this.id = r.id;
            this.jobType = r.jobType;
            this.targetId = r.targetId;
            this.status = r.status;
            this.cursor = r.cursor;
            this.lastItemKey = r.lastItemKey;
            this.totalEstimate = r.totalEstimate;
            this.processedCount = r.processedCount;
            this.chunkSize = r.chunkSize;
            this.errorCount = r.errorCount;
            this.consecutiveErrorCount = r.consecutiveErrorCount;
            this.lastError = r.lastError;
            this.lastErrorAt = r.lastErrorAt;
            this.lastProcessedAt = r.lastProcessedAt;
            this.pauseReason = r.pauseReason;
            this.resumeAt = r.resumeAt;
            this.nextRunAt = r.nextRunAt;
            this.lockOwner = r.lockOwner;
            this.lockUntil = r.lockUntil;
            this.metadata = new LinkedHashMap<>(r.metadata);
            this.createdAt = r.createdAt;
            this.updatedAt = r.updatedAt;
        }

        public Builder id(Long v) { this.id = v; return this; }
        public Builder status(JobStatus v) { this.status = v; return this; }
        public Builder cursor(String v) { this.cursor = v; return this; }
        public Builder lastItemKey(String v) { this.lastItemKey = v; return this; }
        public Builder totalEstimate(Long v) { this.totalEstimate = v; return this; }
        public Builder processedCount(long v) { this.processedCount = v; return this; }
        public Builder chunkSize(int v) { this.chunkSize = v; return this; }
        public Builder errorCount(int v) { this.errorCount = v; return this; }
        public Builder consecutiveErrorCount(int v) { this.consecutiveErrorCount = v; return this; }
        public Builder lastError(String v) { this.lastError = v; return this; }
        public Builder lastErrorAt(Instant v) { this.lastErrorAt = v; return this; }
        public Builder lastProcessedAt(Instant v) { this.lastProcessedAt = v; return this; }
        public Builder pauseReason(PauseReason v) { this.pauseReason = v; return this; }
        public Builder resumeAt(Instant v) { this.resumeAt = v; return this; }
        public Builder nextRunAt(Instant v) { this.nextRunAt = v; return this; }
        public Builder lockOwner(String v) { this.lockOwner = v; return this; }
        public Builder lockUntil(Instant v) { this.lockUntil = v; return this; }
        public Builder createdAt(Instant v) { this.createdAt = v; return this; }
        public Builder updatedAt(Instant v) { this.updatedAt = v; return this; }

        public Builder meta(String key, String value) {
            if (value == null) metadata.remove(key); else metadata.put(key, value);
            return this;
        }

        public Builder clearPause() {
            this.pauseReason = null;
            this.resumeAt = null;
            metadata.remove(META_PAUSE_REASON);
            metadata.remove(META_RESUME_AT);
            return this;
        }

        public JobRecord build() {
            return new JobRecord(id, jobType, targetId, status, cursor, lastItemKey, totalEstimate, processedCount,
                    chunkSize, errorCount, consecutiveErrorCount, lastError, lastErrorAt, lastProcessedAt,
                    pauseReason, resumeAt, nextRunAt, lockOwner, lockUntil, metadata, createdAt, updatedAt);
        }
    }
}
