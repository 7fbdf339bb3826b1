package net.pagewise.core.service;

import net.pagewise.core.error.JobNotFoundException;
import net.pagewise.core.error.StaleChunkException;
import net.pagewise.core.model.ChunkProgress;
import net.pagewise.core.model.ErrorKind;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.model.PauseReason;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.JobRecordRepository;
import net.pagewise.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * JobRecord 상태 머신의 주인.
 * <pre>
 *   queued → active → {paused, completed, failed}
 *   paused → active (resume, 또는 resetAt 이 지난 rate-limit pause)
 * </pre>
 * 모든 변경은 "행 잠금 조회 → 다음 상태 계산 → 저장"을 한 트랜잭션에서 수행한다.
 * 같은 잡에 대한 변경은 행 잠금으로 직렬화되고, 서로 다른 잡끼리는 독립적이다.
 */
public final class ProgressTracker {
    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);
    private static final int MAX_ERROR_LENGTH = 4000;

    private final JobRecordRepository jobs;
    private final TxRunner tx;
    private final Clock clock;
    private final TrackerSettings settings;

    public ProgressTracker(JobRecordRepository jobs, TxRunner tx, Clock clock, TrackerSettings settings) {
        this.jobs = jobs;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
    }

    public TrackerSettings settings() {
        return settings;
    }

    public JobRecord recordSuccess(long jobId, int processed, String newCursor) throws Exception {
        return recordSuccess(jobId, ChunkProgress.of(processed, newCursor));
    }

    /**
     * 청크 하나가 도메인 저장까지 끝난 뒤 호출한다. 커서/카운터를 전진시키고
     * 연속 에러를 0으로 되돌린다. upstream 이 끝났거나 processedCount ≥ totalEstimate 면 completed.
     * <p>
     * origin 이 있는 진행은 그 청크가 읽기 시작한 위치(커서, 세대)가 지금 잡과 같을 때만 반영한다.
     * 청크가 도는 사이 리셋됐으면 {@link StaleChunkException} 으로 거절하고 아무것도 바꾸지 않는다.
     */
    public JobRecord recordSuccess(long jobId, ChunkProgress p) throws Exception {
        if (p.processed() < 0) throw new IllegalArgumentException("processed must be >= 0");
        return mutate(jobId, cur -> {
            if (cur.status().isTerminal()) {
                log.warn("ignoring chunk success for {} job {}", cur.status().code(), jobId);
                return cur;
            }
            if (p.origin() != null && !p.origin().matches(cur)) {
                log.warn("discarding stale chunk for job {}: started at cursor={} gen={}, job now at cursor={} gen={}",
                        jobId, p.origin().cursor(), p.origin().generation(), cur.cursor(), cur.generation());
                throw new StaleChunkException(jobId, cur.status());
            }
            Instant now = clock.now();
            long processed = cur.processedCount() + p.processed();
            Long total = reviseUpward(cur.totalEstimate(), p.totalCount());
            if (total != null && total > 0 && processed > total) total = processed;

            var b = cur.toBuilder()
                    .processedCount(processed)
                    .totalEstimate(total)
                    .cursor(p.newCursor() != null ? p.newCursor() : cur.cursor())
                    .lastItemKey(p.lastItemKey() != null ? p.lastItemKey() : cur.lastItemKey())
                    .consecutiveErrorCount(0)
                    .lastProcessedAt(now)
                    .meta(JobRecord.META_CLEAN_CHUNKS, String.valueOf(cur.cleanChunkStreak() + 1));

            // admin pause 이후 끝난 in-flight 워커: 진행은 반영하되 paused 유지
            if (cur.status() != JobStatus.PAUSED) b.status(JobStatus.ACTIVE);

            Duration delay = p.suggestedDelay();
            if (delay != null && !delay.isZero() && !delay.isNegative()) {
                Instant until = now.plus(delay);
                b.nextRunAt(until).meta(JobRecord.META_THROTTLED_UNTIL, until.toString());
            } else {
                b.nextRunAt(null).meta(JobRecord.META_THROTTLED_UNTIL, null);
            }

            boolean done = p.exhausted() || (total != null && total > 0 && processed >= total);
            if (done) {
                b.status(JobStatus.COMPLETED).clearPause().nextRunAt(null)
                        .meta(JobRecord.META_THROTTLED_UNTIL, null)
                        .meta("completedAt", now.toString());
                log.info("job {} ({} {}) completed: processed={}/{}", jobId, cur.jobType().code(), cur.targetId(),
                        processed, total);
            } else {
                log.debug("job {} advanced: +{} → {}/{} cursor={}", jobId, p.processed(), processed, total,
                        p.newCursor());
            }
            return b.build();
        });
    }

    /**
     * 에러 기록. RATE_LIMITED 는 카운터와 무관하게 즉시 pause, FATAL 은 failed,
     * TRANSIENT 는 연속 에러가 한도에 닿으면 pause.
     */
    public JobRecord recordError(long jobId, ErrorKind kind, String message, Instant resetAt) throws Exception {
        if (kind == ErrorKind.LOCK_CONTENTION) {
            return tx.required(() -> jobs.findById(jobId).orElseThrow(() -> new JobNotFoundException(jobId)));
        }
        return mutate(jobId, cur -> {
            if (cur.status().isTerminal()) {
                log.warn("ignoring {} error for {} job {}: {}", kind, cur.status().code(), jobId, message);
                return cur;
            }
            Instant now = clock.now();
            int consecutive = cur.consecutiveErrorCount() + 1;
            var b = cur.toBuilder()
                    .errorCount(cur.errorCount() + 1)
                    .consecutiveErrorCount(consecutive)
                    .lastError(truncate(message))
                    .lastErrorAt(now)
                    .meta(JobRecord.META_CLEAN_CHUNKS, "0");

            boolean alreadyPaused = cur.status() == JobStatus.PAUSED;
            switch (kind) {
                case FATAL -> {
                    b.status(JobStatus.FAILED).nextRunAt(null).meta("failedAt", now.toString());
                    log.warn("job {} failed permanently: {}", jobId, message);
                }
                case RATE_LIMITED -> {
                    if (!alreadyPaused) {
                        Instant until = resetAt != null ? resetAt : now.plus(settings.rateLimitFallback());
                        pause(b, PauseReason.RATE_LIMITED, until);
                        log.info("job {} paused until {} (rate limited)", jobId, until);
                    }
                }
                default -> {
                    if (!alreadyPaused && consecutive >= settings.maxConsecutiveErrors()) {
                        pause(b, PauseReason.TOO_MANY_ERRORS, null);
                        log.warn("job {} paused after {} consecutive errors, last: {}", jobId, consecutive, message);
                    }
                }
            }
            return b.build();
        });
    }

    /**
     * 스케줄러가 워커를 띄우기 전에 묻는 단 하나의 판단 지점.
     * 필요하면 상태를 함께 바꾼다(completed 전환, rate-limit 자동 재개, 에러 한도 pause).
     */
    public boolean shouldContinue(long jobId) throws Exception {
        return tx.required(() -> {
            JobRecord cur = jobs.lockById(jobId).orElse(null);
            if (cur == null) return false;

            Instant now = clock.now();
            if (cur.status().isTerminal() || cur.status() == JobStatus.UNKNOWN) return false;

            if (cur.reachedEstimate()) {
                jobs.update(cur.toBuilder().status(JobStatus.COMPLETED).clearPause().nextRunAt(null)
                        .meta("completedAt", now.toString()).build());
                log.info("job {} completed: processed {} ≥ estimate {}", jobId, cur.processedCount(),
                        cur.totalEstimate());
                return false;
            }

            JobRecord job = cur;
            if (job.status() == JobStatus.PAUSED) {
                boolean quotaBack = job.pauseReason() == PauseReason.RATE_LIMITED
                        && job.resumeAt() != null && now.isAfter(job.resumeAt());
                if (!quotaBack) return false;
                job = job.toBuilder().status(JobStatus.ACTIVE).consecutiveErrorCount(0).clearPause()
                        .meta("resumedAt", now.toString()).build();
                jobs.update(job);
                log.info("job {} resumed: rate limit window reset", jobId);
            }

            if (job.consecutiveErrorCount() >= settings.maxConsecutiveErrors()) {
                var b = job.toBuilder();
                pause(b, PauseReason.TOO_MANY_ERRORS, null);
                jobs.update(b.build());
                log.warn("job {} paused: {} consecutive errors", jobId, job.consecutiveErrorCount());
                return false;
            }

            return job.nextRunAt() == null || !now.isBefore(job.nextRunAt());
        });
    }

    /** 적응형 청크 크기. 다음 독립 실행이 이어받도록 저장한다 */
    public JobRecord updateChunkSize(long jobId, int newSize) throws Exception {
        if (newSize < 1) throw new IllegalArgumentException("chunkSize must be >= 1: " + newSize);
        int size = settings.clampChunkSize(newSize);
        return mutate(jobId, cur -> {
            if (cur.status().isTerminal()) {
                throw new IllegalStateException("job " + jobId + " is " + cur.status().code());
            }
            if (cur.chunkSize() == size) return cur;
            log.info("job {} chunk size {} → {}", jobId, cur.chunkSize(), size);
            return cur.toBuilder().chunkSize(size).meta(JobRecord.META_CLEAN_CHUNKS, "0").build();
        });
    }

    /** totalEstimate 상향 조정 (upstream 전체 수가 늘어난 경우) */
    public JobRecord reviseTotalEstimate(long jobId, long total) throws Exception {
        return mutate(jobId, cur -> {
            if (cur.status().isTerminal()) return cur;
            Long revised = reviseUpward(cur.totalEstimate(), total);
            if (revised == null || revised.equals(cur.totalEstimate())) return cur;
            return cur.toBuilder().totalEstimate(revised).build();
        });
    }

    /** 관리자 재개: paused 에서만 가능 */
    public JobRecord resume(long jobId) throws Exception {
        return mutate(jobId, cur -> {
            if (cur.status() != JobStatus.PAUSED) {
                throw new IllegalStateException("job " + jobId + " is " + cur.status().code() + ", not paused");
            }
            log.info("job {} resumed (was {})", jobId, cur.pauseReason() == null ? "-" : cur.pauseReason().code());
            return cur.toBuilder().status(JobStatus.ACTIVE).consecutiveErrorCount(0).clearPause().nextRunAt(null)
                    .meta("resumedAt", clock.now().toString()).build();
        });
    }

    /** 관리자 일시정지: 진행 중인 워커는 끊지 않고, 다음 shouldContinue 에서 멈춘다 */
    public JobRecord pause(long jobId) throws Exception {
        return pause(jobId, PauseReason.MANUAL);
    }

    public JobRecord pause(long jobId, PauseReason reason) throws Exception {
        if (reason == null) throw new IllegalArgumentException("reason is required");
        return mutate(jobId, cur -> {
            if (cur.status().isTerminal()) {
                throw new IllegalStateException("job " + jobId + " is " + cur.status().code());
            }
            if (cur.status() == JobStatus.PAUSED) return cur;
            var b = cur.toBuilder();
            pause(b, reason, null);
            log.info("job {} paused ({})", jobId, reason.code());
            return b.build();
        });
    }

    /** 관리자 리셋: 어떤 상태든 queued 로, 카운터/커서/에러 초기화 */
    public JobRecord reset(long jobId) throws Exception {
        return mutate(jobId, cur -> {
            log.info("job {} reset from {} (processed={})", jobId, cur.status().code(), cur.processedCount());
            return cur.toBuilder()
                    .status(JobStatus.QUEUED)
                    .cursor(null)
                    .lastItemKey(null)
                    .processedCount(0)
                    .errorCount(0)
                    .consecutiveErrorCount(0)
                    .lastError(null)
                    .lastErrorAt(null)
                    .lastProcessedAt(null)
                    .nextRunAt(null)
                    .clearPause()
                    .meta(JobRecord.META_THROTTLED_UNTIL, null)
                    .meta(JobRecord.META_CLEAN_CHUNKS, null)
                    .meta("completedAt", null)
                    .meta("failedAt", null)
                    .meta(JobRecord.META_GENERATION, String.valueOf(cur.generation() + 1))
                    .meta("resetAt", clock.now().toString())
                    .build();
        });
    }

    /** metadata 메모 (관찰용, terminal 은 건드리지 않음) */
    public JobRecord annotate(long jobId, String key, String value) throws Exception {
        return annotate(jobId, Collections.singletonMap(key, value));
    }

    public JobRecord annotate(long jobId, Map<String, String> notes) throws Exception {
        return mutate(jobId, cur -> {
            if (cur.status().isTerminal() || notes.isEmpty()) return cur;
            var b = cur.toBuilder();
            notes.forEach(b::meta);
            return b.build();
        });
    }

    private JobRecord mutate(long jobId, UnaryOperator<JobRecord> change) throws Exception {
        return tx.required(() -> {
            JobRecord cur = jobs.lockById(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            JobRecord next = change.apply(cur);
            if (next != cur) jobs.update(next);
            return next;
        });
    }

    private static void pause(JobRecord.Builder b, PauseReason reason, Instant resumeAt) {
        b.status(JobStatus.PAUSED)
                .pauseReason(reason)
                .resumeAt(resumeAt)
                .meta(JobRecord.META_PAUSE_REASON, reason.code())
                .meta(JobRecord.META_RESUME_AT, resumeAt == null ? null : resumeAt.toString());
    }

    private static Long reviseUpward(Long current, Long reported) {
        if (reported == null || reported <= 0) return current;
        if (current == null || reported > current) return reported;
        return current;
    }

    private static String truncate(String message) {
        if (message == null) return null;
        return message.length() <= MAX_ERROR_LENGTH ? message : message.substring(0, MAX_ERROR_LENGTH);
    }
}
