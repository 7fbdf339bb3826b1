package net.pagewise.core.service;

import net.pagewise.core.error.StaleChunkException;
import net.pagewise.core.model.Chunk;
import net.pagewise.core.model.ChunkProgress;
import net.pagewise.core.model.ChunkResult;
import net.pagewise.core.model.ErrorKind;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.spi.DomainStore;
import net.pagewise.core.spi.JobRecordRepository;
import net.pagewise.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 잡 하나에 대해 청크 하나를 처리한다: 리스 → fetch → store → 진행 기록 → 리스 해제.
 * 예외를 던지지 않는다. 모든 결과는 {@link ChunkResult} 로 돌려준다.
 * <p>
 * fetch/store 는 ioExecutor 위에서 Future.get(timeout) 으로 제한한다.
 * 디스패치 스레드 풀과 같은 풀을 쓰면 안 된다(서로 기다리다 멈춘다).
 */
public final class ChunkWorker {
    private static final Logger log = LoggerFactory.getLogger(ChunkWorker.class);

    private final JobRecordRepository jobs;
    private final TxRunner tx;
    private final RateLimitedPager pager;
    private final DomainStore store;
    private final ProgressTracker tracker;
    private final ErrorClassifier classifier;
    private final WorkerSettings settings;
    private final ExecutorService ioExecutor;

    public ChunkWorker(JobRecordRepository jobs,
                       TxRunner tx,
                       RateLimitedPager pager,
                       DomainStore store,
                       ProgressTracker tracker,
                       ErrorClassifier classifier,
                       WorkerSettings settings,
                       ExecutorService ioExecutor) {
        this.jobs = jobs;
        this.tx = tx;
        this.pager = pager;
        this.store = store;
        this.tracker = tracker;
        this.classifier = classifier;
        this.settings = settings;
        this.ioExecutor = ioExecutor;
    }

    public ChunkResult runOnce(long jobId) {
        String owner = settings.ownerPrefix() + "-" + UUID.randomUUID();

        boolean locked;
        try {
            locked = tx.requiresNew(() -> jobs.tryLock(jobId, owner, settings.lockLease()));
        } catch (Exception e) {
            log.warn("lease attempt failed for job {}: {}", jobId, e.toString());
            return ChunkResult.failure(jobId, classifier.classify(e), null, describe(e));
        }
        if (!locked) {
            log.debug("job {} is leased by another worker", jobId);
            return ChunkResult.lockContention(jobId);
        }

        try {
            return process(jobId);
        } finally {
            release(jobId, owner);
        }
    }

    private ChunkResult process(long jobId) {
        JobRecord job;
        try {
            Optional<JobRecord> found = tx.required(() -> jobs.findById(jobId));
            if (found.isEmpty()) return ChunkResult.skipped(jobId, null, "job not found");
            job = found.get();
        } catch (Exception e) {
            log.warn("could not load job {}: {}", jobId, e.toString());
            return ChunkResult.failure(jobId, classifier.classify(e), null, describe(e));
        }

        if (job.status() != JobStatus.QUEUED && job.status() != JobStatus.ACTIVE) {
            return ChunkResult.skipped(jobId, job.status(), "job is " + job.status().code());
        }

        final JobRecord current = job;
        try {
            Chunk chunk = bounded(
                    () -> pager.nextChunk(current.jobType(), current.targetId(), current.cursor(), current.chunkSize()),
                    settings.fetchTimeout());

            if (!chunk.items().isEmpty()) {
                bounded(() -> tx.required(() -> store.upsertItems(current.jobType(), current.targetId(), chunk.items())),
                        settings.storeTimeout());
            }

            // 커서는 도메인 저장이 끝난 뒤에만 전진
            JobRecord after = tracker.recordSuccess(jobId, ChunkProgress.from(chunk, current));
            after = maybeGrow(after);
            return ChunkResult.success(jobId, chunk.items().size(), after.cursor(), after.status(),
                    chunk.suggestedDelay());
        } catch (StaleChunkException e) {
            // 저장된 아이템은 자연키 upsert 라 다음 청크가 다시 써도 무해
            return ChunkResult.skipped(jobId, e.getStatus(), e.getMessage());
        } catch (Exception e) {
            return fail(current, e);
        }
    }

    private ChunkResult fail(JobRecord job, Exception e) {
        if (e instanceof InterruptedException) Thread.currentThread().interrupt();

        ErrorKind kind = classifier.classify(e);
        Instant resetAt = classifier.resetAt(e);
        String message = describe(e);
        log.warn("chunk failed for job {} ({} {}): {} {}", job.id(), job.jobType().code(), job.targetId(), kind,
                message);

        JobStatus status = null;
        try {
            JobRecord after = tracker.recordError(job.id(), kind, message, resetAt);
            status = after.status();
            if (ErrorClassifier.isTimeout(e) && !after.status().isTerminal()) {
                int shrunk = Math.max(1, after.chunkSize() / 2);
                status = tracker.updateChunkSize(job.id(), shrunk).status();
            }
        } catch (Exception re) {
            log.error("could not record {} error for job {}", kind, job.id(), re);
        }
        return ChunkResult.failure(job.id(), kind, status, message);
    }

    private JobRecord maybeGrow(JobRecord after) throws Exception {
        if (after.status() != JobStatus.ACTIVE) return after;
        if (after.cleanChunkStreak() < settings.growAfterCleanChunks()) return after;

        int grown = (int) Math.ceil(after.chunkSize() * settings.growthFactor());
        int clamped = tracker.settings().clampChunkSize(grown);
        if (clamped <= after.chunkSize()) return after;
        return tracker.updateChunkSize(after.id(), clamped);
    }

    private <T> T bounded(Callable<T> call, Duration timeout) throws Exception {
        Future<T> f = ioExecutor.submit(call);
        try {
            return f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new TimeoutException("call did not finish within " + timeout);
        } catch (InterruptedException e) {
            f.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            throw e;
        }
    }

    private void release(long jobId, String owner) {
        try {
            tx.requiresNew(() -> { jobs.unlock(jobId, owner); return null; });
        } catch (Exception e) {
            // 리스는 만료되면 maintenance 가 회수한다
            log.warn("could not release lease on job {}: {}", jobId, e.toString());
        }
    }

    private static String describe(Throwable e) {
        Throwable t = ErrorClassifier.unwrap(e);
        if (t == null) t = e;
        String msg = t.getMessage();
        return msg == null ? t.getClass().getSimpleName() : t.getClass().getSimpleName() + ": " + msg;
    }
}
