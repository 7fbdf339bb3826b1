package net.pagewise.core.service;

import net.pagewise.core.error.JobNotFoundException;
import net.pagewise.core.model.ChunkResult;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.JobRecordRepository;
import net.pagewise.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/** 운영자용 조회/조작. 변경은 전부 ProgressTracker 를 거친다 */
public final class JobAdminService {
    private static final Logger log = LoggerFactory.getLogger(JobAdminService.class);

    public static final int MAX_LIST_LIMIT = 500;

    private final JobRecordRepository jobs;
    private final TxRunner tx;
    private final ProgressTracker tracker;
    private final ChunkWorker worker;
    private final Clock clock;

    public JobAdminService(JobRecordRepository jobs, TxRunner tx, ProgressTracker tracker, ChunkWorker worker,
                           Clock clock) {
        this.jobs = jobs;
        this.tx = tx;
        this.tracker = tracker;
        this.worker = worker;
        this.clock = clock;
    }

    public JobRecord get(long jobId) throws Exception {
        return tx.required(() -> jobs.findById(jobId)).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<JobRecord> list(JobStatus status, int limit) throws Exception {
        if (status == JobStatus.UNKNOWN) throw new IllegalArgumentException("unknown status");
        int n = Math.max(1, Math.min(limit, MAX_LIST_LIMIT));
        return tx.required(() -> jobs.findByStatus(status, n));
    }

    public JobRecord pause(long jobId) throws Exception {
        return audited(jobId, "pause", () -> tracker.pause(jobId));
    }

    public JobRecord resume(long jobId) throws Exception {
        return audited(jobId, "resume", () -> tracker.resume(jobId));
    }

    public JobRecord reset(long jobId) throws Exception {
        return audited(jobId, "reset", () -> tracker.reset(jobId));
    }

    public JobRecord updateChunkSize(long jobId, int chunkSize) throws Exception {
        return audited(jobId, "chunk-size:" + chunkSize, () -> tracker.updateChunkSize(jobId, chunkSize));
    }

    /** 스케줄러를 기다리지 않고 청크 하나를 바로 처리 */
    public ChunkResult runNow(long jobId) throws Exception {
        get(jobId);
        ChunkResult result = worker.runOnce(jobId);
        if (result.contended()) log.warn("run-now on job {} skipped: lease held by another worker", jobId);
        return result;
    }

    private JobRecord audited(long jobId, String action, Callable<JobRecord> change) throws Exception {
        return tx.required(() -> {
            JobRecord changed = change.call();
            Map<String, String> notes = new LinkedHashMap<>();
            notes.put("lastAdminAction", action);
            notes.put("lastAdminActionAt", clock.now().toString());
            JobRecord audited = tracker.annotate(jobId, notes);
            log.info("admin {} on job {} → {}", action, jobId, changed.status().code());
            return audited;
        });
    }
}
