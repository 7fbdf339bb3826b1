package net.pagewise.core.service;

import net.pagewise.core.model.ChunkResult;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.JobRecordRepository;
import net.pagewise.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * 한 번의 틱: 처리 후보 조회 → shouldContinue 로 거르기 → 잡마다 ChunkWorker.runOnce 한 번.
 * 틱 사이에는 아무 상태도 들고 있지 않다. 다음 틱은 DB 에서 다시 읽는다.
 */
public final class SchedulerService {
    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private final JobRecordRepository jobs;
    private final TxRunner tx;
    private final ProgressTracker tracker;
    private final ChunkWorker worker;
    private final Clock clock;
    private final ExecutorService dispatchExecutor;

    public SchedulerService(JobRecordRepository jobs,
                            TxRunner tx,
                            ProgressTracker tracker,
                            ChunkWorker worker,
                            Clock clock,
                            ExecutorService dispatchExecutor) {
        this.jobs = jobs;
        this.tx = tx;
        this.tracker = tracker;
        this.worker = worker;
        this.clock = clock;
        this.dispatchExecutor = dispatchExecutor;
    }

    public TickReport tick(int maxJobs) throws Exception {
        Instant now = clock.now();
        TickReport r = new TickReport();
        r.timestamp = now;

        List<JobRecord> candidates = tx.required(() -> jobs.findSchedulable(now, maxJobs));
        r.considered = candidates.size();

        List<Future<ChunkResult>> running = new ArrayList<>();
        for (JobRecord job : candidates) {
            boolean go;
            try {
                go = tracker.shouldContinue(job.id());
            } catch (Exception e) {
                log.warn("shouldContinue failed for job {}: {}", job.id(), e.toString());
                go = false;
            }
            if (!go) {
                r.skipped++;
                continue;
            }
            running.add(dispatchExecutor.submit(() -> worker.runOnce(job.id())));
            r.dispatched++;
        }

        for (Future<ChunkResult> f : running) {
            ChunkResult result;
            try {
                result = f.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("tick interrupted while waiting for workers");
                break;
            } catch (ExecutionException e) {
                log.error("worker crashed", e.getCause());
                r.failed++;
                continue;
            }
            count(r, result);
        }

        if (r.dispatched > 0) log.debug("{}", r);
        return r;
    }

    private static void count(TickReport r, ChunkResult result) {
        if (result.success()) {
            r.succeeded++;
            r.itemsProcessed += result.itemsProcessed();
        } else if (result.contended()) {
            r.contended++;
        } else if (result.skipped()) {
            r.skipped++;
        } else {
            r.failed++;
        }
    }

    /** 틱 결과 요약 */
    public static final class TickReport {
        public Instant timestamp;
        public int considered;
        public int dispatched;
        public int succeeded;
        public int failed;
        public int contended;
        public int skipped;
        public long itemsProcessed;

        @Override public String toString() {
            return "TickReport{" +
                    "timestamp=" + timestamp +
                    ", considered=" + considered +
                    ", dispatched=" + dispatched +
                    ", succeeded=" + succeeded +
                    ", failed=" + failed +
                    ", contended=" + contended +
                    ", skipped=" + skipped +
                    ", itemsProcessed=" + itemsProcessed +
                    '}';
        }
    }
}
