package net.pagewise.core.service;

import net.pagewise.core.error.RetryableSubmissionException;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.Lane;
import net.pagewise.core.model.Submission;
import net.pagewise.core.model.WorkItem;
import net.pagewise.core.spi.JobRecordRepository;
import net.pagewise.core.spi.LaneExecutor;
import net.pagewise.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SLOW 레인: (jobType, targetId) 당 JobRecord 하나를 멱등 생성한다.
 * 저장 실패는 {@link RetryableSubmissionException} 으로 알린다. 조용히 버리지 않는다.
 */
public final class QueueLaneExecutor implements LaneExecutor {
    private static final Logger log = LoggerFactory.getLogger(QueueLaneExecutor.class);

    private final JobRecordRepository jobs;
    private final TxRunner tx;
    private final ProgressTracker tracker;
    private final int defaultChunkSize;

    public QueueLaneExecutor(JobRecordRepository jobs, TxRunner tx, ProgressTracker tracker, int defaultChunkSize) {
        this.jobs = jobs;
        this.tx = tx;
        this.tracker = tracker;
        this.defaultChunkSize = defaultChunkSize;
    }

    @Override
    public Lane lane() {
        return Lane.SLOW;
    }

    @Override
    public Submission execute(WorkItem item) throws Exception {
        JobRecord job;
        try {
            job = tx.required(() -> enqueue(item));
        } catch (Exception e) {
            log.warn("could not queue {} {}: {}", item.jobType().code(), item.targetId(), e.toString());
            throw new RetryableSubmissionException(
                    "could not persist job " + item.jobType().code() + " " + item.targetId(), e);
        }
        return Submission.queued(job);
    }

    private JobRecord enqueue(WorkItem item) throws Exception {
        int chunkSize = tracker.settings().clampChunkSize(defaultChunkSize);
        Map<String, String> meta = new LinkedHashMap<>();
        if (item.sourceEvent() != null) meta.put("sourceEvent", item.sourceEvent());
        meta.put("affectedTargetCount", String.valueOf(item.affectedTargetCount()));

        JobRecord job = jobs.upsertQueued(item.jobType(), item.targetId(), chunkSize, item.totalEstimate(), meta);

        Long total = item.totalEstimate();
        if (total != null && total > 0 && !job.status().isTerminal()
                && (job.totalEstimate() == null || total > job.totalEstimate())) {
            job = tracker.reviseTotalEstimate(job.id(), total);
        }
        log.info("job {} queued: {} {} (status={})", job.id(), job.jobType().code(), job.targetId(),
                job.status().code());
        return job;
    }
}
