package net.pagewise.core.error;

import net.pagewise.core.model.JobStatus;

/** 청크가 도는 사이 잡이 리셋되거나 커서가 옮겨져 그 결과를 반영할 수 없음 */
public class StaleChunkException extends IllegalStateException {
    private final long jobId;
    private final JobStatus status;

    public StaleChunkException(long jobId, JobStatus status) {
        super("job " + jobId + " moved while its chunk was in flight");
        this.jobId = jobId;
        this.status = status;
    }

    public long getJobId() {
        return jobId;
    }

    public JobStatus getStatus() {
        return status;
    }
}
