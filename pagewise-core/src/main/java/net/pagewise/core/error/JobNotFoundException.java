package net.pagewise.core.error;

public class JobNotFoundException extends RuntimeException {
    private final long jobId;

    public JobNotFoundException(long jobId) {
        super("JobRecord not found: id=" + jobId);
        this.jobId = jobId;
    }

    public long getJobId() {
        return jobId;
    }
}
