package net.pagewise.core.model;

/** 라우터 결과: FAST 면 inlineResult, SLOW 면 jobId */
public record Submission(
        Lane lane,
        Long jobId,
        JobStatus jobStatus,
        Object inlineResult
) {
    public static Submission inline(Object result) {
        return new Submission(Lane.FAST, null, null, result);
    }

    public static Submission queued(JobRecord job) {
        return new Submission(Lane.SLOW, job.id(), job.status(), null);
    }

    public String processingMode() {
        return lane.processingMode();
    }
}
