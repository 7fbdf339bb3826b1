package net.pagewise.app.api;

import net.pagewise.core.error.JobNotFoundException;
import net.pagewise.core.error.RateLimitExceededException;
import net.pagewise.core.error.RetryableSubmissionException;
import net.pagewise.core.error.SchemaMismatchException;
import net.pagewise.core.error.UpstreamHttpException;
import net.pagewise.core.model.ChunkResult;
import net.pagewise.core.model.JobRecord;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.model.JobType;
import net.pagewise.core.model.Submission;
import net.pagewise.core.model.WorkItem;
import net.pagewise.core.service.InlineSyncHandler;
import net.pagewise.core.service.JobAdminService;
import net.pagewise.core.service.JobRouter;
import net.pagewise.core.spi.Clock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(JobController.class)
class JobControllerTest {

    @Autowired MockMvc mvc;

    @MockBean JobRouter router;
    @MockBean JobAdminService admin;
    @MockBean Clock clock;

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    @BeforeEach
    void fixClock() {
        when(clock.now()).thenReturn(NOW);
    }

    private static JobRecord job(long id, JobStatus status) {
        return JobRecord.ofNew(JobType.PR_SYNC, "octo/demo", 100, 500L).toBuilder()
                .id(id)
                .status(status)
                .processedCount(200)
                .cursor("3")
                .createdAt(Instant.parse("2024-05-01T00:00:00Z"))
                .updatedAt(Instant.parse("2024-05-01T00:00:00Z"))
                .build();
    }

    @Test
    void inline_submission_returns_200_with_result() throws Exception {
        when(router.submit(any(WorkItem.class))).thenReturn(
                Submission.inline(new InlineSyncHandler.Result("pr-sync", "octo/demo", 12, false)));

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"pull_request.edited","jobType":"pr-sync","targetId":"octo/demo","affectedTargetCount":1}
                        """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lane").value("FAST"))
                .andExpect(jsonPath("$.processingMode").value("inline"))
                .andExpect(jsonPath("$.result.itemsStored").value(12))
                .andExpect(jsonPath("$.jobId").doesNotExist());
    }

    @Test
    void queued_submission_returns_202_with_job_id() throws Exception {
        when(router.submit(any(WorkItem.class))).thenReturn(Submission.queued(job(42, JobStatus.QUEUED)));

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"repository.resync","jobType":"pr-sync","targetId":"octo/demo","affectedTargetCount":25}
                        """))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.lane").value("SLOW"))
                .andExpect(jsonPath("$.processingMode").value("queued"))
                .andExpect(jsonPath("$.jobId").value(42))
                .andExpect(jsonPath("$.status").value("queued"));
    }

    @Test
    void missing_target_is_rejected_before_routing() throws Exception {
        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"repository.resync","jobType":"pr-sync"}
                        """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));

        verify(router, never()).submit(any());
    }

    @Test
    void unknown_job_type_is_400() throws Exception {
        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"repository.resync","jobType":"wiki-sync","targetId":"octo/demo"}
                        """))
                .andExpect(status().isBadRequest());
    }

    @Test
    void storage_failure_on_queue_is_503_with_retry_after() throws Exception {
        when(router.submit(any(WorkItem.class)))
                .thenThrow(new RetryableSubmissionException("could not persist job", new RuntimeException("db down")));

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"repository.resync","jobType":"issue-sync","targetId":"octo/demo"}
                        """))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string("Retry-After", "5"));
    }

    @Test
    void exhausted_quota_on_inline_request_is_429() throws Exception {
        when(router.submit(any(WorkItem.class)))
                .thenThrow(new RateLimitExceededException("rate limit exhausted", NOW.plusSeconds(120)));

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"issues.edited","jobType":"issue-sync","targetId":"octo/demo"}
                        """))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "120"));
    }

    @Test
    void upstream_secondary_limit_on_inline_request_counts_down_from_clock() throws Exception {
        when(router.submit(any(WorkItem.class)))
                .thenThrow(new UpstreamHttpException(429, "secondary rate limit", null, NOW.plusSeconds(90)));

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"issues.edited","jobType":"issue-sync","targetId":"octo/demo"}
                        """))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "90"))
                .andExpect(jsonPath("$.error").value("rate_limited"));
    }

    @Test
    void unexpected_upstream_payload_on_inline_request_is_502() throws Exception {
        when(router.submit(any(WorkItem.class)))
                .thenThrow(new SchemaMismatchException("expected a JSON array for issue-sync octo/demo"));

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON).content("""
                        {"sourceEvent":"issues.edited","jobType":"issue-sync","targetId":"octo/demo"}
                        """))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("upstream"));
    }

    @Test
    void get_returns_snapshot_with_progress() throws Exception {
        when(admin.get(7L)).thenReturn(job(7, JobStatus.ACTIVE));

        mvc.perform(get("/api/jobs/7"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.jobType").value("pr-sync"))
                .andExpect(jsonPath("$.status").value("active"))
                .andExpect(jsonPath("$.processedCount").value(200))
                .andExpect(jsonPath("$.progress").value(0.4))
                .andExpect(jsonPath("$.locked").value(false));
    }

    @Test
    void get_missing_job_is_404() throws Exception {
        when(admin.get(99L)).thenThrow(new JobNotFoundException(99L));

        mvc.perform(get("/api/jobs/99"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("not_found"));
    }

    @Test
    void list_with_unknown_status_is_400() throws Exception {
        when(admin.list(eq(JobStatus.UNKNOWN), anyInt())).thenThrow(new IllegalArgumentException("unknown status"));

        mvc.perform(get("/api/jobs").param("status", "sleeping"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void resume_of_running_job_is_409() throws Exception {
        when(admin.resume(7L)).thenThrow(new IllegalStateException("job 7 is not paused"));

        mvc.perform(post("/api/jobs/7/resume"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("conflict"));
    }

    @Test
    void pause_returns_paused_job() throws Exception {
        when(admin.pause(7L)).thenReturn(job(7, JobStatus.PAUSED));

        mvc.perform(post("/api/jobs/7/pause"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("paused"));
    }

    @Test
    void chunk_size_update_is_forwarded() throws Exception {
        when(admin.updateChunkSize(7L, 50)).thenReturn(job(7, JobStatus.ACTIVE).toBuilder().chunkSize(50).build());

        mvc.perform(put("/api/jobs/7/chunk-size").contentType(MediaType.APPLICATION_JSON).content("{\"chunkSize\":50}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.chunkSize").value(50));
    }

    @Test
    void invalid_chunk_size_is_400() throws Exception {
        when(admin.updateChunkSize(7L, 0)).thenThrow(new IllegalArgumentException("chunkSize must be >= 1"));

        mvc.perform(put("/api/jobs/7/chunk-size").contentType(MediaType.APPLICATION_JSON).content("{\"chunkSize\":0}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void run_now_reports_chunk_result() throws Exception {
        when(admin.runNow(7L)).thenReturn(
                ChunkResult.success(7L, 100, "4", JobStatus.ACTIVE, Duration.ofSeconds(2)));

        mvc.perform(post("/api/jobs/7/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.itemsProcessed").value(100))
                .andExpect(jsonPath("$.cursor").value("4"))
                .andExpect(jsonPath("$.suggestedDelayMs").value(2000));
    }
}
