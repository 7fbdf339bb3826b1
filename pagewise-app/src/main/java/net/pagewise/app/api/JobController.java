package net.pagewise.app.api;

import jakarta.validation.Valid;
import net.pagewise.core.model.JobStatus;
import net.pagewise.core.model.Lane;
import net.pagewise.core.model.Submission;
import net.pagewise.core.service.JobAdminService;
import net.pagewise.core.service.JobRouter;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final JobRouter router;
    private final JobAdminService admin;

    public JobController(JobRouter router, JobAdminService admin) {
        this.router = router;
        this.admin = admin;
    }

    /** FAST 는 200 + 결과, SLOW 는 202 + jobId */
    @PostMapping
    public ResponseEntity<SubmitResponse> submit(@Valid @RequestBody SubmitRequest req) throws Exception {
        Submission s = router.submit(req.toWorkItem());
        HttpStatus status = s.lane() == Lane.FAST ? HttpStatus.OK : HttpStatus.ACCEPTED;
        return ResponseEntity.status(status).body(SubmitResponse.from(s));
    }

    @GetMapping("/{id}")
    public JobView get(@PathVariable long id) throws Exception {
        return JobView.from(admin.get(id));
    }

    @GetMapping
    public List<JobView> list(@RequestParam(required = false) String status,
                              @RequestParam(defaultValue = "50") int limit) throws Exception {
        JobStatus st = status == null || status.isBlank() ? null : JobStatus.from(status);
        return admin.list(st, limit).stream().map(JobView::from).toList();
    }

    @PostMapping("/{id}/pause")
    public JobView pause(@PathVariable long id) throws Exception {
        return JobView.from(admin.pause(id));
    }

    @PostMapping("/{id}/resume")
    public JobView resume(@PathVariable long id) throws Exception {
        return JobView.from(admin.resume(id));
    }

    @PostMapping("/{id}/reset")
    public JobView reset(@PathVariable long id) throws Exception {
        return JobView.from(admin.reset(id));
    }

    @PutMapping("/{id}/chunk-size")
    public JobView chunkSize(@PathVariable long id, @Valid @RequestBody ChunkSizeRequest req) throws Exception {
        return JobView.from(admin.updateChunkSize(id, req.chunkSize()));
    }

    @PostMapping("/{id}/run")
    public RunResponse run(@PathVariable long id) throws Exception {
        return RunResponse.from(admin.runNow(id));
    }
}
