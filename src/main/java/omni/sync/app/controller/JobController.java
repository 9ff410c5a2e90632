package omni.sync.app.controller;

import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.JobProperties;
import omni.sync.app.entity.Job;
import omni.sync.app.service.UserService;
import omni.sync.app.service.job.JobQueueService;
import omni.sync.app.service.job.JobRunSummary;
import omni.sync.app.service.job.JobRunner;
import omni.sync.app.service.job.JobStats;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@Slf4j
@RestController
@RequestMapping("/api/jobs")
public class JobController {
    static final String CRON_SECRET_HEADER = "X-Cron-Secret";

    private final JobQueueService jobQueueService;
    private final JobRunner jobRunner;
    private final UserService userService;
    private final JobProperties jobProperties;

    public JobController(JobQueueService jobQueueService,
                         JobRunner jobRunner,
                         UserService userService,
                         JobProperties jobProperties) {
        this.jobQueueService = jobQueueService;
        this.jobRunner = jobRunner;
        this.userService = userService;
        this.jobProperties = jobProperties;
    }

    @PostMapping
    public ResponseEntity<JobView> enqueue(@Valid @RequestBody EnqueueJobRequest request, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        Job job = jobQueueService.enqueue(userId, request.kind(), request.payload(), request.batchId());
        return ResponseEntity.status(HttpStatus.CREATED).body(JobView.from(job));
    }

    @GetMapping("/{id}")
    public ResponseEntity<JobView> get(@PathVariable("id") String id, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        return jobQueueService.findForUser(id, userId)
                .map(job -> ResponseEntity.ok(JobView.from(job)))
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/stats")
    public JobStats stats(Authentication authentication) {
        return jobQueueService.stats(userService.currentUserId(authentication));
    }

    /**
     * One poll cycle for an external scheduler. Safe to call concurrently.
     */
    @PostMapping("/run")
    public ResponseEntity<JobRunSummary> run(@RequestHeader(value = CRON_SECRET_HEADER, required = false) String secret) {
        if (!secretMatches(secret)) {
            log.warn("Rejected job run trigger with missing or wrong secret");
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        return ResponseEntity.ok(jobRunner.runOnce());
    }

    private boolean secretMatches(String provided) {
        String expected = jobProperties.getCronSecret();
        if (expected == null || expected.isBlank() || provided == null) {
            return false;
        }
        return MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), provided.getBytes(StandardCharsets.UTF_8));
    }
}
