package omni.sync.app.controller;

import omni.sync.app.entity.Job;
import omni.sync.app.entity.JobKind;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSessionStatus;
import omni.sync.app.service.UserService;
import omni.sync.app.service.job.JobQueueService;
import omni.sync.app.service.sync.SyncSessionService;
import omni.sync.app.service.sync.SyncStateService;
import omni.sync.app.service.sync.SyncStatusView;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

/**
 * Manual sync trigger, per-provider status and sync run history.
 */
@RestController
@RequestMapping("/api/sync")
public class SyncController {
    private final JobQueueService jobQueueService;
    private final SyncStateService syncStateService;
    private final SyncSessionService syncSessionService;
    private final UserService userService;

    public SyncController(JobQueueService jobQueueService,
                          SyncStateService syncStateService,
                          SyncSessionService syncSessionService,
                          UserService userService) {
        this.jobQueueService = jobQueueService;
        this.syncStateService = syncStateService;
        this.syncSessionService = syncSessionService;
        this.userService = userService;
    }

    @PostMapping("/{provider}")
    public ResponseEntity<JobView> triggerSync(@PathVariable("provider") String provider, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        Job job = jobQueueService.enqueue(userId, JobKind.syncFor(Provider.fromWireName(provider)), null, null);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(JobView.from(job));
    }

    @GetMapping("/status")
    public List<SyncStatusView> status(Authentication authentication) {
        return syncStateService.statusFor(userService.currentUserId(authentication));
    }

    @GetMapping("/sessions")
    public List<SyncSessionView> sessions(@RequestParam(value = "provider", required = false) String provider,
                                          @RequestParam(value = "status", required = false) String status,
                                          @RequestParam(value = "limit", defaultValue = "20") int limit,
                                          Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        Provider providerFilter = provider != null ? Provider.fromWireName(provider) : null;
        SyncSessionStatus statusFilter = status != null ? SyncSessionStatus.valueOf(status.trim().toUpperCase(Locale.ROOT)) : null;
        return syncSessionService.list(userId, providerFilter, statusFilter, limit).stream()
                .map(SyncSessionView::from)
                .toList();
    }

    @GetMapping("/sessions/{id}")
    public ResponseEntity<SyncSessionView> session(@PathVariable("id") String id, Authentication authentication) {
        String userId = userService.currentUserId(authentication);
        return syncSessionService.findForUser(id, userId)
                .map(SyncSessionView::from)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
