package omni.sync.app.controller;

import omni.sync.app.entity.CredentialStatus;
import omni.sync.app.entity.Job;
import omni.sync.app.entity.JobKind;
import omni.sync.app.entity.JobStatus;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.entity.SyncSessionStatus;
import omni.sync.app.service.UserService;
import omni.sync.app.service.job.JobQueueService;
import omni.sync.app.service.sync.StopReason;
import omni.sync.app.service.sync.SyncSessionService;
import omni.sync.app.service.sync.SyncStateService;
import omni.sync.app.service.sync.SyncStatusView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.security.authentication.TestingAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class SyncControllerTest {
    private static final String USER_ID = "user123";

    @Mock
    private JobQueueService jobQueueService;

    @Mock
    private SyncStateService syncStateService;

    @Mock
    private SyncSessionService syncSessionService;

    @Mock
    private UserService userService;

    private MockMvc mockMvc;
    private final Authentication authentication = new TestingAuthenticationToken(USER_ID, null);

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new SyncController(jobQueueService, syncStateService, syncSessionService, userService))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
        when(userService.currentUserId(authentication)).thenReturn(USER_ID);
    }

    @Test
    void triggerSync_ShouldEnqueueSyncJobForProvider() throws Exception {
        // Given
        Job job = new Job();
        job.setId("job-1");
        job.setUserId(USER_ID);
        job.setKind(JobKind.CALENDAR_SYNC);
        job.setStatus(JobStatus.QUEUED);
        when(jobQueueService.enqueue(eq(USER_ID), eq(JobKind.CALENDAR_SYNC), isNull(), isNull())).thenReturn(job);

        // When / Then
        mockMvc.perform(post("/api/sync/calendar").principal(authentication))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.kind").value("calendar_sync"));
    }

    @Test
    void status_ShouldFlagReconnectRequired() throws Exception {
        // Given
        when(syncStateService.statusFor(USER_ID)).thenReturn(List.of(
                new SyncStatusView(Provider.MAIL, true, CredentialStatus.INVALID, null, null, "invalid_grant",
                        SyncSessionStatus.FAILED, true)));

        // When / Then
        mockMvc.perform(get("/api/sync/status").principal(authentication))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].provider").value("mail"))
                .andExpect(jsonPath("$[0].reconnectRequired").value(true));
    }

    private static SyncSession session(String id, SyncSessionStatus status, StopReason stopReason) {
        SyncSession session = new SyncSession();
        session.setId(id);
        session.setUserId(USER_ID);
        session.setProvider(Provider.MAIL);
        session.setJobId("job-1");
        session.setBatchId("batch-1");
        session.setStatus(status);
        session.setPages(3);
        session.setItemsFetched(75);
        session.setItemsWritten(75);
        session.setStopReason(stopReason);
        session.setStartedAt(Instant.parse("2026-01-10T12:00:00Z"));
        return session;
    }

    @Test
    void sessions_WithFilters_ShouldListMatchingRunsForCurrentUser() throws Exception {
        // Given
        when(syncSessionService.list(USER_ID, Provider.MAIL, SyncSessionStatus.PARTIAL, 5))
                .thenReturn(List.of(session("session-1", SyncSessionStatus.PARTIAL, StopReason.ITEM_CAP)));

        // When / Then
        mockMvc.perform(get("/api/sync/sessions")
                        .param("provider", "mail")
                        .param("status", "partial")
                        .param("limit", "5")
                        .principal(authentication))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("session-1"))
                .andExpect(jsonPath("$[0].provider").value("mail"))
                .andExpect(jsonPath("$[0].status").value("PARTIAL"))
                .andExpect(jsonPath("$[0].itemsFetched").value(75));
    }

    @Test
    void sessions_WithoutFilters_ShouldUseDefaultLimit() throws Exception {
        // Given
        when(syncSessionService.list(USER_ID, null, null, 20)).thenReturn(List.of());

        // When / Then
        mockMvc.perform(get("/api/sync/sessions").principal(authentication))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void sessions_WithUnknownStatus_ShouldReturnBadRequest() throws Exception {
        // When / Then
        mockMvc.perform(get("/api/sync/sessions").param("status", "sleeping").principal(authentication))
                .andExpect(status().isBadRequest());
        verifyNoInteractions(syncSessionService);
    }

    @Test
    void session_ShouldReturnRunOfCurrentUser() throws Exception {
        // Given
        when(syncSessionService.findForUser("session-1", USER_ID))
                .thenReturn(Optional.of(session("session-1", SyncSessionStatus.COMPLETED, StopReason.EXHAUSTED)));

        // When / Then
        mockMvc.perform(get("/api/sync/sessions/session-1").principal(authentication))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.pages").value(3));
    }

    @Test
    void session_OwnedByAnotherUser_ShouldReturnNotFound() throws Exception {
        // Given
        when(syncSessionService.findForUser("session-9", USER_ID)).thenReturn(Optional.empty());

        // When / Then
        mockMvc.perform(get("/api/sync/sessions/session-9").principal(authentication))
                .andExpect(status().isNotFound());
    }
}
