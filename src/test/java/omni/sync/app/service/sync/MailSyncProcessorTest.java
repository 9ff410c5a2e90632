package omni.sync.app.service.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import omni.sync.app.config.SyncProperties;
import omni.sync.app.entity.ErrorStage;
import omni.sync.app.entity.Job;
import omni.sync.app.entity.JobKind;
import omni.sync.app.entity.JobStatus;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;
import omni.sync.app.entity.RawEventError;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.entity.SyncState;
import omni.sync.app.exception.AuthException;
import omni.sync.app.exception.JobPayloadException;
import omni.sync.app.exception.ProviderException;
import omni.sync.app.repository.RawEventErrorRepository;
import omni.sync.app.repository.RawEventRepository;
import omni.sync.app.service.job.JobQueueService;
import omni.sync.app.service.provider.GmailProviderClient;
import omni.sync.app.service.provider.ListRequest;
import omni.sync.app.service.provider.ProviderItem;
import omni.sync.app.service.provider.ProviderPage;
import omni.sync.app.service.vault.TokenVault;
import omni.sync.app.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MailSyncProcessorTest {
    private static final String USER_ID = "user123";
    private static final Instant NOW = Instant.parse("2026-01-20T10:00:00Z");

    @Mock
    private GmailProviderClient client;

    @Mock
    private TokenVault tokenVault;

    @Mock
    private RawEventRepository rawEventRepository;

    @Mock
    private RawEventErrorRepository rawEventErrorRepository;

    @Mock
    private JobQueueService jobQueueService;

    @Mock
    private SyncStateService syncStateService;

    @Mock
    private SyncSessionService sessionService;

    private SyncProperties properties;
    private MutableClock clock;
    private MailSyncProcessor processor;
    private final List<RawEvent> written = new ArrayList<>();

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.setPageSize(25);
        properties.setFetchBatchSize(20);
        properties.setInterBatchDelay(Duration.ZERO);
        clock = new MutableClock(NOW);
        processor = new MailSyncProcessor(client, tokenVault, rawEventRepository, rawEventErrorRepository,
                jobQueueService, syncStateService, sessionService, properties, new ObjectMapper(), clock);

        when(client.provider()).thenReturn(Provider.MAIL);
    }

    private void tokenIs(String token) {
        when(tokenVault.getValidToken(USER_ID, Provider.MAIL)).thenReturn(token);
    }

    private void rawEventsAreStored() {
        when(rawEventRepository.insertAll(anyList())).thenAnswer(invocation -> {
            List<RawEvent> events = invocation.getArgument(0);
            written.addAll(events);
            return events.size();
        });
    }

    private void getBatchHydratesEverything() {
        when(client.getBatch(anyString(), anyString(), anyList())).thenAnswer(invocation -> {
            List<String> ids = invocation.getArgument(2);
            return ids.stream().map(MailSyncProcessorTest::hydrated).toList();
        });
    }

    private static ProviderItem hydrated(String id) {
        return new ProviderItem(id, "{\"id\":\"" + id + "\"}", Instant.parse("2026-01-01T00:00:00Z"));
    }

    private static ProviderPage stubPage(int from, int count, String nextPageToken) {
        List<ProviderItem> items = new ArrayList<>();
        for (int i = from; i < from + count; i++) {
            items.add(ProviderItem.stub("msg-" + i));
        }
        return new ProviderPage(items, nextPageToken);
    }

    private static Job syncJob(String payload) {
        Job job = new Job();
        job.setId(UUID.randomUUID().toString());
        job.setUserId(USER_ID);
        job.setKind(JobKind.MAIL_SYNC);
        job.setStatus(JobStatus.PROCESSING);
        job.setBatchId(UUID.randomUUID().toString());
        job.setPayload(payload);
        return job;
    }

    private ListRequest capturedRequest() {
        ArgumentCaptor<ListRequest> captor = ArgumentCaptor.forClass(ListRequest.class);
        verify(client, atLeastOnce()).list(anyString(), anyString(), captor.capture(), any());
        return captor.getValue();
    }

    @Test
    void handle_WithThreePages_ShouldWriteEverythingAndEnqueueOneNormalization() {
        // Given
        tokenIs("token-1");
        rawEventsAreStored();
        getBatchHydratesEverything();
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(stubPage(0, 25, "p2"));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), eq("p2"))).thenReturn(stubPage(25, 25, "p3"));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), eq("p3"))).thenReturn(stubPage(50, 25, null));
        Job job = syncJob("{}");

        // When
        SyncRunResult result = processor.handle(job);

        // Then
        assertEquals(3, result.pages());
        assertEquals(75, result.fetched());
        assertEquals(75, result.written());
        assertEquals(StopReason.EXHAUSTED, result.stopReason());
        assertEquals(75, written.stream().map(RawEvent::getSourceId).distinct().count());
        assertTrue(written.stream().allMatch(e -> job.getBatchId().equals(e.getBatchId())));
        verify(rawEventRepository, times(6)).insertAll(anyList());
        verify(jobQueueService, times(1)).enqueue(USER_ID, JobKind.NORMALIZE_MAIL, null, job.getBatchId());
        verify(syncStateService).recordRun(USER_ID, Provider.MAIL, NOW, true, null);
    }

    @Test
    void handle_WithEndlessPages_ShouldStopAtItemCapAndStillEnqueueNormalization() {
        // Given
        properties.setMaxItemsPerRun(60);
        tokenIs("token-1");
        rawEventsAreStored();
        getBatchHydratesEverything();
        AtomicInteger listCalls = new AtomicInteger();
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), any())).thenAnswer(invocation -> {
            int call = listCalls.incrementAndGet();
            ListRequest request = invocation.getArgument(2);
            return stubPage((call - 1) * 25, request.pageSize(), "page-" + call);
        });
        Job job = syncJob("{}");

        // When
        SyncRunResult result = processor.handle(job);

        // Then
        assertEquals(60, result.fetched());
        assertEquals(60, result.written());
        assertEquals(StopReason.ITEM_CAP, result.stopReason());
        assertEquals(3, listCalls.get());
        assertEquals(10, capturedRequest().pageSize());
        verify(jobQueueService, times(1)).enqueue(USER_ID, JobKind.NORMALIZE_MAIL, null, job.getBatchId());
        verify(syncStateService).recordRun(USER_ID, Provider.MAIL, NOW, false, "page-3");
    }

    @Test
    void handle_WithCapSmallerThanPageSize_ShouldAskForCapAndSaveNextPageToken() {
        // Given
        properties.setMaxItemsPerRun(10);
        tokenIs("token-1");
        rawEventsAreStored();
        getBatchHydratesEverything();
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenAnswer(invocation -> {
            ListRequest request = invocation.getArgument(2);
            return stubPage(0, request.pageSize(), "page-1");
        });

        // When
        SyncRunResult result = processor.handle(syncJob("{}"));

        // Then
        assertEquals(10, result.written());
        assertEquals(StopReason.ITEM_CAP, result.stopReason());
        assertEquals(10, capturedRequest().pageSize());
        verify(syncStateService).recordRun(USER_ID, Provider.MAIL, NOW, false, "page-1");
    }

    @Test
    void handle_WhenProviderIgnoresPageSize_ShouldStillMovePastTheCappedPage() {
        // Given
        properties.setMaxItemsPerRun(10);
        tokenIs("token-1");
        rawEventsAreStored();
        getBatchHydratesEverything();
        SyncState state = new SyncState();
        state.setResumePageToken("page-4");
        when(syncStateService.find(USER_ID, Provider.MAIL)).thenReturn(Optional.of(state));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), eq("page-4"))).thenReturn(stubPage(100, 25, "page-5"));

        // When
        SyncRunResult result = processor.handle(syncJob("{}"));

        // Then
        assertEquals(10, result.fetched());
        assertEquals(10, written.size());
        verify(syncStateService).recordRun(USER_ID, Provider.MAIL, NOW, false, "page-5");
    }

    @Test
    void handle_WhenDeadlinePassesMidPage_ShouldStopAndKeepPageForNextRun() {
        // Given
        tokenIs("token-1");
        rawEventsAreStored();
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(stubPage(0, 25, "p2"));
        when(client.getBatch(anyString(), anyString(), anyList())).thenAnswer(invocation -> {
            clock.advance(Duration.ofMinutes(5));
            List<String> ids = invocation.getArgument(2);
            return ids.stream().map(MailSyncProcessorTest::hydrated).toList();
        });
        Job job = syncJob("{}");

        // When
        SyncRunResult result = processor.handle(job);

        // Then
        assertEquals(StopReason.DEADLINE, result.stopReason());
        assertEquals(20, result.written());
        verify(client, times(1)).getBatch(anyString(), anyString(), anyList());
        verify(jobQueueService, times(1)).enqueue(USER_ID, JobKind.NORMALIZE_MAIL, null, job.getBatchId());
        verify(syncStateService).recordRun(USER_ID, Provider.MAIL, NOW, false, null);
    }

    @Test
    void handle_WithUnauthorized_ShouldRefreshOnceAndContinue() {
        // Given
        tokenIs("token-1");
        rawEventsAreStored();
        getBatchHydratesEverything();
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull()))
                .thenThrow(ProviderException.forStatus(401, "Invalid Credentials", null));
        when(tokenVault.refreshAfterUnauthorized(USER_ID, Provider.MAIL, "token-1")).thenReturn("token-2");
        when(client.list(eq(USER_ID), eq("token-2"), any(ListRequest.class), isNull())).thenReturn(stubPage(0, 2, null));

        // When
        SyncRunResult result = processor.handle(syncJob("{}"));

        // Then
        assertEquals(2, result.written());
        verify(client).getBatch(eq(USER_ID), eq("token-2"), anyList());
        verify(tokenVault, times(1)).refreshAfterUnauthorized(anyString(), any(), anyString());
        verify(tokenVault, never()).invalidate(anyString(), any(), anyString());
    }

    @Test
    void handle_WithUnauthorizedAfterRefresh_ShouldInvalidateAndFailWithAuthException() {
        // Given
        tokenIs("token-1");
        when(client.list(eq(USER_ID), anyString(), any(ListRequest.class), isNull()))
                .thenThrow(ProviderException.forStatus(401, "Invalid Credentials", null));
        when(tokenVault.refreshAfterUnauthorized(USER_ID, Provider.MAIL, "token-1")).thenReturn("token-2");

        // When & Then
        assertThrows(AuthException.class, () -> processor.handle(syncJob("{}")));
        verify(tokenVault).invalidate(eq(USER_ID), eq(Provider.MAIL), anyString());
        verify(syncStateService).recordError(eq(USER_ID), eq(Provider.MAIL), anyString());
        verify(jobQueueService, never()).enqueue(anyString(), any(JobKind.class), any(), anyString());
    }

    @Test
    void handle_WhenFailingAfterWrites_ShouldStillEnqueueNormalizationAndRethrow() {
        // Given
        tokenIs("token-1");
        rawEventsAreStored();
        getBatchHydratesEverything();
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(stubPage(0, 10, "p2"));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), eq("p2")))
                .thenThrow(ProviderException.forStatus(503, "Backend Error", null));
        Job job = syncJob("{}");

        // When & Then
        ProviderException exception = assertThrows(ProviderException.class, () -> processor.handle(job));
        assertTrue(exception.isRetryable());
        verify(jobQueueService, times(1)).enqueue(USER_ID, JobKind.NORMALIZE_MAIL, null, job.getBatchId());
        verify(syncStateService).recordError(eq(USER_ID), eq(Provider.MAIL), contains("Backend Error"));
        verify(syncStateService, never()).recordRun(anyString(), any(), any(), anyBoolean(), any());
    }

    @Test
    void handle_WithMessagesGoneBeforeHydration_ShouldRecordThemAsMalformed() {
        // Given
        tokenIs("token-1");
        rawEventsAreStored();
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(stubPage(0, 3, null));
        when(client.getBatch(eq(USER_ID), eq("token-1"), anyList())).thenReturn(List.of(hydrated("msg-0"), hydrated("msg-2")));

        // When
        SyncRunResult result = processor.handle(syncJob("{}"));

        // Then
        assertEquals(2, result.written());
        assertEquals(1, result.malformed());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RawEventError>> errors = ArgumentCaptor.forClass(List.class);
        verify(rawEventErrorRepository).saveAll(errors.capture());
        assertEquals(1, errors.getValue().size());
        assertEquals("msg-1", errors.getValue().get(0).getSourceId());
        assertEquals(ErrorStage.INGESTION, errors.getValue().get(0).getStage());
    }

    @Test
    void handle_OnFirstSync_ShouldQueryConfiguredWindow() {
        // Given
        tokenIs("token-1");
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(new ProviderPage(List.of(), null));

        // When
        SyncRunResult result = processor.handle(syncJob("{}"));

        // Then
        assertEquals(StopReason.EXHAUSTED, result.stopReason());
        assertEquals("newer_than:365d -in:chats -in:drafts", capturedRequest().query());
        assertEquals(25, capturedRequest().pageSize());
        verify(jobQueueService, times(1)).enqueue(eq(USER_ID), eq(JobKind.NORMALIZE_MAIL), isNull(), anyString());
    }

    @Test
    void handle_AfterSuccessfulSync_ShouldQueryIncrementallyWithOverlap() {
        // Given
        tokenIs("token-1");
        SyncState state = new SyncState();
        state.setLastSuccessfulSyncAt(Instant.parse("2026-01-10T05:00:00Z"));
        when(syncStateService.find(USER_ID, Provider.MAIL)).thenReturn(Optional.of(state));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(new ProviderPage(List.of(), null));

        // When
        processor.handle(syncJob("{}"));

        // Then
        assertEquals("after:2026/01/09 -in:chats -in:drafts", capturedRequest().query());
    }

    @Test
    void handle_WithExplicitQuery_ShouldUseItAsIs() {
        // Given
        tokenIs("token-1");
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(new ProviderPage(List.of(), null));

        // When
        processor.handle(syncJob("{\"query\":\"from:boss@example.com\"}"));

        // Then
        assertEquals("from:boss@example.com", capturedRequest().query());
    }

    @Test
    void handle_WithSavedPageToken_ShouldResumeFromIt() {
        // Given
        tokenIs("token-1");
        SyncState state = new SyncState();
        state.setResumePageToken("page-9");
        when(syncStateService.find(USER_ID, Provider.MAIL)).thenReturn(Optional.of(state));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), eq("page-9"))).thenReturn(new ProviderPage(List.of(), null));

        // When
        SyncRunResult result = processor.handle(syncJob("{}"));

        // Then
        assertEquals(StopReason.EXHAUSTED, result.stopReason());
        verify(syncStateService).recordRun(USER_ID, Provider.MAIL, NOW, true, null);
    }

    @Test
    void handle_WithRejectedSavedPageToken_ShouldRestartFromFirstPage() {
        // Given
        tokenIs("token-1");
        SyncState state = new SyncState();
        state.setResumePageToken("stale");
        when(syncStateService.find(USER_ID, Provider.MAIL)).thenReturn(Optional.of(state));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), eq("stale")))
                .thenThrow(ProviderException.forStatus(400, "Invalid pageToken", null));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(new ProviderPage(List.of(), null));

        // When
        SyncRunResult result = processor.handle(syncJob("{}"));

        // Then
        assertEquals(StopReason.EXHAUSTED, result.stopReason());
        assertEquals(1, result.pages());
    }

    @Test
    void handle_ShouldTrackTheRunAsASyncSession() {
        // Given
        tokenIs("token-1");
        rawEventsAreStored();
        getBatchHydratesEverything();
        SyncSession session = new SyncSession();
        Job job = syncJob("{}");
        when(sessionService.start(USER_ID, Provider.MAIL, job.getId(), job.getBatchId())).thenReturn(session);
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull())).thenReturn(stubPage(0, 25, "p2"));
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), eq("p2"))).thenReturn(stubPage(25, 5, null));

        // When
        processor.handle(job);

        // Then
        ArgumentCaptor<SyncRunResult> progress = ArgumentCaptor.forClass(SyncRunResult.class);
        verify(sessionService, times(2)).recordProgress(eq(session), progress.capture());
        assertEquals(25, progress.getAllValues().get(0).written());
        assertEquals(30, progress.getAllValues().get(1).written());
        ArgumentCaptor<SyncRunResult> outcome = ArgumentCaptor.forClass(SyncRunResult.class);
        verify(sessionService).complete(eq(session), outcome.capture());
        assertEquals(StopReason.EXHAUSTED, outcome.getValue().stopReason());
        assertEquals(2, outcome.getValue().pages());
        verify(sessionService, never()).fail(any(), any(), anyString());
    }

    @Test
    void handle_WhenProviderFails_ShouldFailTheSyncSession() {
        // Given
        tokenIs("token-1");
        SyncSession session = new SyncSession();
        Job job = syncJob("{}");
        when(sessionService.start(USER_ID, Provider.MAIL, job.getId(), job.getBatchId())).thenReturn(session);
        when(client.list(eq(USER_ID), eq("token-1"), any(ListRequest.class), isNull()))
                .thenThrow(ProviderException.forStatus(503, "Backend Error", null));

        // When & Then
        assertThrows(ProviderException.class, () -> processor.handle(job));
        verify(sessionService).fail(eq(session), any(SyncRunResult.class), contains("Backend Error"));
        verify(sessionService, never()).complete(any(), any());
    }

    @Test
    void handle_WithoutBatchId_ShouldRejectPayload() {
        // Given
        Job job = syncJob("{}");
        job.setBatchId(null);

        // When & Then
        assertThrows(JobPayloadException.class, () -> processor.handle(job));
        verifyNoInteractions(tokenVault);
    }
}
