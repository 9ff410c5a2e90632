package omni.sync.app.service.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.SyncProperties;
import omni.sync.app.entity.ErrorStage;
import omni.sync.app.entity.Job;
import omni.sync.app.entity.JobKind;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;
import omni.sync.app.entity.RawEventError;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.exception.AuthException;
import omni.sync.app.exception.JobPayloadException;
import omni.sync.app.exception.ProviderException;
import omni.sync.app.repository.RawEventErrorRepository;
import omni.sync.app.repository.RawEventRepository;
import omni.sync.app.service.job.JobHandler;
import omni.sync.app.service.job.JobQueueService;
import omni.sync.app.service.provider.ListRequest;
import omni.sync.app.service.provider.ProviderClient;
import omni.sync.app.service.provider.ProviderItem;
import omni.sync.app.service.provider.ProviderPage;
import omni.sync.app.service.vault.TokenVault;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Pages through a provider into the raw event log, bounded by an item cap and a deadline.
 * Every run that ends, partial or not, enqueues exactly one normalization job for its batch.
 * Each run is tracked as a sync session with its progress counters.
 */
@Slf4j
public abstract class AbstractSyncProcessor implements JobHandler {
    protected final ProviderClient client;
    protected final TokenVault tokenVault;
    protected final RawEventRepository rawEventRepository;
    protected final RawEventErrorRepository rawEventErrorRepository;
    protected final JobQueueService jobQueueService;
    protected final SyncStateService syncStateService;
    protected final SyncSessionService sessionService;
    protected final SyncProperties properties;
    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AbstractSyncProcessor(ProviderClient client,
                                    TokenVault tokenVault,
                                    RawEventRepository rawEventRepository,
                                    RawEventErrorRepository rawEventErrorRepository,
                                    JobQueueService jobQueueService,
                                    SyncStateService syncStateService,
                                    SyncSessionService sessionService,
                                    SyncProperties properties,
                                    ObjectMapper objectMapper,
                                    Clock clock) {
        this.client = client;
        this.tokenVault = tokenVault;
        this.rawEventRepository = rawEventRepository;
        this.rawEventErrorRepository = rawEventErrorRepository;
        this.jobQueueService = jobQueueService;
        this.syncStateService = syncStateService;
        this.sessionService = sessionService;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Builds the provider query for this run from the job payload and the sync state.
     */
    protected abstract ListRequest buildListRequest(String userId, JsonNode payload, Instant startedAt);

    @Override
    public SyncRunResult handle(Job job) {
        Provider provider = client.provider();
        String userId = job.getUserId();
        String batchId = job.getBatchId();
        if (batchId == null || batchId.isBlank()) {
            throw new JobPayloadException("Sync job " + job.getId() + " has no batchId");
        }
        JsonNode payload = readPayload(job);
        Instant startedAt = clock.instant();
        Run run = new Run(userId, batchId, startedAt.plus(properties.getRunDeadline()));
        run.session = sessionService.start(userId, provider, job.getId(), batchId);

        try {
            run.token = tokenVault.getValidToken(userId, provider);
            ListRequest request = buildListRequest(userId, payload, startedAt);
            String resumeToken = properties.isResumeEnabled()
                    ? syncStateService.find(userId, provider).map(s -> s.getResumePageToken()).orElse(null)
                    : null;
            if (resumeToken != null) {
                log.info("Resuming {} sync for user {} from saved page token", provider, userId);
            }
            paginate(run, request, resumeToken);
        } catch (RuntimeException e) {
            log.error("{} sync failed for user {} batch {} after {} written: {}",
                    provider, userId, batchId, run.written, e.getMessage());
            syncStateService.recordError(userId, provider, e.getMessage());
            sessionService.fail(run.session, run.snapshot(), e.getMessage());
            if (run.written > 0) {
                // Keep what was already ingested reachable
                enqueueNormalization(userId, batchId);
            }
            throw e;
        }

        syncStateService.recordRun(userId, provider, startedAt, run.stopReason == StopReason.EXHAUSTED, run.resumeToken);
        enqueueNormalization(userId, batchId);

        SyncRunResult result = run.snapshot();
        sessionService.complete(run.session, result);
        log.info("{} sync finished for user {}: {}", provider, userId, result.summary());
        return result;
    }

    private void paginate(Run run, ListRequest request, String startToken) {
        int cap = properties.getMaxItemsPerRun();
        String pageToken = startToken;
        boolean resuming = startToken != null;

        while (true) {
            if (deadlinePassed(run)) {
                run.stop(StopReason.DEADLINE, pageToken);
                return;
            }
            int remaining = cap - run.fetched;
            if (remaining <= 0) {
                run.stop(StopReason.ITEM_CAP, pageToken);
                return;
            }

            // Never ask for more than the cap allows, so a capped run ends on a page boundary
            ListRequest pageRequest = request.withPageSize(Math.min(request.pageSize(), remaining));
            ProviderPage page;
            try {
                String token = pageToken;
                page = callWithAuthRetry(run, accessToken -> client.list(run.userId, accessToken, pageRequest, token));
            } catch (ProviderException e) {
                if (resuming && (e.getStatusCode() == 400 || e.getStatusCode() == 410)) {
                    log.warn("Saved page token rejected for user {} ({}), restarting from the first page",
                            run.userId, e.getStatusCode());
                    resuming = false;
                    pageToken = null;
                    continue;
                }
                throw e;
            }
            resuming = false;
            run.pages++;

            List<ProviderItem> items = page.items();
            if (items.size() > remaining) {
                log.warn("{} returned {} items for a page of {}, dropping {} past the item cap for user {}",
                        client.provider(), items.size(), pageRequest.pageSize(), items.size() - remaining, run.userId);
                items = items.subList(0, remaining);
            }

            int consumed = ingestPage(run, items);
            run.fetched += consumed;
            sessionService.recordProgress(run.session, run.snapshot());
            if (consumed < items.size()) {
                // Deadline hit mid-page; the page is fetched again next run
                run.stop(StopReason.DEADLINE, pageToken);
                return;
            }
            if (!page.hasMore()) {
                run.stop(StopReason.EXHAUSTED, null);
                return;
            }
            pageToken = page.nextPageToken();
        }
    }

    /**
     * Hydrates and writes the page in sub-batches of the fetch size, one batched insert each.
     *
     * @return number of items consumed before the deadline
     */
    private int ingestPage(Run run, List<ProviderItem> items) {
        int batchSize = Math.max(1, properties.getFetchBatchSize());
        int consumed = 0;
        for (int i = 0; i < items.size(); i += batchSize) {
            if (i > 0) {
                pause(properties.getInterBatchDelay().toMillis());
            }
            if (deadlinePassed(run)) {
                return consumed;
            }
            List<ProviderItem> chunk = items.subList(i, Math.min(i + batchSize, items.size()));
            List<ProviderItem> hydrated = hydrate(run, chunk);
            List<RawEvent> events = new ArrayList<>(hydrated.size());
            List<RawEventError> errors = new ArrayList<>();
            for (ProviderItem item : hydrated) {
                if (item.sourceId() == null || item.sourceId().isBlank() || !item.isHydrated()) {
                    errors.add(ingestionError(run, item.sourceId(), "Item without source id or payload"));
                    continue;
                }
                events.add(toRawEvent(run, item));
            }
            run.malformed += chunk.size() - events.size();
            if (hydrated.size() < chunk.size()) {
                for (ProviderItem missing : missingFrom(chunk, hydrated)) {
                    errors.add(ingestionError(run, missing.sourceId(), "Item no longer available at the provider"));
                }
            }

            run.written += rawEventRepository.insertAll(events);
            if (!errors.isEmpty()) {
                log.warn("Skipped {} malformed {} items for user {} batch {}",
                        errors.size(), client.provider(), run.userId, run.batchId);
                rawEventErrorRepository.saveAll(errors);
            }
            consumed += chunk.size();
            log.debug("Wrote {} raw events for user {} batch {}", events.size(), run.userId, run.batchId);
        }
        return consumed;
    }

    private List<ProviderItem> hydrate(Run run, List<ProviderItem> chunk) {
        List<String> stubIds = new ArrayList<>();
        for (ProviderItem item : chunk) {
            if (!item.isHydrated() && item.sourceId() != null) {
                stubIds.add(item.sourceId());
            }
        }
        if (stubIds.isEmpty()) {
            return chunk;
        }
        List<ProviderItem> fetched = callWithAuthRetry(run, accessToken -> client.getBatch(run.userId, accessToken, stubIds));
        Map<String, ProviderItem> byId = new HashMap<>();
        for (ProviderItem item : fetched) {
            byId.put(item.sourceId(), item);
        }
        List<ProviderItem> result = new ArrayList<>(chunk.size());
        for (ProviderItem item : chunk) {
            if (item.isHydrated()) {
                result.add(item);
            } else if (item.sourceId() == null) {
                result.add(item);
            } else if (byId.containsKey(item.sourceId())) {
                result.add(byId.get(item.sourceId()));
            }
        }
        return result;
    }

    private static List<ProviderItem> missingFrom(List<ProviderItem> requested, List<ProviderItem> returned) {
        List<String> returnedIds = new ArrayList<>();
        for (ProviderItem item : returned) {
            returnedIds.add(item.sourceId());
        }
        List<ProviderItem> missing = new ArrayList<>();
        for (ProviderItem item : requested) {
            if (item.sourceId() != null && !returnedIds.contains(item.sourceId())) {
                missing.add(item);
            }
        }
        return missing;
    }

    /**
     * A 401 triggers one token refresh per run; a second 401 means the grant is gone.
     */
    private <T> T callWithAuthRetry(Run run, Function<String, T> call) {
        try {
            return call.apply(run.token);
        } catch (ProviderException e) {
            if (!e.isUnauthorized()) {
                throw e;
            }
            Provider provider = client.provider();
            if (run.refreshed) {
                tokenVault.invalidate(run.userId, provider, "401 after token refresh");
                throw new AuthException(run.userId, provider, "Provider rejected a freshly refreshed token", e);
            }
            run.refreshed = true;
            run.token = tokenVault.refreshAfterUnauthorized(run.userId, provider, run.token);
            try {
                return call.apply(run.token);
            } catch (ProviderException again) {
                if (again.isUnauthorized()) {
                    tokenVault.invalidate(run.userId, provider, "401 after token refresh");
                    throw new AuthException(run.userId, provider, "Provider rejected a freshly refreshed token", again);
                }
                throw again;
            }
        }
    }

    private RawEvent toRawEvent(Run run, ProviderItem item) {
        RawEvent event = new RawEvent();
        event.setUserId(run.userId);
        event.setProvider(client.provider());
        event.setSourceId(item.sourceId());
        event.setPayload(item.payload());
        event.setOccurredAt(item.occurredAt() != null ? item.occurredAt() : clock.instant());
        event.setBatchId(run.batchId);
        return event;
    }

    private RawEventError ingestionError(Run run, String sourceId, String message) {
        RawEventError error = new RawEventError();
        error.setUserId(run.userId);
        error.setProvider(client.provider());
        error.setStage(ErrorStage.INGESTION);
        error.setSourceId(sourceId);
        error.setError(message);
        error.setBatchId(run.batchId);
        error.setErrorAt(clock.instant());
        return error;
    }

    private void enqueueNormalization(String userId, String batchId) {
        jobQueueService.enqueue(userId, JobKind.normalizeFor(client.provider()), null, batchId);
    }

    protected JsonNode readPayload(Job job) {
        if (job.getPayload() == null || job.getPayload().isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(job.getPayload());
        } catch (JsonProcessingException e) {
            throw new JobPayloadException("Job " + job.getId() + " payload is not valid JSON", e);
        }
    }

    private boolean deadlinePassed(Run run) {
        return !clock.instant().isBefore(run.deadline);
    }

    private static void pause(long millis) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Sync interrupted", e);
        }
    }

    /**
     * Mutable state of one run.
     */
    private static final class Run {
        final String userId;
        final String batchId;
        final Instant deadline;
        String token;
        boolean refreshed;
        int pages;
        int fetched;
        int written;
        int malformed;
        StopReason stopReason;
        String resumeToken;
        SyncSession session;

        Run(String userId, String batchId, Instant deadline) {
            this.userId = userId;
            this.batchId = batchId;
            this.deadline = deadline;
        }

        SyncRunResult snapshot() {
            return new SyncRunResult(batchId, pages, fetched, written, malformed, stopReason);
        }

        void stop(StopReason reason, String resumeFrom) {
            this.stopReason = reason;
            this.resumeToken = reason == StopReason.EXHAUSTED ? null : resumeFrom;
        }
    }
}
