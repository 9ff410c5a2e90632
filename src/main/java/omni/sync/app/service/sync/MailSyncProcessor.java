package omni.sync.app.service.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import omni.sync.app.config.SyncProperties;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncState;
import omni.sync.app.repository.RawEventErrorRepository;
import omni.sync.app.repository.RawEventRepository;
import omni.sync.app.service.job.JobQueueService;
import omni.sync.app.service.provider.GmailProviderClient;
import omni.sync.app.service.provider.ListRequest;
import omni.sync.app.service.vault.TokenVault;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Mail sync. Incremental after the first successful run: {@code after:} the last success
 * minus an overlap, otherwise {@code newer_than:} the configured window.
 */
@Service
public class MailSyncProcessor extends AbstractSyncProcessor {
    private static final DateTimeFormatter GMAIL_DATE = DateTimeFormatter.ofPattern("yyyy/MM/dd").withZone(ZoneOffset.UTC);

    public MailSyncProcessor(GmailProviderClient client,
                             TokenVault tokenVault,
                             RawEventRepository rawEventRepository,
                             RawEventErrorRepository rawEventErrorRepository,
                             JobQueueService jobQueueService,
                             SyncStateService syncStateService,
                             SyncSessionService sessionService,
                             SyncProperties properties,
                             ObjectMapper objectMapper,
                             Clock clock) {
        super(client, tokenVault, rawEventRepository, rawEventErrorRepository, jobQueueService,
                syncStateService, sessionService, properties, objectMapper, clock);
    }

    @Override
    protected ListRequest buildListRequest(String userId, JsonNode payload, Instant startedAt) {
        String explicitQuery = payload.path("query").asText(null);
        if (explicitQuery != null && !explicitQuery.isBlank()) {
            return ListRequest.forQuery(explicitQuery, properties.getPageSize());
        }

        SyncProperties.Mail mail = properties.getMail();
        Instant lastSuccess = syncStateService.find(userId, Provider.MAIL)
                .map(SyncState::getLastSuccessfulSyncAt)
                .orElse(null);
        String window = lastSuccess != null
                ? "after:" + GMAIL_DATE.format(lastSuccess.minusSeconds(mail.getOverlapHours() * 3600L))
                : "newer_than:" + mail.getDaysBack() + "d";
        String base = mail.getBaseQuery();
        String query = base == null || base.isBlank() ? window : window + " " + base;
        return ListRequest.forQuery(query, properties.getPageSize());
    }
}
