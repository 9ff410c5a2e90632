package omni.sync.app.service.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import omni.sync.app.config.SyncProperties;
import omni.sync.app.exception.JobPayloadException;
import omni.sync.app.repository.RawEventErrorRepository;
import omni.sync.app.repository.RawEventRepository;
import omni.sync.app.service.job.JobQueueService;
import omni.sync.app.service.provider.GoogleCalendarProviderClient;
import omni.sync.app.service.provider.ListRequest;
import omni.sync.app.service.vault.TokenVault;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Calendar sync over a time window around now. The window is aligned to whole days so a
 * saved page token stays valid for a resumed run on the same day.
 */
@Service
public class CalendarSyncProcessor extends AbstractSyncProcessor {

    public CalendarSyncProcessor(GoogleCalendarProviderClient client,
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
        SyncProperties.Calendar calendar = properties.getCalendar();
        int daysPast = intField(payload, "daysPast", calendar.getDaysPast());
        int daysFuture = intField(payload, "daysFuture", calendar.getDaysFuture());
        Instant today = startedAt.truncatedTo(ChronoUnit.DAYS);
        return ListRequest.forWindow(
                today.minus(daysPast, ChronoUnit.DAYS),
                today.plus(daysFuture + 1L, ChronoUnit.DAYS),
                properties.getPageSize());
    }

    private static int intField(JsonNode payload, String name, int defaultValue) {
        JsonNode value = payload.get(name);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt() || value.asInt() < 0) {
            throw new JobPayloadException(name + " must be a non-negative integer");
        }
        return value.asInt();
    }
}
