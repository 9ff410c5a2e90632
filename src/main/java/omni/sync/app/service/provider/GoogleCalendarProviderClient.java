package omni.sync.app.service.provider;

import com.google.api.client.http.HttpTransport;
import com.google.api.client.util.DateTime;
import com.google.api.services.calendar.Calendar;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventDateTime;
import com.google.api.services.calendar.model.Events;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.ProviderProperties;
import omni.sync.app.config.SyncProperties;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.ProviderException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;

/**
 * Google Calendar events. The list response already carries full events, so items come back hydrated.
 */
@Slf4j
@Component
public class GoogleCalendarProviderClient extends AbstractGoogleProviderClient {
    private final String calendarId;

    @Autowired
    public GoogleCalendarProviderClient(HttpTransport httpTransport,
                                        ProviderProperties properties,
                                        SyncProperties syncProperties,
                                        ProviderCallGuards guards) {
        this(httpTransport, properties, syncProperties.getCalendar().getCalendarId(),
                new GoogleRequestExecutor(Provider.CALENDAR, guards, properties.getRetry().toPolicy()));
    }

    GoogleCalendarProviderClient(HttpTransport httpTransport, ProviderProperties properties,
                                 String calendarId, GoogleRequestExecutor executor) {
        super(httpTransport, properties, executor);
        this.calendarId = calendarId;
    }

    @Override
    public Provider provider() {
        return Provider.CALENDAR;
    }

    private Calendar calendar(String accessToken) {
        return new Calendar.Builder(httpTransport, JSON_FACTORY, requestInitializer(accessToken))
                .setApplicationName(properties.getApplicationName())
                .build();
    }

    @Override
    public ProviderPage list(String userId, String accessToken, ListRequest request, String pageToken) {
        Calendar service = calendar(accessToken);
        Events events = executor.execute(userId, "events.list", () -> {
            Calendar.Events.List call = service.events().list(calendarId)
                    .setSingleEvents(true)
                    .setOrderBy("startTime")
                    .setMaxResults(request.pageSize());
            if (request.timeMin() != null) {
                call.setTimeMin(new DateTime(Date.from(request.timeMin())));
            }
            if (request.timeMax() != null) {
                call.setTimeMax(new DateTime(Date.from(request.timeMax())));
            }
            if (pageToken != null) {
                call.setPageToken(pageToken);
            }
            return call.execute();
        });

        List<ProviderItem> items = new ArrayList<>();
        if (events.getItems() != null) {
            for (Event event : events.getItems()) {
                items.add(toItem(event));
            }
        }
        return new ProviderPage(items, events.getNextPageToken());
    }

    @Override
    public List<ProviderItem> getBatch(String userId, String accessToken, List<String> ids) {
        Calendar service = calendar(accessToken);
        List<ProviderItem> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            try {
                Event event = executor.execute(userId, "events.get", () -> service.events().get(calendarId, id).execute());
                items.add(toItem(event));
            } catch (ProviderException e) {
                if (!e.isNotFound()) {
                    throw e;
                }
                log.warn("Calendar event {} no longer exists, skipping", id);
            }
        }
        return items;
    }

    private ProviderItem toItem(Event event) {
        return new ProviderItem(event.getId(), toJson(event), startOf(event));
    }

    static Instant startOf(Event event) {
        EventDateTime start = event.getStart();
        if (start == null) {
            return null;
        }
        if (start.getDateTime() != null) {
            return Instant.ofEpochMilli(start.getDateTime().getValue());
        }
        if (start.getDate() != null) {
            return Instant.ofEpochMilli(start.getDate().getValue());
        }
        return null;
    }
}
