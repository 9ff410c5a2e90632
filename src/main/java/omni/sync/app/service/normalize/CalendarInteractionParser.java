package omni.sync.app.service.normalize;

import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.calendar.model.Event;
import com.google.api.services.calendar.model.EventAttendee;
import com.google.api.services.calendar.model.EventDateTime;
import omni.sync.app.entity.Interaction;
import omni.sync.app.entity.InteractionType;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;
import omni.sync.app.exception.MalformedPayloadException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Calendar event to meeting interaction.
 */
@Component
public class CalendarInteractionParser implements InteractionParser {
    private static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    @Override
    public Provider provider() {
        return Provider.CALENDAR;
    }

    @Override
    public Interaction parse(RawEvent event) {
        Event calendarEvent = read(event);
        Instant start = startOf(calendarEvent.getStart());
        if (start == null) {
            throw new MalformedPayloadException("Calendar event " + event.getSourceId() + " has no start time");
        }

        List<String> participants = new ArrayList<>();
        if (calendarEvent.getOrganizer() != null) {
            participants.add(calendarEvent.getOrganizer().getEmail());
        }
        if (calendarEvent.getAttendees() != null) {
            for (EventAttendee attendee : calendarEvent.getAttendees()) {
                participants.add(attendee.getEmail());
            }
        }

        Interaction interaction = new Interaction();
        interaction.setUserId(event.getUserId());
        interaction.setType(InteractionType.MEETING);
        interaction.setSubject(ParserSupport.truncate(calendarEvent.getSummary(), ParserSupport.MAX_SUBJECT_LENGTH));
        interaction.setBodyText(calendarEvent.getDescription());
        interaction.setParticipants(ParserSupport.joinParticipants(participants));
        interaction.setOccurredAt(start);
        interaction.setSource(Provider.CALENDAR);
        interaction.setSourceId(event.getSourceId());
        interaction.setBatchId(event.getBatchId());
        return interaction;
    }

    private static Event read(RawEvent event) {
        if (event.getPayload() == null || event.getPayload().isBlank()) {
            throw new MalformedPayloadException("Empty calendar payload for " + event.getSourceId());
        }
        try {
            return JSON_FACTORY.fromString(event.getPayload(), Event.class);
        } catch (IOException | RuntimeException e) {
            throw new MalformedPayloadException("Unreadable calendar payload for " + event.getSourceId() + ": " + e.getMessage(), e);
        }
    }

    private static Instant startOf(EventDateTime start) {
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
