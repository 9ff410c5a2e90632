package omni.sync.app.service.normalize;

import omni.sync.app.entity.Interaction;
import omni.sync.app.entity.InteractionType;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;
import omni.sync.app.exception.MalformedPayloadException;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CalendarInteractionParserTest {

    private final CalendarInteractionParser parser = new CalendarInteractionParser();

    private static RawEvent rawEvent(String payload) {
        RawEvent event = new RawEvent();
        event.setId("raw-1");
        event.setUserId("user123");
        event.setProvider(Provider.CALENDAR);
        event.setSourceId("evt-1");
        event.setPayload(payload);
        event.setBatchId("batch-1");
        return event;
    }

    @Test
    void parse_WithTimedEvent_ShouldCreateMeeting() {
        // Given
        String payload = "{\"id\":\"evt-1\",\"summary\":\"Planning\",\"description\":\"Agenda: roadmap\","
                + "\"organizer\":{\"email\":\"alice@example.com\"},"
                + "\"attendees\":[{\"email\":\"alice@example.com\"},{\"email\":\"bob@example.com\"}],"
                + "\"start\":{\"dateTime\":\"2026-02-03T15:00:00Z\"},\"end\":{\"dateTime\":\"2026-02-03T16:00:00Z\"}}";

        // When
        Interaction interaction = parser.parse(rawEvent(payload));

        // Then
        assertEquals(InteractionType.MEETING, interaction.getType());
        assertEquals("Planning", interaction.getSubject());
        assertEquals("Agenda: roadmap", interaction.getBodyText());
        assertEquals("alice@example.com, bob@example.com", interaction.getParticipants());
        assertEquals(Instant.parse("2026-02-03T15:00:00Z"), interaction.getOccurredAt());
        assertEquals(Provider.CALENDAR, interaction.getSource());
        assertEquals("evt-1", interaction.getSourceId());
    }

    @Test
    void parse_WithAllDayEvent_ShouldUseStartDate() {
        // Given
        String payload = "{\"id\":\"evt-1\",\"summary\":\"Offsite\",\"start\":{\"date\":\"2026-06-01\"}}";

        // When
        Interaction interaction = parser.parse(rawEvent(payload));

        // Then
        assertEquals(Instant.parse("2026-06-01T00:00:00Z"), interaction.getOccurredAt());
        assertNull(interaction.getParticipants());
    }

    @Test
    void parse_WithoutStart_ShouldThrowMalformedPayload() {
        assertThrows(MalformedPayloadException.class,
                () -> parser.parse(rawEvent("{\"id\":\"evt-1\",\"summary\":\"No time\"}")));
    }

    @Test
    void parse_WithInvalidJson_ShouldThrowMalformedPayload() {
        assertThrows(MalformedPayloadException.class, () -> parser.parse(rawEvent("{\"id\":")));
    }
}
