package omni.sync.app.controller;

import omni.sync.app.entity.Interaction;
import omni.sync.app.entity.InteractionType;
import omni.sync.app.entity.Provider;

import java.time.Instant;

public record InteractionView(String id, InteractionType type, String subject, String bodyText,
                              String participants, Instant occurredAt, Provider source, String sourceId) {

    public static InteractionView from(Interaction interaction) {
        return new InteractionView(interaction.getId(), interaction.getType(), interaction.getSubject(),
                interaction.getBodyText(), interaction.getParticipants(), interaction.getOccurredAt(),
                interaction.getSource(), interaction.getSourceId());
    }
}
