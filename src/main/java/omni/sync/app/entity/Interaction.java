package omni.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Canonical record derived from a raw event. At most one per (user, source, source id).
 */
@Entity
@Table(name = "interactions",
        uniqueConstraints = @UniqueConstraint(name = "uk_interaction_source",
                columnNames = {"user_id", "source", "source_id"}),
        indexes = @Index(name = "idx_interactions_user_occurred", columnList = "user_id, occurred_at"))
@Getter
@Setter
@ToString(exclude = "bodyText")
@EqualsAndHashCode(of = "id")
public class Interaction {
    @Id
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "interaction_type", nullable = false, length = 20)
    private InteractionType type;

    @Column(length = 1000)
    private String subject;

    @Column(columnDefinition = "TEXT")
    private String bodyText;

    @Column(length = 4000)
    private String participants;

    @Column(name = "occurred_at")
    private Instant occurredAt;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Provider source;

    @Column(name = "source_id", nullable = false)
    private String sourceId;

    @Column(length = 36)
    private String batchId;

    private Instant createdAt;
}
