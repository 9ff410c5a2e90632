package omni.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * One provider item exactly as fetched. Rows are append-only.
 */
@Entity
@Table(name = "raw_events", indexes = {
        @Index(name = "idx_raw_events_batch", columnList = "user_id, provider, batch_id")
})
@Getter
@Setter
@ToString(exclude = "payload")
@EqualsAndHashCode(of = "id")
public class RawEvent {
    @Id
    private String id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private Provider provider;

    @Column(nullable = false, updatable = false)
    private String sourceId;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String payload;

    @Column(updatable = false)
    private Instant occurredAt;

    @Column(length = 36, updatable = false)
    private String batchId;

    @Column(updatable = false)
    private Instant createdAt;
}
