package omni.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Per user and provider cursor of the sync processors.
 */
@Entity
@Table(name = "sync_states",
        uniqueConstraints = @UniqueConstraint(name = "uk_sync_state_user_provider", columnNames = {"user_id", "provider"}))
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class SyncState {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Provider provider;

    @Column(length = 2000)
    private String resumePageToken;

    private Instant lastSuccessfulSyncAt;

    private Instant lastRunAt;

    @Column(length = 2000)
    private String lastError;
}
