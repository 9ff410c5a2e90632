package omni.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;
import omni.sync.app.service.sync.StopReason;

import java.time.Instant;

/**
 * One sync run of a provider for a user, with its progress counters.
 */
@Entity
@Table(name = "sync_sessions", indexes = {
        @Index(name = "idx_sync_session_user_started", columnList = "user_id, started_at"),
        @Index(name = "idx_sync_session_status", columnList = "status")
})
@Getter
@Setter
@ToString
@EqualsAndHashCode(of = "id")
public class SyncSession {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Provider provider;

    private String jobId;

    @Column(nullable = false)
    private String batchId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private SyncSessionStatus status;

    private int pages;

    private int itemsFetched;

    private int itemsWritten;

    private int itemsMalformed;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private StopReason stopReason;

    @Column(length = 2000)
    private String error;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    private Instant updatedAt;

    private Instant completedAt;
}
