package omni.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Durable unit of work. Status transitions are made only through the
 * conditional updates in {@code JobRepository}.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_jobs_status_run_after", columnList = "status, run_after"),
        @Index(name = "idx_jobs_user", columnList = "user_id")
})
@Getter
@Setter
@ToString(exclude = "payload")
@EqualsAndHashCode(of = "id")
public class Job {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 40)
    private JobKind kind;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private JobStatus status;

    private int attempts;

    @Column(length = 36)
    private String batchId;

    @Column(name = "run_after")
    private Instant runAfter;

    @Column(length = 2000)
    private String lastError;

    private Instant createdAt;

    private Instant updatedAt;
}
