package omni.sync.app.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

@Entity
@Table(name = "raw_event_errors")
@Data
public class RawEventError {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    private String rawEventId;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private Provider provider;

    @Enumerated(EnumType.STRING)
    @Column(length = 20)
    private ErrorStage stage;

    private String sourceId;

    @Column(length = 2000)
    private String error;

    @Column(length = 36)
    private String batchId;

    private Instant errorAt;
}
