package omni.sync.app.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "integration_credentials",
        uniqueConstraints = @UniqueConstraint(name = "uk_credential_user_provider", columnNames = {"user_id", "provider"}))
@Getter
@Setter
@ToString(exclude = "token")
@EqualsAndHashCode(of = "id")
public class IntegrationCredential {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Provider provider;

    @Embedded
    private OAuthToken token;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private CredentialStatus status;

    @Version
    private Long version;

    private Instant createdAt;

    private Instant updatedAt;

    public boolean isUsable() {
        return status == CredentialStatus.ACTIVE && token != null && token.getAccessToken() != null;
    }
}
