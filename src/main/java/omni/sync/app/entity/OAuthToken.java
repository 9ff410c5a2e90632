package omni.sync.app.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;

import java.time.Instant;

/**
 * Token material of a credential. Both token columns hold ciphertext.
 */
@Embeddable
@Data
public class OAuthToken {
    @Column(length = 4000)
    private String accessToken;

    @Column(length = 4000)
    private String refreshToken;

    private Instant expiry;

    @Column(length = 1000)
    private String scopes;
}
