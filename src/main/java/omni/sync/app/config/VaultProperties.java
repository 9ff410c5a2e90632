package omni.sync.app.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Token vault settings (omni.vault.*).
 */
@ConfigurationProperties(prefix = "omni.vault")
@Getter
@Setter
@NoArgsConstructor
public class VaultProperties {

    /** Tokens expiring within this margin are refreshed before use. */
    private Duration refreshMargin = Duration.ofMinutes(5);

    private String tokenEndpoint = "https://oauth2.googleapis.com/token";

    private String clientId;

    private String clientSecret;

    /** Password and hex salt of the token cipher. */
    private String encryptionPassword;

    private String encryptionSalt;

    private Duration httpConnectTimeout = Duration.ofSeconds(10);

    private Duration httpReadTimeout = Duration.ofSeconds(20);
}
