package omni.sync.app.service.vault;

import omni.sync.app.config.VaultProperties;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Component;

/**
 * Encrypts token material before it reaches the database (AES-GCM, 256 bit key derived from
 * the configured password and salt).
 */
@Component
public class TokenCipher {
    private final TextEncryptor encryptor;

    public TokenCipher(VaultProperties properties) {
        if (isBlank(properties.getEncryptionPassword()) || isBlank(properties.getEncryptionSalt())) {
            throw new IllegalStateException(
                    "Token encryption is not configured. Please set omni.vault.encryption-password and omni.vault.encryption-salt");
        }
        this.encryptor = Encryptors.delux(properties.getEncryptionPassword(), properties.getEncryptionSalt());
    }

    public String encrypt(String plaintext) {
        return plaintext == null ? null : encryptor.encrypt(plaintext);
    }

    public String decrypt(String ciphertext) {
        return ciphertext == null ? null : encryptor.decrypt(ciphertext);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank() || value.startsWith("${");
    }
}
