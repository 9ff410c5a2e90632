package omni.sync.app.service.vault;

/**
 * Parsed token endpoint response. {@code refreshToken} is null when the provider did not rotate it.
 */
public record TokenResponse(String accessToken, String refreshToken, long expiresInSeconds, String scope) {
}
