package omni.sync.app.service.vault;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.VaultProperties;
import omni.sync.app.exception.InvalidGrantException;
import omni.sync.app.exception.ProviderException;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

/**
 * Refresh-token grant against the OAuth token endpoint.
 */
@Slf4j
@Component
public class TokenEndpointClient {
    private static final long DEFAULT_EXPIRES_IN = 3600;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final VaultProperties properties;

    public TokenEndpointClient(RestTemplate oauthRestTemplate, ObjectMapper objectMapper, VaultProperties properties) {
        this.restTemplate = oauthRestTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    public TokenResponse refresh(String refreshToken) {
        MultiValueMap<String, String> body = new LinkedMultiValueMap<>();
        body.add("refresh_token", refreshToken);
        body.add("grant_type", "refresh_token");
        return post(body);
    }

    private TokenResponse post(MultiValueMap<String, String> body) {
        validateClientCredentials();
        body.add("client_id", properties.getClientId());
        body.add("client_secret", properties.getClientSecret());

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        HttpEntity<MultiValueMap<String, String>> request = new HttpEntity<>(body, headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(properties.getTokenEndpoint(), request, String.class);
        } catch (HttpStatusCodeException e) {
            String errorBody = e.getResponseBodyAsString();
            if (e.getStatusCode().is4xxClientError() && errorBody.contains("invalid_grant")) {
                throw new InvalidGrantException("Token endpoint rejected the grant: " + errorBody);
            }
            throw ProviderException.forStatus(e.getStatusCode().value(),
                    "Token endpoint returned " + e.getStatusCode().value() + ": " + errorBody, e);
        } catch (ResourceAccessException e) {
            throw ProviderException.transientFailure("Token endpoint unreachable: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw ProviderException.forStatus(response.getStatusCode().value(),
                    "Unexpected token endpoint response. Status: " + response.getStatusCode(), null);
        }
        return parse(response.getBody());
    }

    private TokenResponse parse(String responseBody) {
        try {
            JsonNode json = objectMapper.readTree(responseBody);
            if (!json.hasNonNull("access_token")) {
                throw new ProviderException("Token response missing access_token", 200, false, null);
            }
            long expiresIn = json.hasNonNull("expires_in") ? json.get("expires_in").asLong() : DEFAULT_EXPIRES_IN;
            String refreshToken = json.hasNonNull("refresh_token") ? json.get("refresh_token").asText() : null;
            String scope = json.hasNonNull("scope") ? json.get("scope").asText() : null;
            return new TokenResponse(json.get("access_token").asText(), refreshToken, expiresIn, scope);
        } catch (JsonProcessingException e) {
            throw new ProviderException("Token response is not valid JSON", 200, false, e);
        }
    }

    private void validateClientCredentials() {
        if (isBlank(properties.getClientId())) {
            throw new IllegalStateException("OAuth client-id is not configured. Please set omni.vault.client-id");
        }
        if (isBlank(properties.getClientSecret())) {
            throw new IllegalStateException("OAuth client-secret is not configured. Please set omni.vault.client-secret");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isEmpty() || value.startsWith("${");
    }
}
