package omni.sync.app.config;

import jakarta.servlet.http.HttpServletRequest;
import omni.sync.app.entity.Provider;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.client.registration.ClientRegistrationRepository;
import org.springframework.security.oauth2.client.web.DefaultOAuth2AuthorizationRequestResolver;
import org.springframework.security.oauth2.client.web.OAuth2AuthorizationRequestResolver;
import org.springframework.security.oauth2.core.endpoint.OAuth2AuthorizationRequest;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;

import java.util.HashMap;
import java.util.Map;

/**
 * Starts the provider connect flow at /api/integrations/{registrationId}/authorize for a signed-in
 * user. Adds access_type=offline and prompt=consent so Google always returns a refresh token.
 */
public class ProviderConnectRequestResolver implements OAuth2AuthorizationRequestResolver {
    private static final String REGISTRATION_ID_URI_VARIABLE_NAME = "registrationId";
    private static final AntPathRequestMatcher authorizationRequestMatcher = new AntPathRequestMatcher(
            "/api/integrations/{" + REGISTRATION_ID_URI_VARIABLE_NAME + "}/authorize");

    private final OAuth2AuthorizationRequestResolver defaultResolver;

    public ProviderConnectRequestResolver(ClientRegistrationRepository clientRegistrationRepository) {
        this.defaultResolver = new DefaultOAuth2AuthorizationRequestResolver(
                clientRegistrationRepository, "/api/integrations");
    }

    @Override
    public OAuth2AuthorizationRequest resolve(HttpServletRequest request) {
        AntPathRequestMatcher.MatchResult match = authorizationRequestMatcher.matcher(request);
        if (!match.isMatch()) {
            return null;
        }
        return resolve(request, match.getVariables().get(REGISTRATION_ID_URI_VARIABLE_NAME));
    }

    @Override
    public OAuth2AuthorizationRequest resolve(HttpServletRequest request, String clientRegistrationId) {
        // Connecting needs a signed-in user and one of the provider registrations, never the login one
        if (!isSignedIn() || !isProvider(clientRegistrationId)) {
            return null;
        }
        return customizeAuthorizationRequest(defaultResolver.resolve(request, clientRegistrationId));
    }

    private OAuth2AuthorizationRequest customizeAuthorizationRequest(OAuth2AuthorizationRequest authorizationRequest) {
        if (authorizationRequest == null) {
            return null;
        }

        Map<String, Object> additionalParameters = new HashMap<>(authorizationRequest.getAdditionalParameters());
        additionalParameters.put("access_type", "offline");
        additionalParameters.put("prompt", "consent");
        additionalParameters.put("include_granted_scopes", "true");

        return OAuth2AuthorizationRequest.from(authorizationRequest)
                .additionalParameters(additionalParameters)
                .build();
    }

    private static boolean isSignedIn() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        return authentication != null && authentication.isAuthenticated()
                && !(authentication instanceof AnonymousAuthenticationToken);
    }

    private static boolean isProvider(String registrationId) {
        if (registrationId == null) {
            return false;
        }
        for (Provider provider : Provider.values()) {
            if (provider.getWireName().equals(registrationId)) {
                return true;
            }
        }
        return false;
    }
}
