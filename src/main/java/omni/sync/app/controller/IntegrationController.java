package omni.sync.app.controller;

import omni.sync.app.entity.IntegrationCredential;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.InvalidOAuthStateException;
import omni.sync.app.exception.OAuthExchangeException;
import omni.sync.app.service.UserService;
import omni.sync.app.service.vault.OAuthConnectService;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Landing page of the provider connect flow. GET /api/integrations/{provider}/authorize is
 * served by the OAuth2 client filter, which also exchanges the code and then redirects here
 * without it.
 */
@RestController
@RequestMapping("/api/integrations")
public class IntegrationController {
    private final OAuthConnectService connectService;
    private final UserService userService;

    public IntegrationController(OAuthConnectService connectService, UserService userService) {
        this.connectService = connectService;
        this.userService = userService;
    }

    @GetMapping("/{provider}/callback")
    public Map<String, Object> callback(@PathVariable("provider") String provider,
                                        @RequestParam(value = "error", required = false) String error,
                                        @RequestParam(value = "code", required = false) String code,
                                        @RequestParam(value = "state", required = false) String state,
                                        Authentication authentication) {
        Provider target = Provider.fromWireName(provider);
        if (error != null) {
            throw new OAuthExchangeException("Authorization failed for " + target.getWireName() + ": " + error, null);
        }
        // The filter consumes every callback it started, so a code here has no matching request
        if (code != null || state != null) {
            throw new InvalidOAuthStateException("No authorization request matches this callback");
        }
        String userId = userService.currentUserId(authentication);
        IntegrationCredential credential = connectService.completeConnection(userId, target);
        return Map.of(
                "provider", credential.getProvider(),
                "status", credential.getStatus(),
                "connected", true);
    }
}
