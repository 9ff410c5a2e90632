package omni.sync.app.service.provider;

import omni.sync.app.entity.Provider;

import java.util.List;

/**
 * Read-only access to one provider. Implementations are rate limited, retry transient
 * failures and bound every request with connect and read timeouts.
 * <p>
 * Limits and the circuit breaker are kept per user, so every call names the user it acts for.
 * <p>
 * A 401 is never retried; it surfaces as a {@link omni.sync.app.exception.ProviderException}
 * with {@code isUnauthorized()} so the caller can refresh the token through the vault.
 */
public interface ProviderClient {

    Provider provider();

    /**
     * Lists one page of items. Items may be stubs (source id only) that need {@link #getBatch}.
     *
     * @param pageToken null for the first page
     */
    ProviderPage list(String userId, String accessToken, ListRequest request, String pageToken);

    /**
     * Fetches full payloads for the given ids, in order. Ids the provider no longer knows are omitted.
     */
    List<ProviderItem> getBatch(String userId, String accessToken, List<String> ids);
}
