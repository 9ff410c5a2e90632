package omni.sync.app.service.provider;

import java.time.Instant;

/**
 * @param payload verbatim provider JSON, null for list stubs
 */
public record ProviderItem(String sourceId, String payload, Instant occurredAt) {

    public static ProviderItem stub(String sourceId) {
        return new ProviderItem(sourceId, null, null);
    }

    public boolean isHydrated() {
        return payload != null;
    }
}
