package omni.sync.app.service.provider;

import java.util.List;

public record ProviderPage(List<ProviderItem> items, String nextPageToken) {

    public boolean hasMore() {
        return nextPageToken != null && !nextPageToken.isEmpty();
    }
}
