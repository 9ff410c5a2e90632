package omni.sync.app.service.provider;

import com.google.api.client.http.HttpTransport;
import com.google.api.services.gmail.Gmail;
import com.google.api.services.gmail.model.ListMessagesResponse;
import com.google.api.services.gmail.model.Message;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.config.ProviderProperties;
import omni.sync.app.entity.Provider;
import omni.sync.app.exception.ProviderException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Gmail messages: list returns stubs, getBatch fetches each message in full format.
 */
@Slf4j
@Component
public class GmailProviderClient extends AbstractGoogleProviderClient {
    private static final String ME = "me";

    @Autowired
    public GmailProviderClient(HttpTransport httpTransport, ProviderProperties properties, ProviderCallGuards guards) {
        this(httpTransport, properties, new GoogleRequestExecutor(Provider.MAIL, guards, properties.getRetry().toPolicy()));
    }

    GmailProviderClient(HttpTransport httpTransport, ProviderProperties properties, GoogleRequestExecutor executor) {
        super(httpTransport, properties, executor);
    }

    @Override
    public Provider provider() {
        return Provider.MAIL;
    }

    private Gmail gmail(String accessToken) {
        return new Gmail.Builder(httpTransport, JSON_FACTORY, requestInitializer(accessToken))
                .setApplicationName(properties.getApplicationName())
                .build();
    }

    @Override
    public ProviderPage list(String userId, String accessToken, ListRequest request, String pageToken) {
        Gmail service = gmail(accessToken);
        ListMessagesResponse response = executor.execute(userId, "messages.list", () -> {
            Gmail.Users.Messages.List call = service.users().messages().list(ME)
                    .setMaxResults((long) request.pageSize());
            if (request.query() != null && !request.query().isBlank()) {
                call.setQ(request.query());
            }
            if (pageToken != null) {
                call.setPageToken(pageToken);
            }
            return call.execute();
        });

        List<ProviderItem> items = new ArrayList<>();
        if (response.getMessages() != null) {
            for (Message messageRef : response.getMessages()) {
                items.add(ProviderItem.stub(messageRef.getId()));
            }
        }
        return new ProviderPage(items, response.getNextPageToken());
    }

    @Override
    public List<ProviderItem> getBatch(String userId, String accessToken, List<String> ids) {
        Gmail service = gmail(accessToken);
        List<ProviderItem> items = new ArrayList<>(ids.size());
        for (String id : ids) {
            Message message;
            try {
                message = executor.execute(userId, "messages.get", () -> service.users().messages().get(ME, id)
                        .setFormat("full")
                        .execute());
            } catch (ProviderException e) {
                if (e.isNotFound()) {
                    log.warn("Gmail message {} no longer exists, skipping", id);
                    continue;
                }
                throw e;
            }
            Instant occurredAt = message.getInternalDate() != null
                    ? Instant.ofEpochMilli(message.getInternalDate())
                    : null;
            items.add(new ProviderItem(message.getId() != null ? message.getId() : id, toJson(message), occurredAt));
        }
        return items;
    }
}
