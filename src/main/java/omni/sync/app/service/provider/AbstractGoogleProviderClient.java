package omni.sync.app.service.provider;

import com.google.api.client.auth.oauth2.BearerToken;
import com.google.api.client.auth.oauth2.Credential;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.json.JsonFactory;
import com.google.api.client.json.gson.GsonFactory;
import omni.sync.app.config.ProviderProperties;
import omni.sync.app.exception.MalformedPayloadException;

import java.io.IOException;

/**
 * Shared plumbing of the Google backed clients: bearer credential, timeouts and the
 * guarded retrying executor.
 */
public abstract class AbstractGoogleProviderClient implements ProviderClient {
    protected static final JsonFactory JSON_FACTORY = GsonFactory.getDefaultInstance();

    protected final HttpTransport httpTransport;
    protected final ProviderProperties properties;
    protected final GoogleRequestExecutor executor;

    protected AbstractGoogleProviderClient(HttpTransport httpTransport,
                                           ProviderProperties properties,
                                           GoogleRequestExecutor executor) {
        this.httpTransport = httpTransport;
        this.properties = properties;
        this.executor = executor;
    }

    protected HttpRequestInitializer requestInitializer(String accessToken) {
        Credential credential = new Credential.Builder(BearerToken.authorizationHeaderAccessMethod())
                .setTransport(httpTransport)
                .setJsonFactory(JSON_FACTORY)
                .build();
        credential.setAccessToken(accessToken);
        int connectTimeout = (int) properties.getConnectTimeout().toMillis();
        int readTimeout = (int) properties.getReadTimeout().toMillis();
        return request -> {
            credential.initialize(request);
            request.setConnectTimeout(connectTimeout);
            request.setReadTimeout(readTimeout);
        };
    }

    protected static String toJson(Object model) {
        try {
            return JSON_FACTORY.toString(model);
        } catch (IOException e) {
            throw new MalformedPayloadException("Could not serialize provider payload", e);
        }
    }
}
