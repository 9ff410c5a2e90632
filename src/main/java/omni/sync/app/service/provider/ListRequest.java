package omni.sync.app.service.provider;

import java.time.Instant;

/**
 * Provider-neutral list parameters: mail uses {@code query}, calendar uses the time window.
 */
public record ListRequest(String query, Instant timeMin, Instant timeMax, int pageSize) {

    public static ListRequest forQuery(String query, int pageSize) {
        return new ListRequest(query, null, null, pageSize);
    }

    public static ListRequest forWindow(Instant timeMin, Instant timeMax, int pageSize) {
        return new ListRequest(null, timeMin, timeMax, pageSize);
    }

    public ListRequest withPageSize(int size) {
        return size == pageSize ? this : new ListRequest(query, timeMin, timeMax, size);
    }
}
