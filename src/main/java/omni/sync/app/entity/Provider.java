package omni.sync.app.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * External read-only data sources a user can connect.
 */
public enum Provider {
    MAIL("mail", "https://www.googleapis.com/auth/gmail.readonly"),
    CALENDAR("calendar", "https://www.googleapis.com/auth/calendar.readonly");

    private final String wireName;
    private final String scope;

    Provider(String wireName, String scope) {
        this.wireName = wireName;
        this.scope = scope;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getScope() {
        return scope;
    }

    @JsonCreator
    public static Provider fromWireName(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (Provider provider : values()) {
                if (provider.wireName.equals(normalized)) {
                    return provider;
                }
            }
        }
        throw new IllegalArgumentException("Unknown provider: " + value);
    }
}
