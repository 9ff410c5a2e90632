package omni.sync.app.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum JobKind {
    MAIL_SYNC("mail_sync", Provider.MAIL, false),
    CALENDAR_SYNC("calendar_sync", Provider.CALENDAR, false),
    NORMALIZE_MAIL("normalize_mail", Provider.MAIL, true),
    NORMALIZE_CALENDAR("normalize_calendar", Provider.CALENDAR, true);

    private final String wireName;
    private final Provider provider;
    private final boolean normalization;

    JobKind(String wireName, Provider provider, boolean normalization) {
        this.wireName = wireName;
        this.provider = provider;
        this.normalization = normalization;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public Provider getProvider() {
        return provider;
    }

    public boolean isNormalization() {
        return normalization;
    }

    public static Optional<JobKind> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (JobKind kind : values()) {
            if (kind.wireName.equals(value)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public static JobKind syncFor(Provider provider) {
        return provider == Provider.MAIL ? MAIL_SYNC : CALENDAR_SYNC;
    }

    public static JobKind normalizeFor(Provider provider) {
        return provider == Provider.MAIL ? NORMALIZE_MAIL : NORMALIZE_CALENDAR;
    }
}
