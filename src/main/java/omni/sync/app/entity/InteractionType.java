package omni.sync.app.entity;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum InteractionType {
    EMAIL,
    MEETING;

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
