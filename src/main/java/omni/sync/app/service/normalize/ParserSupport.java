package omni.sync.app.service.normalize;

import java.util.Collection;
import java.util.stream.Collectors;

final class ParserSupport {
    static final int MAX_SUBJECT_LENGTH = 1000;
    static final int MAX_PARTICIPANTS_LENGTH = 4000;

    private ParserSupport() {
    }

    static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    static String joinParticipants(Collection<String> participants) {
        String joined = participants.stream()
                .filter(p -> p != null && !p.isBlank())
                .map(String::trim)
                .distinct()
                .collect(Collectors.joining(", "));
        return joined.isEmpty() ? null : truncate(joined, MAX_PARTICIPANTS_LENGTH);
    }
}
