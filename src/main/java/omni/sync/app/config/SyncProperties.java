package omni.sync.app.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Sync processor settings (omni.sync.*).
 */
@ConfigurationProperties(prefix = "omni.sync")
@Getter
@Setter
@NoArgsConstructor
public class SyncProperties {

    /** Hard cap of items fetched in one run. */
    private int maxItemsPerRun = 500;

    /** Wall-clock deadline of one run. */
    private Duration runDeadline = Duration.ofMinutes(4);

    /** Items hydrated and written per sub-batch. */
    private int fetchBatchSize = 20;

    /** Pause between two sub-batches. */
    private Duration interBatchDelay = Duration.ofMillis(200);

    /** Page size requested from the provider list call. */
    private int pageSize = 100;

    /** Continue from the saved page token when the previous run stopped early. */
    private boolean resumeEnabled = true;

    private Mail mail = new Mail();

    private Calendar calendar = new Calendar();

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Mail {
        /** Window of the first sync, as newer_than:{daysBack}d. */
        private int daysBack = 365;

        /** Overlap subtracted from the last successful sync for incremental queries. */
        private int overlapHours = 24;

        /** Filter appended to every mail query. */
        private String baseQuery = "-in:chats -in:drafts";
    }

    @Getter
    @Setter
    @NoArgsConstructor
    public static class Calendar {
        private int daysPast = 180;

        private int daysFuture = 365;

        private String calendarId = "primary";
    }
}
