package omni.sync.app.service.job;

import omni.sync.app.entity.Job;
import omni.sync.app.service.normalize.NormalizationProcessor;
import omni.sync.app.service.sync.CalendarSyncProcessor;
import omni.sync.app.service.sync.MailSyncProcessor;
import org.springframework.stereotype.Component;

/**
 * Routes a job to its handler. The switch has no default branch, so a new {@code JobKind}
 * does not compile until it is routed here.
 */
@Component
public class JobDispatcher {
    private final MailSyncProcessor mailSyncProcessor;
    private final CalendarSyncProcessor calendarSyncProcessor;
    private final NormalizationProcessor normalizationProcessor;

    public JobDispatcher(MailSyncProcessor mailSyncProcessor,
                         CalendarSyncProcessor calendarSyncProcessor,
                         NormalizationProcessor normalizationProcessor) {
        this.mailSyncProcessor = mailSyncProcessor;
        this.calendarSyncProcessor = calendarSyncProcessor;
        this.normalizationProcessor = normalizationProcessor;
    }

    public JobResult dispatch(Job job) {
        JobHandler handler = switch (job.getKind()) {
            case MAIL_SYNC -> mailSyncProcessor;
            case CALENDAR_SYNC -> calendarSyncProcessor;
            case NORMALIZE_MAIL, NORMALIZE_CALENDAR -> normalizationProcessor;
        };
        return handler.handle(job);
    }
}
