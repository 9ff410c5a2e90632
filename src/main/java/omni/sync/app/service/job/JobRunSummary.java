package omni.sync.app.service.job;

/**
 * Counts of one poll cycle. {@code processed} is the number of jobs this runner claimed;
 * {@code skipped} counts jobs another runner claimed first.
 */
public record JobRunSummary(int processed, int done, int error, int retried, int skipped) {

    public static JobRunSummary empty() {
        return new JobRunSummary(0, 0, 0, 0, 0);
    }
}
