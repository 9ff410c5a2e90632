package omni.sync.app.service.sync;

import omni.sync.app.service.job.JobResult;

/**
 * @param fetched   items taken from list pages (stubs included)
 * @param written   raw events inserted
 * @param malformed items skipped because they were gone or unusable
 */
public record SyncRunResult(String batchId, int pages, int fetched, int written, int malformed,
                            StopReason stopReason) implements JobResult {

    @Override
    public String summary() {
        return String.format("batch=%s pages=%d fetched=%d written=%d malformed=%d stop=%s",
                batchId, pages, fetched, written, malformed, stopReason);
    }
}
