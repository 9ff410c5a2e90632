package omni.sync.app.service.normalize;

import omni.sync.app.service.job.JobResult;

/**
 * @param total     raw events in the batch
 * @param inserted  interactions created
 * @param skipped   raw events whose interaction already existed or repeated within the batch
 * @param malformed raw events that could not be parsed
 */
public record NormalizationResult(int total, int inserted, int skipped, int malformed) implements JobResult {

    @Override
    public String summary() {
        return String.format("total=%d inserted=%d skipped=%d malformed=%d", total, inserted, skipped, malformed);
    }
}
