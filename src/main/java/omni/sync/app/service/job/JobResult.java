package omni.sync.app.service.job;

/**
 * Outcome of a successful handler run, logged by the runner.
 */
public interface JobResult {
    String summary();
}
