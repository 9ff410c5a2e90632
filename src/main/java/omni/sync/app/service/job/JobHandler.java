package omni.sync.app.service.job;

import omni.sync.app.entity.Job;

public interface JobHandler {
    /**
     * Runs the job. Throwing marks the attempt failed; see {@link JobRunner} for retry rules.
     */
    JobResult handle(Job job);
}
