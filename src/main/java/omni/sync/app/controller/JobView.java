package omni.sync.app.controller;

import omni.sync.app.entity.Job;
import omni.sync.app.entity.JobKind;
import omni.sync.app.entity.JobStatus;

import java.time.Instant;

public record JobView(String id, JobKind kind, JobStatus status, int attempts, String batchId,
                      String lastError, Instant runAfter, Instant createdAt, Instant updatedAt) {

    public static JobView from(Job job) {
        return new JobView(job.getId(), job.getKind(), job.getStatus(), job.getAttempts(), job.getBatchId(),
                job.getLastError(), job.getRunAfter(), job.getCreatedAt(), job.getUpdatedAt());
    }
}
