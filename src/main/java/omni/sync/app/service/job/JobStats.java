package omni.sync.app.service.job;

import omni.sync.app.entity.JobStatus;

import java.util.Map;

public record JobStats(Map<JobStatus, Long> counts, long total) {
}
