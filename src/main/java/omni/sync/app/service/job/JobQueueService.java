package omni.sync.app.service.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import omni.sync.app.entity.Job;
import omni.sync.app.entity.JobKind;
import omni.sync.app.entity.JobStatus;
import omni.sync.app.exception.JobPayloadException;
import omni.sync.app.repository.JobRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for new work. Validates kind and payload, then writes a queued row.
 */
@Slf4j
@Service
public class JobQueueService {
    static final int MAX_PAYLOAD_BYTES = 64 * 1024;

    private final JobRepository jobRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JobQueueService(JobRepository jobRepository, ObjectMapper objectMapper, Clock clock) {
        this.jobRepository = jobRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * @throws IllegalArgumentException if {@code kind} is not a known job kind
     */
    public Job enqueue(String userId, String kind, JsonNode payload, String batchId) {
        JobKind jobKind = JobKind.fromWireName(kind)
                .orElseThrow(() -> new IllegalArgumentException("Unknown job kind: " + kind));
        return enqueue(userId, jobKind, payload, batchId);
    }

    @Transactional
    public Job enqueue(String userId, JobKind kind, JsonNode payload, String batchId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        String resolvedBatchId = resolveBatchId(kind, batchId);
        String payloadJson = serializePayload(payload, resolvedBatchId);

        Instant now = clock.instant();
        Job job = new Job();
        job.setUserId(userId);
        job.setKind(kind);
        job.setPayload(payloadJson);
        job.setStatus(JobStatus.QUEUED);
        job.setAttempts(0);
        job.setBatchId(resolvedBatchId);
        job.setRunAfter(now);
        job.setCreatedAt(now);
        job.setUpdatedAt(now);
        Job saved = jobRepository.save(job);
        log.info("Enqueued {} job {} for user {} (batch {})", kind.getWireName(), saved.getId(), userId, resolvedBatchId);
        return saved;
    }

    public Optional<Job> findForUser(String jobId, String userId) {
        return jobRepository.findByIdAndUserId(jobId, userId);
    }

    public JobStats stats(String userId) {
        List<JobRepository.StatusCount> rows = userId != null
                ? jobRepository.countByStatusForUser(userId)
                : jobRepository.countByStatus();
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        long total = 0;
        for (JobRepository.StatusCount row : rows) {
            counts.put(row.getStatus(), row.getTotal());
            total += row.getTotal();
        }
        return new JobStats(counts, total);
    }

    private String resolveBatchId(JobKind kind, String batchId) {
        if (batchId != null && !batchId.isBlank()) {
            return validateBatchId(batchId);
        }
        if (kind.isNormalization()) {
            throw new JobPayloadException(kind.getWireName() + " requires a batchId");
        }
        return UUID.randomUUID().toString();
    }

    private static String validateBatchId(String batchId) {
        try {
            return UUID.fromString(batchId.trim()).toString();
        } catch (IllegalArgumentException e) {
            throw new JobPayloadException("batchId must be a UUID: " + batchId);
        }
    }

    private String serializePayload(JsonNode payload, String batchId) {
        ObjectNode body;
        if (payload == null || payload.isNull()) {
            body = objectMapper.createObjectNode();
        } else if (payload.isObject()) {
            body = ((ObjectNode) payload).deepCopy();
        } else {
            throw new JobPayloadException("Job payload must be a JSON object");
        }
        body.put("batchId", batchId);

        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new JobPayloadException("Job payload is not serializable", e);
        }
        if (json.getBytes(StandardCharsets.UTF_8).length > MAX_PAYLOAD_BYTES) {
            throw new JobPayloadException("Job payload exceeds " + MAX_PAYLOAD_BYTES + " bytes");
        }
        return json;
    }
}
