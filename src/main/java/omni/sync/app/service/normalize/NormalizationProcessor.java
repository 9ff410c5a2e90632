package omni.sync.app.service.normalize;

import lombok.extern.slf4j.Slf4j;
import omni.sync.app.entity.ErrorStage;
import omni.sync.app.entity.Interaction;
import omni.sync.app.entity.Job;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;
import omni.sync.app.entity.RawEventError;
import omni.sync.app.exception.JobPayloadException;
import omni.sync.app.exception.MalformedPayloadException;
import omni.sync.app.repository.InteractionRepository;
import omni.sync.app.repository.RawEventErrorRepository;
import omni.sync.app.repository.RawEventRepository;
import omni.sync.app.service.job.JobHandler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns one sync batch of raw events into interactions: one existence query for all keys,
 * in-memory dedup, one bulk insert. Running it twice for a batch inserts nothing the second time.
 */
@Slf4j
@Service
public class NormalizationProcessor implements JobHandler {
    private static final int KEY_QUERY_CHUNK = 1000;

    private final RawEventRepository rawEventRepository;
    private final InteractionRepository interactionRepository;
    private final RawEventErrorRepository rawEventErrorRepository;
    private final Map<Provider, InteractionParser> parsers = new EnumMap<>(Provider.class);
    private final Clock clock;

    public NormalizationProcessor(RawEventRepository rawEventRepository,
                                  InteractionRepository interactionRepository,
                                  RawEventErrorRepository rawEventErrorRepository,
                                  List<InteractionParser> parsers,
                                  Clock clock) {
        this.rawEventRepository = rawEventRepository;
        this.interactionRepository = interactionRepository;
        this.rawEventErrorRepository = rawEventErrorRepository;
        this.clock = clock;
        for (InteractionParser parser : parsers) {
            this.parsers.put(parser.provider(), parser);
        }
    }

    @Override
    public NormalizationResult handle(Job job) {
        if (!job.getKind().isNormalization()) {
            throw new IllegalArgumentException("Not a normalization job: " + job.getKind().getWireName());
        }
        if (job.getBatchId() == null || job.getBatchId().isBlank()) {
            throw new JobPayloadException("Normalization job " + job.getId() + " has no batchId");
        }
        return normalize(job.getUserId(), job.getKind().getProvider(), job.getBatchId());
    }

    public NormalizationResult normalize(String userId, Provider provider, String batchId) {
        InteractionParser parser = parsers.get(provider);
        if (parser == null) {
            throw new IllegalStateException("No interaction parser for " + provider);
        }

        List<RawEvent> events = rawEventRepository.findByUserIdAndProviderAndBatchIdOrderByOccurredAtAsc(
                userId, provider, batchId);
        if (events.isEmpty()) {
            log.info("No raw events for user {} provider {} batch {}", userId, provider, batchId);
            return new NormalizationResult(0, 0, 0, 0);
        }

        Set<String> seen = new HashSet<>(findExisting(userId, provider, events));
        List<Interaction> toInsert = new ArrayList<>();
        List<RawEventError> errors = new ArrayList<>();
        int skipped = 0;
        for (RawEvent event : events) {
            if (!seen.add(event.getSourceId())) {
                skipped++;
                continue;
            }
            try {
                toInsert.add(parser.parse(event));
            } catch (MalformedPayloadException e) {
                log.warn("Skipping malformed {} raw event {} ({}): {}",
                        provider, event.getId(), event.getSourceId(), e.getMessage());
                errors.add(normalizationError(event, e.getMessage()));
            }
        }

        int inserted = interactionRepository.insertIgnoringDuplicates(toInsert);
        // Rows lost to a concurrent run already exist, count them as skipped
        skipped += toInsert.size() - inserted;
        if (!errors.isEmpty()) {
            rawEventErrorRepository.saveAll(errors);
        }

        NormalizationResult result = new NormalizationResult(events.size(), inserted, skipped, errors.size());
        log.info("Normalized {} batch {} for user {}: {}", provider, batchId, userId, result.summary());
        return result;
    }

    private Set<String> findExisting(String userId, Provider provider, List<RawEvent> events) {
        List<String> keys = new ArrayList<>(new LinkedHashSet<>(events.stream().map(RawEvent::getSourceId).toList()));
        Set<String> existing = new HashSet<>();
        for (int i = 0; i < keys.size(); i += KEY_QUERY_CHUNK) {
            existing.addAll(interactionRepository.findExistingSourceIds(
                    userId, provider, keys.subList(i, Math.min(i + KEY_QUERY_CHUNK, keys.size()))));
        }
        return existing;
    }

    private RawEventError normalizationError(RawEvent event, String message) {
        RawEventError error = new RawEventError();
        error.setRawEventId(event.getId());
        error.setUserId(event.getUserId());
        error.setProvider(event.getProvider());
        error.setStage(ErrorStage.NORMALIZATION);
        error.setSourceId(event.getSourceId());
        error.setError(message != null && message.length() > 2000 ? message.substring(0, 2000) : message);
        error.setBatchId(event.getBatchId());
        error.setErrorAt(clock.instant());
        return error;
    }
}
