package omni.sync.app.service.sync;

import lombok.extern.slf4j.Slf4j;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.entity.SyncSessionStatus;
import omni.sync.app.repository.SyncSessionRepository;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Sync run history: a session is opened when a sync job starts and closed with its outcome.
 */
@Slf4j
@Service
public class SyncSessionService {
    private static final int MAX_ERROR_LENGTH = 2000;
    private static final int MAX_LIST_SIZE = 100;

    private final SyncSessionRepository sessionRepository;
    private final Clock clock;

    public SyncSessionService(SyncSessionRepository sessionRepository, Clock clock) {
        this.sessionRepository = sessionRepository;
        this.clock = clock;
    }

    @Transactional
    public SyncSession start(String userId, Provider provider, String jobId, String batchId) {
        Instant now = clock.instant();
        SyncSession session = new SyncSession();
        session.setUserId(userId);
        session.setProvider(provider);
        session.setJobId(jobId);
        session.setBatchId(batchId);
        session.setStatus(SyncSessionStatus.RUNNING);
        session.setStartedAt(now);
        session.setUpdatedAt(now);
        return sessionRepository.save(session);
    }

    @Transactional
    public SyncSession recordProgress(SyncSession session, SyncRunResult progress) {
        apply(session, progress);
        return sessionRepository.save(session);
    }

    /**
     * Closes the session: completed when pagination was exhausted, partial otherwise.
     */
    @Transactional
    public SyncSession complete(SyncSession session, SyncRunResult result) {
        apply(session, result);
        session.setStatus(result.stopReason() == StopReason.EXHAUSTED
                ? SyncSessionStatus.COMPLETED
                : SyncSessionStatus.PARTIAL);
        session.setStopReason(result.stopReason());
        session.setCompletedAt(session.getUpdatedAt());
        return sessionRepository.save(session);
    }

    @Transactional
    public SyncSession fail(SyncSession session, SyncRunResult progress, String error) {
        apply(session, progress);
        session.setStatus(SyncSessionStatus.FAILED);
        session.setError(truncate(error));
        session.setCompletedAt(session.getUpdatedAt());
        return sessionRepository.save(session);
    }

    /**
     * Newest first. Provider and status are optional filters.
     */
    @Transactional(readOnly = true)
    public List<SyncSession> list(String userId, Provider provider, SyncSessionStatus status, int limit) {
        PageRequest page = PageRequest.of(0, Math.max(1, Math.min(limit, MAX_LIST_SIZE)));
        if (provider != null && status != null) {
            return sessionRepository.findByUserIdAndProviderAndStatusOrderByStartedAtDesc(userId, provider, status, page);
        }
        if (provider != null) {
            return sessionRepository.findByUserIdAndProviderOrderByStartedAtDesc(userId, provider, page);
        }
        if (status != null) {
            return sessionRepository.findByUserIdAndStatusOrderByStartedAtDesc(userId, status, page);
        }
        return sessionRepository.findByUserIdOrderByStartedAtDesc(userId, page);
    }

    @Transactional(readOnly = true)
    public Optional<SyncSession> findForUser(String id, String userId) {
        return sessionRepository.findByIdAndUserId(id, userId);
    }

    /**
     * Fails running sessions that stopped reporting progress, their runner having died.
     */
    public int failAbandoned(Duration staleAfter) {
        Instant now = clock.instant();
        int failed = sessionRepository.failAbandoned(now.minus(staleAfter),
                "No progress for more than " + staleAfter.toMinutes() + " minutes", now);
        if (failed > 0) {
            log.warn("Marked {} abandoned sync sessions as failed", failed);
        }
        return failed;
    }

    private void apply(SyncSession session, SyncRunResult progress) {
        session.setPages(progress.pages());
        session.setItemsFetched(progress.fetched());
        session.setItemsWritten(progress.written());
        session.setItemsMalformed(progress.malformed());
        session.setUpdatedAt(clock.instant());
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
