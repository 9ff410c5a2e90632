package omni.sync.app.service.sync;

import omni.sync.app.entity.CredentialStatus;
import omni.sync.app.entity.IntegrationCredential;
import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.entity.SyncState;
import omni.sync.app.repository.IntegrationCredentialRepository;
import omni.sync.app.repository.SyncSessionRepository;
import omni.sync.app.repository.SyncStateRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Service
public class SyncStateService {
    private static final int MAX_ERROR_LENGTH = 2000;

    private final SyncStateRepository syncStateRepository;
    private final IntegrationCredentialRepository credentialRepository;
    private final SyncSessionRepository sessionRepository;
    private final Clock clock;

    public SyncStateService(SyncStateRepository syncStateRepository,
                            IntegrationCredentialRepository credentialRepository,
                            SyncSessionRepository sessionRepository,
                            Clock clock) {
        this.syncStateRepository = syncStateRepository;
        this.credentialRepository = credentialRepository;
        this.sessionRepository = sessionRepository;
        this.clock = clock;
    }

    public Optional<SyncState> find(String userId, Provider provider) {
        return syncStateRepository.findByUserIdAndProvider(userId, provider);
    }

    /**
     * Records the end of a run. A run that exhausted pagination becomes the new incremental
     * boundary; a run cut short by cap or deadline keeps its page token for the next run.
     */
    @Transactional
    public SyncState recordRun(String userId, Provider provider, Instant startedAt, boolean exhausted, String nextPageToken) {
        SyncState state = getOrCreate(userId, provider);
        if (exhausted) {
            state.setLastSuccessfulSyncAt(startedAt);
            state.setResumePageToken(null);
        } else {
            state.setResumePageToken(nextPageToken);
        }
        state.setLastRunAt(clock.instant());
        state.setLastError(null);
        return syncStateRepository.save(state);
    }

    @Transactional
    public void recordError(String userId, Provider provider, String error) {
        SyncState state = getOrCreate(userId, provider);
        state.setLastRunAt(clock.instant());
        state.setLastError(truncate(error));
        syncStateRepository.save(state);
    }

    @Transactional
    public void clearError(String userId, Provider provider) {
        syncStateRepository.findByUserIdAndProvider(userId, provider).ifPresent(state -> {
            state.setLastError(null);
            syncStateRepository.save(state);
        });
    }

    @Transactional(readOnly = true)
    public List<SyncStatusView> statusFor(String userId) {
        List<SyncStatusView> views = new ArrayList<>();
        for (Provider provider : Provider.values()) {
            Optional<IntegrationCredential> credential = credentialRepository.findByUserIdAndProvider(userId, provider);
            Optional<SyncState> state = syncStateRepository.findByUserIdAndProvider(userId, provider);
            Optional<SyncSession> lastSession = sessionRepository.findFirstByUserIdAndProviderOrderByStartedAtDesc(userId, provider);
            CredentialStatus status = credential.map(IntegrationCredential::getStatus).orElse(null);
            views.add(new SyncStatusView(
                    provider,
                    credential.isPresent(),
                    status,
                    state.map(SyncState::getLastSuccessfulSyncAt).orElse(null),
                    state.map(SyncState::getLastRunAt).orElse(null),
                    state.map(SyncState::getLastError).orElse(null),
                    lastSession.map(SyncSession::getStatus).orElse(null),
                    status == CredentialStatus.INVALID));
        }
        return views;
    }

    private SyncState getOrCreate(String userId, Provider provider) {
        return syncStateRepository.findByUserIdAndProvider(userId, provider).orElseGet(() -> {
            SyncState state = new SyncState();
            state.setUserId(userId);
            state.setProvider(provider);
            return state;
        });
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH);
    }
}
