package omni.sync.app.repository;

import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncSession;
import omni.sync.app.entity.SyncSessionStatus;
import omni.sync.app.support.FixedClockConfig;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import(FixedClockConfig.class)
class SyncSessionRepositoryTest {
    private static final Instant NOW = FixedClockConfig.NOW;

    @Autowired
    private SyncSessionRepository sessionRepository;

    private SyncSession save(String userId, Provider provider, SyncSessionStatus status, Instant startedAt) {
        SyncSession session = new SyncSession();
        session.setUserId(userId);
        session.setProvider(provider);
        session.setJobId(UUID.randomUUID().toString());
        session.setBatchId(UUID.randomUUID().toString());
        session.setStatus(status);
        session.setStartedAt(startedAt);
        session.setUpdatedAt(startedAt);
        return sessionRepository.saveAndFlush(session);
    }

    @Test
    void failAbandoned_ShouldOnlyFailRunningSessionsWithoutRecentProgress() {
        SyncSession stale = save("user-a", Provider.MAIL, SyncSessionStatus.RUNNING, NOW.minusSeconds(3600));
        SyncSession fresh = save("user-a", Provider.MAIL, SyncSessionStatus.RUNNING, NOW.minusSeconds(60));
        SyncSession done = save("user-a", Provider.CALENDAR, SyncSessionStatus.COMPLETED, NOW.minusSeconds(3600));

        int failed = sessionRepository.failAbandoned(NOW.minusSeconds(900), "abandoned", NOW);

        assertEquals(1, failed);
        SyncSession reloaded = sessionRepository.findById(stale.getId()).orElseThrow();
        assertEquals(SyncSessionStatus.FAILED, reloaded.getStatus());
        assertEquals("abandoned", reloaded.getError());
        assertEquals(NOW, reloaded.getCompletedAt());
        assertEquals(SyncSessionStatus.RUNNING, sessionRepository.findById(fresh.getId()).orElseThrow().getStatus());
        assertEquals(SyncSessionStatus.COMPLETED, sessionRepository.findById(done.getId()).orElseThrow().getStatus());
    }

    @Test
    void listQueries_ShouldReturnNewestFirstForTheUserOnly() {
        save("user-a", Provider.MAIL, SyncSessionStatus.COMPLETED, NOW.minusSeconds(300));
        SyncSession newest = save("user-a", Provider.MAIL, SyncSessionStatus.PARTIAL, NOW.minusSeconds(60));
        save("user-a", Provider.CALENDAR, SyncSessionStatus.FAILED, NOW.minusSeconds(120));
        save("user-b", Provider.MAIL, SyncSessionStatus.COMPLETED, NOW);

        List<SyncSession> all = sessionRepository.findByUserIdOrderByStartedAtDesc("user-a", PageRequest.of(0, 10));
        List<SyncSession> mail = sessionRepository.findByUserIdAndProviderOrderByStartedAtDesc(
                "user-a", Provider.MAIL, PageRequest.of(0, 1));
        List<SyncSession> failedMail = sessionRepository.findByUserIdAndProviderAndStatusOrderByStartedAtDesc(
                "user-a", Provider.MAIL, SyncSessionStatus.FAILED, PageRequest.of(0, 10));

        assertEquals(3, all.size());
        assertEquals(newest.getId(), all.get(0).getId());
        assertEquals(List.of(newest.getId()), mail.stream().map(SyncSession::getId).toList());
        assertTrue(failedMail.isEmpty());
        assertEquals(newest.getId(), sessionRepository
                .findFirstByUserIdAndProviderOrderByStartedAtDesc("user-a", Provider.MAIL).orElseThrow().getId());
        assertTrue(sessionRepository.findByIdAndUserId(newest.getId(), "user-b").isEmpty());
    }
}
