package omni.sync.app.repository;

import omni.sync.app.entity.RawEvent;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * JDBC batch insert for raw events; JPA saveAll would issue one statement per row.
 */
public class RawEventRepositoryImpl implements RawEventRepositoryCustom {
    private static final String INSERT_SQL =
            "INSERT INTO raw_events (id, user_id, provider, source_id, payload, occurred_at, batch_id, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public RawEventRepositoryImpl(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    @Transactional
    public int insertAll(List<RawEvent> events) {
        if (events.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        for (RawEvent event : events) {
            if (event.getId() == null) {
                event.setId(UUID.randomUUID().toString());
            }
            if (event.getCreatedAt() == null) {
                event.setCreatedAt(now);
            }
        }
        int[][] counts = jdbcTemplate.batchUpdate(INSERT_SQL, events, events.size(), (ps, event) -> {
            ps.setString(1, event.getId());
            ps.setString(2, event.getUserId());
            ps.setString(3, event.getProvider().name());
            ps.setString(4, event.getSourceId());
            ps.setString(5, event.getPayload());
            ps.setTimestamp(6, event.getOccurredAt() != null ? Timestamp.from(event.getOccurredAt()) : null);
            ps.setString(7, event.getBatchId());
            ps.setTimestamp(8, Timestamp.from(event.getCreatedAt()));
        });
        return BatchCounts.sum(counts);
    }
}
