package omni.sync.app.repository;

import omni.sync.app.entity.Interaction;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

public class InteractionRepositoryImpl implements InteractionRepositoryCustom {
    private static final String INSERT_SQL =
            "INSERT INTO interactions (id, user_id, interaction_type, subject, body_text, participants, "
                    + "occurred_at, source, source_id, batch_id, created_at) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?) "
                    + "ON CONFLICT DO NOTHING";

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    public InteractionRepositoryImpl(JdbcTemplate jdbcTemplate, Clock clock) {
        this.jdbcTemplate = jdbcTemplate;
        this.clock = clock;
    }

    @Override
    @Transactional
    public int insertIgnoringDuplicates(List<Interaction> interactions) {
        if (interactions.isEmpty()) {
            return 0;
        }
        Instant now = clock.instant();
        for (Interaction interaction : interactions) {
            if (interaction.getId() == null) {
                interaction.setId(UUID.randomUUID().toString());
            }
            if (interaction.getCreatedAt() == null) {
                interaction.setCreatedAt(now);
            }
        }
        int[][] counts = jdbcTemplate.batchUpdate(INSERT_SQL, interactions, interactions.size(), (ps, i) -> {
            ps.setString(1, i.getId());
            ps.setString(2, i.getUserId());
            ps.setString(3, i.getType().name());
            ps.setString(4, i.getSubject());
            ps.setString(5, i.getBodyText());
            ps.setString(6, i.getParticipants());
            ps.setTimestamp(7, i.getOccurredAt() != null ? Timestamp.from(i.getOccurredAt()) : null);
            ps.setString(8, i.getSource().name());
            ps.setString(9, i.getSourceId());
            ps.setString(10, i.getBatchId());
            ps.setTimestamp(11, Timestamp.from(i.getCreatedAt()));
        });
        return BatchCounts.sum(counts);
    }
}
