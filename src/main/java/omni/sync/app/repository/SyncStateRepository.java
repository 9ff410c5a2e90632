package omni.sync.app.repository;

import omni.sync.app.entity.Provider;
import omni.sync.app.entity.SyncState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SyncStateRepository extends JpaRepository<SyncState, String> {
    Optional<SyncState> findByUserIdAndProvider(String userId, Provider provider);

    List<SyncState> findByUserId(String userId);
}
