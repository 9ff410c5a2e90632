package omni.sync.app.repository;

import omni.sync.app.entity.Provider;
import omni.sync.app.entity.RawEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RawEventRepository extends JpaRepository<RawEvent, String>, RawEventRepositoryCustom {
    List<RawEvent> findByUserIdAndProviderAndBatchIdOrderByOccurredAtAsc(String userId, Provider provider, String batchId);

    long countByUserIdAndProvider(String userId, Provider provider);
}
