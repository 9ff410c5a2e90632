package omni.sync.app.repository;

import omni.sync.app.entity.RawEventError;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RawEventErrorRepository extends JpaRepository<RawEventError, String> {
    List<RawEventError> findByUserIdAndBatchId(String userId, String batchId);
}
