package omni.sync.app.repository;

import omni.sync.app.entity.Interaction;
import omni.sync.app.entity.Provider;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Set;

@Repository
public interface InteractionRepository extends JpaRepository<Interaction, String>, InteractionRepositoryCustom {

    // Single existence check for a whole batch
    @Query("SELECT i.sourceId FROM Interaction i WHERE i.userId = :userId AND i.source = :source AND i.sourceId IN :sourceIds")
    Set<String> findExistingSourceIds(@Param("userId") String userId,
                                      @Param("source") Provider source,
                                      @Param("sourceIds") Collection<String> sourceIds);

    Page<Interaction> findByUserIdOrderByOccurredAtDesc(String userId, Pageable pageable);

    long countByUserIdAndSource(String userId, Provider source);
}
