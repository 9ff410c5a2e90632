package omni.sync.app.repository;

import omni.sync.app.entity.IntegrationCredential;
import omni.sync.app.entity.Provider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IntegrationCredentialRepository extends JpaRepository<IntegrationCredential, String> {
    Optional<IntegrationCredential> findByUserIdAndProvider(String userId, Provider provider);

    List<IntegrationCredential> findByUserId(String userId);
}
