package org.devfriend.core.persistence.repository.integration;

import org.devfriend.core.model.integration.EIntegrationStatus;
import org.devfriend.core.model.integration.Integration;
import org.devfriend.core.model.secret.EServiceType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface IntegrationRepository extends JpaRepository<Integration, Long> {

    List<Integration> findByUser_IdOrderByCreatedAtDesc(Long userId);

    List<Integration> findByUser_IdAndServiceTypeOrderByCreatedAtDesc(Long userId, EServiceType serviceType);

    Optional<Integration> findFirstByUser_IdAndServiceTypeOrderByCreatedAtAsc(Long userId, EServiceType serviceType);

    Optional<Integration> findByUser_IdAndId(Long userId, Long id);

    List<Integration> findBySecretId(Long secretId);

    List<Integration> findByStatus(EIntegrationStatus status);
}
