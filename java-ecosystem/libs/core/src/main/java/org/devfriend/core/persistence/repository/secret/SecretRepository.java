package org.devfriend.core.persistence.repository.secret;

import org.devfriend.core.model.secret.ESecretKind;
import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.core.model.secret.Secret;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SecretRepository extends JpaRepository<Secret, Long> {

    List<Secret> findByUser_IdOrderByCreatedAtDesc(Long userId);

    Optional<Secret> findByUser_IdAndId(Long userId, Long id);

    List<Secret> findByUser_IdAndServiceTypeAndKindOrderByCreatedAtAscIdAsc(
            Long userId, EServiceType serviceType, ESecretKind kind
    );
}
