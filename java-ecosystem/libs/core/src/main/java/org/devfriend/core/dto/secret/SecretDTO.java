package org.devfriend.core.dto.secret;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.devfriend.core.model.secret.Secret;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Public view of a secret. Carries the names of the stored fields but never their values.
 *
 * @param fields field names of the decrypted bundle, or {@code null} when it could not be decrypted
 */
public record SecretDTO(
        @JsonProperty("id") Long id,
        @JsonProperty("name") String name,
        @JsonProperty("service_type") String serviceType,
        @JsonProperty("kind") String kind,
        @JsonProperty("fields") List<String> fields,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {
    public static SecretDTO fromSecret(Secret secret, List<String> fields) {
        return new SecretDTO(
                secret.getId(),
                secret.getName(),
                secret.getServiceType().getId(),
                secret.getKind().name().toLowerCase(),
                fields,
                secret.getCreatedAt(),
                secret.getUpdatedAt()
        );
    }
}
