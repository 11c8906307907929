package org.devfriend.core.dto.integration;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.devfriend.core.model.integration.Integration;

import java.time.LocalDateTime;
import java.util.Map;

public record IntegrationDTO(
        @JsonProperty("id") Long id,
        @JsonProperty("service_type") String serviceType,
        @JsonProperty("status") String status,
        @JsonProperty("secret_id") Long secretId,
        @JsonProperty("config") Map<String, Object> config,
        @JsonProperty("created_at") LocalDateTime createdAt,
        @JsonProperty("updated_at") LocalDateTime updatedAt
) {
    public static IntegrationDTO fromIntegration(Integration integration) {
        return new IntegrationDTO(
                integration.getId(),
                integration.getServiceType().getId(),
                integration.getStatus().name().toLowerCase(),
                integration.getSecretId(),
                integration.getConfig() == null ? Map.of() : integration.getConfig(),
                integration.getCreatedAt(),
                integration.getUpdatedAt()
        );
    }
}
