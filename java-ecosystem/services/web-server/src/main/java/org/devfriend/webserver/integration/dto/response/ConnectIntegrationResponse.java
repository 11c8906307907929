package org.devfriend.webserver.integration.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.devfriend.core.dto.integration.IntegrationDTO;

public record ConnectIntegrationResponse(
        @JsonProperty("integration") IntegrationDTO integration,
        @JsonProperty("auth_url") String authUrl
) {
}
