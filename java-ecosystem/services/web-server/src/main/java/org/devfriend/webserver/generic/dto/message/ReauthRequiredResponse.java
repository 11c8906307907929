package org.devfriend.webserver.generic.dto.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.devfriend.webserver.exception.ReauthRequiredException;
import org.springframework.http.HttpStatus;

/**
 * Error body that lets the frontend offer a reconnect action instead of a generic failure.
 */
public class ReauthRequiredResponse extends ErrorMessageResponse {
    private final Long integrationId;
    private final String provider;
    private final String reconnectUrl;

    public ReauthRequiredResponse(ReauthRequiredException ex) {
        super(ex.getMessage(), HttpStatus.CONFLICT);
        this.integrationId = ex.getIntegrationId();
        this.provider = ex.getProvider().getId();
        this.reconnectUrl = ex.getReconnectUrl();
    }

    @JsonProperty("reauth_required")
    public boolean isReauthRequired() {
        return true;
    }

    @JsonProperty("integration_id")
    public Long getIntegrationId() {
        return integrationId;
    }

    @JsonProperty("provider")
    public String getProvider() {
        return provider;
    }

    @JsonProperty("reconnect_url")
    public String getReconnectUrl() {
        return reconnectUrl;
    }
}
