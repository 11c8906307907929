package org.devfriend.webserver.secret.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;

import java.util.Map;

/**
 * Partial update; {@code null} fields are left unchanged.
 */
public class UpdateSecretRequest {
    @Size(min = 1, max = 150, message = "Secret name must be between 1 and 150 characters")
    private String name;

    @JsonProperty("service_type")
    private String serviceType;

    @JsonProperty("datos_secrets")
    private Map<String, Object> values;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getServiceType() {
        return serviceType;
    }

    public void setServiceType(String serviceType) {
        this.serviceType = serviceType;
    }

    public Map<String, Object> getValues() {
        return values;
    }

    public void setValues(Map<String, Object> values) {
        this.values = values;
    }
}
