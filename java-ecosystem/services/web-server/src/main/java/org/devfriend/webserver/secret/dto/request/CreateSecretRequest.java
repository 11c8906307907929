package org.devfriend.webserver.secret.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

import java.util.Map;

public class CreateSecretRequest {
    @NotBlank(message = "Secret name is required")
    @Size(max = 150, message = "Secret name must be at most 150 characters")
    private String name;

    @NotBlank(message = "Service type is required")
    @JsonProperty("service_type")
    private String serviceType;

    @NotEmpty(message = "Secret values are required")
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
