package org.devfriend.webserver.integration.controller;

import org.devfriend.core.dto.integration.IntegrationDTO;
import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.core.model.integration.Integration;
import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.security.service.UserDetailsImpl;
import org.devfriend.webserver.generic.dto.message.MessageResponse;
import org.devfriend.webserver.integration.dto.response.ConnectIntegrationResponse;
import org.devfriend.webserver.integration.dto.response.ItemPageResponse;
import org.devfriend.webserver.integration.service.IntegrationManager;
import org.devfriend.webserver.oauth.service.OAuthBroker;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;

import java.util.List;

/**
 * Integration CRUD, connect and sync endpoints shared by the per-provider controllers.
 * Subclasses bind a base path and a service type, and add their provider specific listings.
 */
public abstract class AbstractIntegrationController {

    protected final IntegrationManager integrationManager;
    protected final OAuthBroker oAuthBroker;

    protected AbstractIntegrationController(IntegrationManager integrationManager, OAuthBroker oAuthBroker) {
        this.integrationManager = integrationManager;
        this.oAuthBroker = oAuthBroker;
    }

    protected abstract EServiceType getServiceType();

    @GetMapping
    public ResponseEntity<List<IntegrationDTO>> listIntegrations(@AuthenticationPrincipal UserDetailsImpl userDetails) {
        List<IntegrationDTO> integrations = integrationManager.listIntegrations(userDetails.getId(), getServiceType())
                .stream()
                .map(IntegrationDTO::fromIntegration)
                .toList();
        return ResponseEntity.ok(integrations);
    }

    /**
     * Starts a connection: the authorize URL is built first, so a missing OAuth configuration
     * leaves no integration row behind.
     */
    @PostMapping
    public ResponseEntity<ConnectIntegrationResponse> createIntegration(@AuthenticationPrincipal UserDetailsImpl userDetails) {
        Long userId = userDetails.getId();
        String authUrl = oAuthBroker.buildAuthorizeUrl(userId, EOAuthProvider.forServiceType(getServiceType()));
        Integration integration = integrationManager.createPending(userId, getServiceType());
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(new ConnectIntegrationResponse(IntegrationDTO.fromIntegration(integration), authUrl));
    }

    @GetMapping("/{integrationId}")
    public ResponseEntity<IntegrationDTO> getIntegration(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId
    ) {
        Integration integration = integrationManager.getIntegration(userDetails.getId(), getServiceType(), integrationId);
        return ResponseEntity.ok(IntegrationDTO.fromIntegration(integration));
    }

    @DeleteMapping("/{integrationId}")
    public ResponseEntity<MessageResponse> deleteIntegration(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId
    ) {
        integrationManager.delete(userDetails.getId(), getServiceType(), integrationId);
        return ResponseEntity.ok(new MessageResponse("Integration deleted successfully"));
    }

    @PostMapping("/{integrationId}/sync")
    public ResponseEntity<IntegrationDTO> syncIntegration(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId
    ) {
        Integration integration = integrationManager.sync(userDetails.getId(), getServiceType(), integrationId);
        return ResponseEntity.ok(IntegrationDTO.fromIntegration(integration));
    }

    protected ResponseEntity<ItemPageResponse> listItems(Long userId, Long integrationId, ListRequest request) {
        return ResponseEntity.ok(ItemPageResponse.fromPage(
                integrationManager.fetchList(userId, getServiceType(), integrationId, request)));
    }

    protected static Integer checkPageSize(Integer pageSize, int max) {
        if (pageSize != null && (pageSize < 1 || pageSize > max)) {
            throw new IllegalArgumentException("max_results must be between 1 and " + max);
        }
        return pageSize;
    }
}
