package org.devfriend.webserver.integration.controller;

import org.devfriend.core.dto.integration.IntegrationDTO;
import org.devfriend.security.service.UserDetailsImpl;
import org.devfriend.webserver.integration.service.IntegrationManager;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Provider independent read access to the caller's integrations.
 */
@RestController
@RequestMapping("/integrations")
public class IntegrationController {
    private final IntegrationManager integrationManager;

    public IntegrationController(IntegrationManager integrationManager) {
        this.integrationManager = integrationManager;
    }

    @GetMapping
    public ResponseEntity<List<IntegrationDTO>> listIntegrations(@AuthenticationPrincipal UserDetailsImpl userDetails) {
        return ResponseEntity.ok(integrationManager.listIntegrations(userDetails.getId()).stream()
                .map(IntegrationDTO::fromIntegration)
                .toList());
    }

    @GetMapping("/{integrationId}")
    public ResponseEntity<IntegrationDTO> getIntegration(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId
    ) {
        return ResponseEntity.ok(IntegrationDTO.fromIntegration(
                integrationManager.getIntegration(userDetails.getId(), integrationId)));
    }
}
