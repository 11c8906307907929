package org.devfriend.webserver.secret.controller;

import jakarta.validation.Valid;
import org.devfriend.core.dto.secret.SecretDTO;
import org.devfriend.security.service.UserDetailsImpl;
import org.devfriend.webserver.generic.dto.message.MessageResponse;
import org.devfriend.webserver.secret.dto.request.CreateSecretRequest;
import org.devfriend.webserver.secret.dto.request.UpdateSecretRequest;
import org.devfriend.webserver.secret.service.SecretService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/secrets")
public class SecretController {
    private final SecretService secretService;

    public SecretController(SecretService secretService) {
        this.secretService = secretService;
    }

    @GetMapping
    public ResponseEntity<List<SecretDTO>> listSecrets(@AuthenticationPrincipal UserDetailsImpl userDetails) {
        return ResponseEntity.ok(secretService.listSecrets(userDetails.getId()));
    }

    @GetMapping("/get-decryptable")
    public ResponseEntity<List<SecretDTO>> listDecryptableSecrets(@AuthenticationPrincipal UserDetailsImpl userDetails) {
        return ResponseEntity.ok(secretService.listDecryptableSecrets(userDetails.getId()));
    }

    @GetMapping("/{secretId}")
    public ResponseEntity<SecretDTO> getSecret(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long secretId
    ) {
        return ResponseEntity.ok(secretService.getSecret(userDetails.getId(), secretId));
    }

    @PostMapping
    public ResponseEntity<SecretDTO> createSecret(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @Valid @RequestBody CreateSecretRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(secretService.createSecret(userDetails.getId(), request));
    }

    @PutMapping("/{secretId}")
    public ResponseEntity<SecretDTO> updateSecret(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long secretId,
            @Valid @RequestBody UpdateSecretRequest request
    ) {
        return ResponseEntity.ok(secretService.updateSecret(userDetails.getId(), secretId, request));
    }

    @DeleteMapping("/{secretId}")
    public ResponseEntity<MessageResponse> deleteSecret(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long secretId
    ) {
        secretService.deleteSecret(userDetails.getId(), secretId);
        return ResponseEntity.ok(new MessageResponse("Secret deleted successfully"));
    }
}
