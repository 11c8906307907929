package org.devfriend.webserver.integration.controller;

import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.github.GitHubConfig;
import org.devfriend.providerclient.model.EListKind;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.security.service.UserDetailsImpl;
import org.devfriend.webserver.integration.dto.response.ItemPageResponse;
import org.devfriend.webserver.integration.service.IntegrationManager;
import org.devfriend.webserver.oauth.service.OAuthBroker;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/github/integrations")
public class GitHubIntegrationController extends AbstractIntegrationController {

    public GitHubIntegrationController(IntegrationManager integrationManager, OAuthBroker oAuthBroker) {
        super(integrationManager, oAuthBroker);
    }

    @Override
    protected EServiceType getServiceType() {
        return EServiceType.GITHUB;
    }

    @GetMapping("/{integrationId}/repos")
    public ResponseEntity<ItemPageResponse> listRepositories(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId,
            @RequestParam(name = "per_page", required = false) Integer perPage,
            @RequestParam(required = false) String page
    ) {
        ListRequest request = new ListRequest(EListKind.REPOS, page,
                checkPageSize(perPage, GitHubConfig.MAX_PAGE_SIZE), null);
        return listItems(userDetails.getId(), integrationId, request);
    }

    @GetMapping("/{integrationId}/user")
    public ResponseEntity<Map<String, Object>> getUser(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId
    ) {
        return ResponseEntity.ok(
                integrationManager.fetchIdentity(userDetails.getId(), getServiceType(), integrationId).toConfig());
    }
}
