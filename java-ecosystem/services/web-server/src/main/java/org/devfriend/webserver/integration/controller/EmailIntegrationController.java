package org.devfriend.webserver.integration.controller;

import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.google.GoogleConfig;
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
@RequestMapping("/email/integrations")
public class EmailIntegrationController extends AbstractIntegrationController {

    public EmailIntegrationController(IntegrationManager integrationManager, OAuthBroker oAuthBroker) {
        super(integrationManager, oAuthBroker);
    }

    @Override
    protected EServiceType getServiceType() {
        return EServiceType.GMAIL;
    }

    @GetMapping("/{integrationId}/emails")
    public ResponseEntity<ItemPageResponse> listEmails(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId,
            @RequestParam(name = "max_results", required = false) Integer maxResults,
            @RequestParam(name = "page_token", required = false) String pageToken,
            @RequestParam(required = false) String query
    ) {
        ListRequest request = new ListRequest(EListKind.EMAILS, pageToken,
                checkPageSize(maxResults, GoogleConfig.MAX_PAGE_SIZE), query);
        return listItems(userDetails.getId(), integrationId, request);
    }

    @GetMapping("/{integrationId}/stats")
    public ResponseEntity<Map<String, Object>> getStats(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId
    ) {
        return ResponseEntity.ok(
                integrationManager.fetchSummary(userDetails.getId(), getServiceType(), integrationId).counts());
    }
}
