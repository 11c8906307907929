package org.devfriend.webserver.integration.controller;

import org.devfriend.core.model.secret.EServiceType;
import org.devfriend.providerclient.model.EListKind;
import org.devfriend.providerclient.model.ListRequest;
import org.devfriend.providerclient.slack.SlackConfig;
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

@RestController
@RequestMapping("/messages/integrations")
public class MessagesIntegrationController extends AbstractIntegrationController {

    public MessagesIntegrationController(IntegrationManager integrationManager, OAuthBroker oAuthBroker) {
        super(integrationManager, oAuthBroker);
    }

    @Override
    protected EServiceType getServiceType() {
        return EServiceType.SLACK;
    }

    @GetMapping("/{integrationId}/messages")
    public ResponseEntity<ItemPageResponse> listMessages(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId,
            @RequestParam(name = "channel_id", required = false) String channelId,
            @RequestParam(name = "max_results", defaultValue = "" + SlackConfig.DEFAULT_PAGE_SIZE) Integer maxResults,
            @RequestParam(required = false) String cursor
    ) {
        ListRequest request = new ListRequest(EListKind.MESSAGES, cursor,
                checkPageSize(maxResults, SlackConfig.MAX_PAGE_SIZE), channelId);
        return listItems(userDetails.getId(), integrationId, request);
    }

    @GetMapping("/{integrationId}/channels")
    public ResponseEntity<ItemPageResponse> listChannels(
            @AuthenticationPrincipal UserDetailsImpl userDetails,
            @PathVariable Long integrationId,
            @RequestParam(required = false) String cursor
    ) {
        return listItems(userDetails.getId(), integrationId, new ListRequest(EListKind.CHANNELS, cursor, null, null));
    }
}
