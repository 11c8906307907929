package org.devfriend.webserver.integration.service;

import org.devfriend.core.model.integration.Integration;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.webserver.exception.ReauthRequiredException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Refreshes access tokens shortly before they expire, so user requests rarely pay for a refresh.
 * Goes through the same locked path as request-time refreshes.
 */
@Service
public class IntegrationTokenRefreshScheduler {

    private static final Logger log = LoggerFactory.getLogger(IntegrationTokenRefreshScheduler.class);

    private final IntegrationManager integrationManager;

    @Value("${devfriend.integration.token-refresh.window-minutes:10}")
    private long refreshWindowMinutes = 10;

    public IntegrationTokenRefreshScheduler(IntegrationManager integrationManager) {
        this.integrationManager = integrationManager;
    }

    @Scheduled(cron = "${devfriend.integration.token-refresh.cron:0 */30 * * * *}")
    public void refreshExpiringTokens() {
        List<Integration> candidates = integrationManager.findRefreshCandidates();
        log.info("Starting scheduled token refresh check for {} integrations", candidates.size());

        Duration window = Duration.ofMinutes(refreshWindowMinutes);
        int checked = 0;
        int needsReauth = 0;
        int failed = 0;

        for (Integration integration : candidates) {
            try {
                integrationManager.refreshIfExpiring(integration, window);
                checked++;
            } catch (ReauthRequiredException e) {
                needsReauth++;
                log.warn("Integration {} needs re-authentication: {}", integration.getId(), e.getMessage());
            } catch (ProviderUnavailableException e) {
                failed++;
                log.warn("Token refresh for integration {} will be retried on the next run: {}",
                        integration.getId(), e.getMessage());
            } catch (RuntimeException e) {
                failed++;
                log.error("Failed to refresh token for integration {}: {}", integration.getId(), e.getMessage());
            }
        }

        log.info("Token refresh complete: {} ok, {} need re-authentication, {} failed", checked, needsReauth, failed);
    }
}
