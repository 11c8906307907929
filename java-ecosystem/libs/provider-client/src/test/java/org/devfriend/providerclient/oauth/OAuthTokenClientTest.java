package org.devfriend.providerclient.oauth;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import okhttp3.OkHttpClient;
import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.providerclient.HttpClientFactory;
import org.devfriend.providerclient.ProviderClientException;
import org.devfriend.providerclient.ProviderUnavailableException;
import org.devfriend.providerclient.github.GitHubOAuthDescriptor;
import org.devfriend.providerclient.google.GoogleOAuthDescriptor;
import org.devfriend.providerclient.slack.SlackOAuthDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.TimeUnit;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("OAuthTokenClient")
class OAuthTokenClientTest {

    private WireMockServer server;
    private OAuthTokenClient tokenClient;
    private GoogleOAuthDescriptor google;
    private GitHubOAuthDescriptor github;
    private SlackOAuthDescriptor slack;

    @BeforeEach
    void setUp() {
        server = new WireMockServer(WireMockConfiguration.options().dynamicPort());
        server.start();

        OkHttpClient client = new OkHttpClient.Builder()
                .connectTimeout(1, TimeUnit.SECONDS)
                .readTimeout(1, TimeUnit.SECONDS)
                .callTimeout(1, TimeUnit.SECONDS)
                .build();
        tokenClient = new OAuthTokenClient(new HttpClientFactory(client));

        google = new GoogleOAuthDescriptor("https://accounts.example/auth", server.baseUrl() + "/google/token");
        github = new GitHubOAuthDescriptor("https://github.example/authorize", server.baseUrl() + "/github/token");
        slack = new SlackOAuthDescriptor("https://slack.example/authorize", server.baseUrl() + "/slack/token");
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    private static OAuthConfig config(EOAuthProvider provider) {
        return new OAuthConfig(provider, "client-id", "client-secret", "http://localhost:8888/auth/" + provider.getId() + "/callback", null);
    }

    private void stubJson(String path, int status, String body) {
        server.stubFor(post(urlPathEqualTo(path))
                .willReturn(aResponse()
                        .withStatus(status)
                        .withHeader("Content-Type", "application/json")
                        .withBody(body)));
    }

    @Nested
    @DisplayName("exchangeCode()")
    class ExchangeCodeTests {

        @Test
        @DisplayName("should post the authorization code and parse Google tokens")
        void shouldExchangeGoogleCode() {
            stubJson("/google/token", 200, """
                    {"access_token":"ya29.access","refresh_token":"1//refresh","expires_in":3599,
                     "scope":"https://www.googleapis.com/auth/gmail.readonly","token_type":"Bearer"}
                    """);

            OAuthTokens tokens = tokenClient.exchangeCode(google, config(EOAuthProvider.GOOGLE), "auth-code");

            assertThat(tokens.accessToken()).isEqualTo("ya29.access");
            assertThat(tokens.refreshToken()).isEqualTo("1//refresh");
            assertThat(tokens.expiresAt()).isBetween(Instant.now().plusSeconds(3500), Instant.now().plusSeconds(3600));
            server.verify(postRequestedFor(urlPathEqualTo("/google/token"))
                    .withHeader("Accept", equalTo("application/json"))
                    .withRequestBody(containing("grant_type=authorization_code"))
                    .withRequestBody(containing("code=auth-code"))
                    .withRequestBody(containing("client_id=client-id")));
        }

        @Test
        @DisplayName("should classify Google invalid_grant as InvalidGrantException")
        void shouldClassifyGoogleInvalidGrant() {
            stubJson("/google/token", 400, """
                    {"error":"invalid_grant","error_description":"Bad Request"}
                    """);

            assertThatThrownBy(() -> tokenClient.exchangeCode(google, config(EOAuthProvider.GOOGLE), "used-code"))
                    .isInstanceOf(InvalidGrantException.class)
                    .satisfies(e -> assertThat(((InvalidGrantException) e).getErrorCode()).isEqualTo("invalid_grant"));
        }

        @Test
        @DisplayName("should classify invalid_client as ConfigMismatchException")
        void shouldClassifyInvalidClient() {
            stubJson("/google/token", 401, """
                    {"error":"invalid_client","error_description":"Unauthorized"}
                    """);

            assertThatThrownBy(() -> tokenClient.exchangeCode(google, config(EOAuthProvider.GOOGLE), "code"))
                    .isInstanceOf(ConfigMismatchException.class);
        }

        @Test
        @DisplayName("should read GitHub errors from a 200 body")
        void shouldReadGitHubErrorsFromOkBody() {
            stubJson("/github/token", 200, """
                    {"error":"bad_verification_code","error_description":"The code passed is incorrect or expired."}
                    """);

            assertThatThrownBy(() -> tokenClient.exchangeCode(github, config(EOAuthProvider.GITHUB), "expired"))
                    .isInstanceOf(InvalidGrantException.class)
                    .hasMessageContaining("bad_verification_code");
        }

        @Test
        @DisplayName("should classify GitHub incorrect_client_credentials as ConfigMismatchException")
        void shouldClassifyGitHubBadCredentials() {
            stubJson("/github/token", 200, """
                    {"error":"incorrect_client_credentials"}
                    """);

            assertThatThrownBy(() -> tokenClient.exchangeCode(github, config(EOAuthProvider.GITHUB), "code"))
                    .isInstanceOf(ConfigMismatchException.class);
        }

        @Test
        @DisplayName("should accept non-expiring GitHub tokens")
        void shouldAcceptNonExpiringGitHubTokens() {
            stubJson("/github/token", 200, """
                    {"access_token":"gho_abc","token_type":"bearer","scope":"read:user,repo"}
                    """);

            OAuthTokens tokens = tokenClient.exchangeCode(github, config(EOAuthProvider.GITHUB), "code");

            assertThat(tokens.accessToken()).isEqualTo("gho_abc");
            assertThat(tokens.refreshToken()).isNull();
            assertThat(tokens.expiresAt()).isNull();
        }

        @Test
        @DisplayName("should parse Slack team attributes and ok=false errors")
        void shouldHandleSlackShapes() {
            stubJson("/slack/token", 200, """
                    {"ok":true,"access_token":"xoxb-1","scope":"channels:read","token_type":"bot",
                     "team":{"id":"T1","name":"Acme"},"authed_user":{"id":"U1"}}
                    """);

            OAuthTokens tokens = tokenClient.exchangeCode(slack, config(EOAuthProvider.SLACK), "code");

            assertThat(tokens.accessToken()).isEqualTo("xoxb-1");
            assertThat(tokens.attributes())
                    .containsEntry("team_id", "T1")
                    .containsEntry("team_name", "Acme")
                    .containsEntry("authed_user_id", "U1");

            stubJson("/slack/token", 200, """
                    {"ok":false,"error":"invalid_code"}
                    """);

            assertThatThrownBy(() -> tokenClient.exchangeCode(slack, config(EOAuthProvider.SLACK), "code"))
                    .isInstanceOf(InvalidGrantException.class);
        }

        @Test
        @DisplayName("should report 5xx as ProviderUnavailableException")
        void shouldReportServerErrorsAsUnavailable() {
            stubJson("/google/token", 503, "{}");

            assertThatThrownBy(() -> tokenClient.exchangeCode(google, config(EOAuthProvider.GOOGLE), "code"))
                    .isInstanceOf(ProviderUnavailableException.class);
        }

        @Test
        @DisplayName("should report a timeout as ProviderUnavailableException")
        void shouldReportTimeoutAsUnavailable() {
            server.stubFor(post(urlPathEqualTo("/google/token"))
                    .willReturn(aResponse().withStatus(200).withFixedDelay(3000).withBody("{}")));

            assertThatThrownBy(() -> tokenClient.exchangeCode(google, config(EOAuthProvider.GOOGLE), "code"))
                    .isInstanceOf(ProviderUnavailableException.class);
        }

        @Test
        @DisplayName("should reject a success payload without an access token")
        void shouldRejectPayloadWithoutAccessToken() {
            stubJson("/google/token", 200, """
                    {"token_type":"Bearer"}
                    """);

            assertThatThrownBy(() -> tokenClient.exchangeCode(google, config(EOAuthProvider.GOOGLE), "code"))
                    .isInstanceOf(ProviderClientException.class)
                    .isNotInstanceOf(OAuthProviderException.class);
        }
    }

    @Nested
    @DisplayName("refresh()")
    class RefreshTests {

        @Test
        @DisplayName("should send the refresh grant and return new tokens")
        void shouldRefresh() {
            stubJson("/google/token", 200, """
                    {"access_token":"ya29.new","expires_in":3600}
                    """);

            OAuthTokens tokens = tokenClient.refresh(google, config(EOAuthProvider.GOOGLE), "1//refresh");

            assertThat(tokens.accessToken()).isEqualTo("ya29.new");
            assertThat(tokens.refreshToken()).isNull();
            server.verify(postRequestedFor(urlPathEqualTo("/google/token"))
                    .withRequestBody(containing("grant_type=refresh_token"))
                    .withRequestBody(containing("refresh_token=1%2F%2Frefresh")));
        }

        @Test
        @DisplayName("should classify invalid_grant during refresh as RefreshRevokedException")
        void shouldClassifyRevocation() {
            stubJson("/google/token", 400, """
                    {"error":"invalid_grant","error_description":"Token has been expired or revoked."}
                    """);

            assertThatThrownBy(() -> tokenClient.refresh(google, config(EOAuthProvider.GOOGLE), "dead"))
                    .isInstanceOf(RefreshRevokedException.class);
        }

        @Test
        @DisplayName("should classify Slack invalid_refresh_token as RefreshRevokedException")
        void shouldClassifySlackRevocation() {
            stubJson("/slack/token", 200, """
                    {"ok":false,"error":"invalid_refresh_token"}
                    """);

            assertThatThrownBy(() -> tokenClient.refresh(slack, config(EOAuthProvider.SLACK), "xoxe-1"))
                    .isInstanceOf(RefreshRevokedException.class);
        }

        @Test
        @DisplayName("should not treat unrelated errors as revocation")
        void shouldNotTreatUnknownErrorsAsRevocation() {
            stubJson("/google/token", 400, """
                    {"error":"invalid_scope"}
                    """);

            assertThatThrownBy(() -> tokenClient.refresh(google, config(EOAuthProvider.GOOGLE), "refresh"))
                    .isInstanceOf(ProviderClientException.class)
                    .isNotInstanceOf(RefreshRevokedException.class);
        }

        @Test
        @DisplayName("should report rate limiting as ProviderUnavailableException")
        void shouldReportRateLimitAsUnavailable() {
            stubJson("/google/token", 429, "{}");

            assertThatThrownBy(() -> tokenClient.refresh(google, config(EOAuthProvider.GOOGLE), "refresh"))
                    .isInstanceOf(ProviderUnavailableException.class);
        }
    }
}
