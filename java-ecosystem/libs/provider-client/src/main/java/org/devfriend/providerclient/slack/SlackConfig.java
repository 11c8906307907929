package org.devfriend.providerclient.slack;

public final class SlackConfig {

    public static final String API_BASE = "https://slack.com/api";
    public static final String OAUTH_AUTHORIZE_URL = "https://slack.com/oauth/v2/authorize";
    public static final String OAUTH_TOKEN_URL = API_BASE + "/oauth.v2.access";

    public static final int DEFAULT_PAGE_SIZE = 100;
    public static final int MAX_PAGE_SIZE = 1000;

    private SlackConfig() {
        // Utility class
    }
}
