package org.devfriend.providerclient.github;

public final class GitHubConfig {

    public static final String API_BASE = "https://api.github.com";
    public static final String OAUTH_AUTHORIZE_URL = "https://github.com/login/oauth/authorize";
    public static final String OAUTH_TOKEN_URL = "https://github.com/login/oauth/access_token";

    public static final String ACCEPT_HEADER = "application/vnd.github+json";
    public static final String API_VERSION_HEADER = "X-GitHub-Api-Version";
    public static final String API_VERSION = "2022-11-28";

    public static final int DEFAULT_PAGE_SIZE = 30;
    public static final int MAX_PAGE_SIZE = 100;

    private GitHubConfig() {
        // Utility class
    }
}
