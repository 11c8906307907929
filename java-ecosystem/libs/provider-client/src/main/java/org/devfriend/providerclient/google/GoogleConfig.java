package org.devfriend.providerclient.google;

public final class GoogleConfig {

    public static final String OAUTH_AUTHORIZE_URL = "https://accounts.google.com/o/oauth2/v2/auth";
    public static final String OAUTH_TOKEN_URL = "https://oauth2.googleapis.com/token";
    public static final String GMAIL_API_BASE = "https://gmail.googleapis.com/gmail/v1/users/me";

    public static final String GMAIL_READONLY_SCOPE = "https://www.googleapis.com/auth/gmail.readonly";

    public static final int DEFAULT_PAGE_SIZE = 20;
    public static final int MAX_PAGE_SIZE = 100;

    private GoogleConfig() {
        // Utility class
    }
}
