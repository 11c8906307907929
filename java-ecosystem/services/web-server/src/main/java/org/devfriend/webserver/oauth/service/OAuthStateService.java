package org.devfriend.webserver.oauth.service;

import org.devfriend.core.model.integration.EOAuthProvider;
import org.devfriend.webserver.exception.OAuthStateException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Base64;

/**
 * Signed, self-contained OAuth state tokens, so the callback can be attributed to a user
 * without a server-side session.
 * <p>
 * State format: Base64Url(providerId:userId:timestamp:nonce:signature)
 * The signature is HMAC-SHA256(providerId:userId:timestamp:nonce, secret)
 */
@Service
public class OAuthStateService {

    private static final Logger log = LoggerFactory.getLogger(OAuthStateService.class);
    private static final String HMAC_ALGORITHM = "HmacSHA256";
    private static final String DELIMITER = ":";
    static final long STATE_EXPIRATION_MS = 10 * 60 * 1000; // 10 minutes

    /**
     * Caller identity recovered from a valid state token.
     */
    public record ValidatedState(EOAuthProvider provider, Long userId) {
    }

    private final SecureRandom secureRandom = new SecureRandom();
    private Clock clock = Clock.systemUTC();

    @Value("${devfriend.oauth.state-secret:${devfriend.security.jwt-secret}}")
    private String secretKey;

    public String generateState(EOAuthProvider provider, Long userId) {
        long timestamp = clock.millis();
        String nonce = generateNonce();

        String payload = provider.getId() + DELIMITER + userId + DELIMITER + timestamp + DELIMITER + nonce;
        String signature = computeHmac(payload);

        String state = payload + DELIMITER + signature;
        return Base64.getUrlEncoder().withoutPadding().encodeToString(state.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * @throws OAuthStateException when the token is missing, malformed, forged or older than ten minutes
     */
    public ValidatedState validate(String state) {
        if (state == null || state.isEmpty()) {
            log.warn("OAuth state is null or empty");
            throw new OAuthStateException("Missing OAuth state");
        }

        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(state), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            log.warn("Failed to decode OAuth state: {}", e.getMessage());
            throw new OAuthStateException("Malformed OAuth state");
        }

        String[] parts = decoded.split(DELIMITER);
        if (parts.length != 5) {
            log.warn("Invalid OAuth state format: expected 5 parts, got {}", parts.length);
            throw new OAuthStateException("Malformed OAuth state");
        }

        String providerId = parts[0];
        String userIdStr = parts[1];
        String timestampStr = parts[2];
        String nonce = parts[3];
        String receivedSignature = parts[4];

        String payload = providerId + DELIMITER + userIdStr + DELIMITER + timestampStr + DELIMITER + nonce;
        if (!constantTimeEquals(computeHmac(payload), receivedSignature)) {
            log.warn("OAuth state signature validation failed - possible forgery attempt");
            throw new OAuthStateException("OAuth state signature mismatch");
        }

        try {
            long timestamp = Long.parseLong(timestampStr);
            long age = clock.millis() - timestamp;
            if (age > STATE_EXPIRATION_MS || age < 0) {
                log.warn("OAuth state expired: issued {}ms ago", age);
                throw new OAuthStateException("OAuth state expired");
            }

            ValidatedState validated = new ValidatedState(EOAuthProvider.fromId(providerId), Long.parseLong(userIdStr));
            log.debug("OAuth state validated for user {} and provider {}", validated.userId(), providerId);
            return validated;
        } catch (IllegalArgumentException e) {
            log.warn("Failed to parse OAuth state: {}", e.getMessage());
            throw new OAuthStateException("Malformed OAuth state");
        }
    }

    private String generateNonce() {
        byte[] nonceBytes = new byte[16];
        secureRandom.nextBytes(nonceBytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(nonceBytes);
    }

    private String computeHmac(String data) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            SecretKeySpec keySpec = new SecretKeySpec(
                    secretKey.getBytes(StandardCharsets.UTF_8),
                    HMAC_ALGORITHM
            );
            mac.init(keySpec);
            byte[] hmacBytes = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().withoutPadding().encodeToString(hmacBytes);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("Failed to compute HMAC", e);
        }
    }

    private static boolean constantTimeEquals(String a, String b) {
        if (a == null || b == null) {
            return false;
        }
        return MessageDigest.isEqual(a.getBytes(StandardCharsets.UTF_8), b.getBytes(StandardCharsets.UTF_8));
    }
}
