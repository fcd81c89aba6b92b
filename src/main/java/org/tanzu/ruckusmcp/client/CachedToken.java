package org.tanzu.ruckusmcp.client;

import java.time.Instant;

/**
 * An access token and the instant from which it must no longer be used.
 * The expiry already has the safety margin subtracted.
 */
public final class CachedToken {

    private final String accessToken;
    private final Instant expiresAt;

    public CachedToken(String accessToken, Instant expiresAt) {
        this.accessToken = accessToken;
        this.expiresAt = expiresAt;
    }

    public String getAccessToken() { return accessToken; }

    public Instant getExpiresAt() { return expiresAt; }

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }

    @Override
    public String toString() {
        return "CachedToken{accessToken='***', expiresAt=" + expiresAt + '}';
    }
}
