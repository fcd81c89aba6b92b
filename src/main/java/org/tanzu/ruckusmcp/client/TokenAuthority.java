package org.tanzu.ruckusmcp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.tanzu.ruckusmcp.exception.AuthenticationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Owns the OAuth2 client-credentials token for one tenant.
 * 
 * The token is acquired on first use and cached together with its expiry.
 * Expiry is checked lazily on every {@link #getValidToken()} call; there is no
 * background refresh. The recorded expiry is the server-declared lifetime minus
 * {@link #SAFETY_MARGIN}, so a request never starts with a token about to lapse.
 * 
 * The check-then-refresh sequence runs under a lock with a second check inside,
 * so concurrent callers that all see an expired token cause one exchange, not
 * one each. Reading a still-valid token does not take the lock.
 * 
 * A failed exchange never touches the cache: a previously cached token stays in
 * place until its own expiry, and with no cached token nothing is stored.
 */
public class TokenAuthority {

    private static final Logger logger = LoggerFactory.getLogger(TokenAuthority.class);

    /** Subtracted from the server-declared token lifetime */
    public static final Duration SAFETY_MARGIN = Duration.ofSeconds(300);

    /** Lifetime assumed when the token response omits expires_in */
    static final long DEFAULT_EXPIRES_IN_SECONDS = 3600;

    /** Token lifecycle as seen from the cache. */
    public enum State { NO_TOKEN, VALID, EXPIRED }

    private final Credentials credentials;
    private final String baseUrl;
    private final WebClient webClient;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private final Object refreshLock = new Object();
    private volatile CachedToken cachedToken;

    /**
     * Creates an authority that authenticates against the regional endpoint of the credentials.
     */
    public TokenAuthority(Credentials credentials, WebClient webClient, Clock clock) {
        this(credentials, Region.resolve(credentials.getRegion()).baseUrl(), webClient, clock);
    }

    /**
     * Creates an authority that authenticates against an explicit base URL.
     * 
     * @param credentials client credentials
     * @param baseUrl scheme and host, without trailing slash
     * @param webClient transport used for the token exchange
     * @param clock time source for expiry bookkeeping
     */
    public TokenAuthority(Credentials credentials, String baseUrl, WebClient webClient, Clock clock) {
        this.credentials = credentials;
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.webClient = webClient;
        this.clock = clock;
    }

    /**
     * Returns the cached token while it is valid, otherwise authenticates,
     * caches the new token and returns it.
     * 
     * @return a bearer token that has not reached its recorded expiry
     * @throws AuthenticationException if a needed exchange fails
     */
    public String getValidToken() {
        CachedToken current = cachedToken;
        if (current != null && current.isValidAt(clock.instant())) {
            return current.getAccessToken();
        }
        synchronized (refreshLock) {
            current = cachedToken;
            if (current != null && current.isValidAt(clock.instant())) {
                return current.getAccessToken();
            }
            logger.info(current == null
                    ? "No cached access token found, authenticating"
                    : "Cached access token expired, re-authenticating");
            CachedToken fresh = authenticate();
            cachedToken = fresh;
            return fresh.getAccessToken();
        }
    }

    /**
     * Authenticates unconditionally and replaces the cached token.
     * 
     * @throws AuthenticationException if the exchange fails; the cache is then unchanged
     */
    public void forceRefresh() {
        synchronized (refreshLock) {
            logger.info("Forcing access token refresh");
            cachedToken = authenticate();
        }
    }

    /**
     * Headers every API request carries: the bearer token and a JSON content type.
     */
    public Map<String, String> getAuthHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + getValidToken());
        headers.put(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE);
        return headers;
    }

    public State getState() {
        CachedToken current = cachedToken;
        if (current == null) {
            return State.NO_TOKEN;
        }
        return current.isValidAt(clock.instant()) ? State.VALID : State.EXPIRED;
    }

    /** The cached token, or null before the first successful exchange. */
    public CachedToken getCachedToken() {
        return cachedToken;
    }

    public Credentials getCredentials() {
        return credentials;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Performs the client-credentials exchange against /oauth2/token/{tenantId}.
     * 
     * @return the new token with its safety-adjusted expiry
     * @throws AuthenticationException on transport failure, non-2xx status, or a
     *         response without access_token
     */
    private CachedToken authenticate() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("grant_type", "client_credentials");
        form.add("client_id", credentials.getClientId());
        form.add("client_secret", credentials.getClientSecret());

        logger.debug("Authenticating with RUCKUS One API at {}/oauth2/token/{}", baseUrl, credentials.getTenantId());

        Instant requestedAt = clock.instant();
        ResponseEntity<String> response;
        try {
            response = webClient.post()
                .uri(baseUrl + "/oauth2/token/{tenantId}", credentials.getTenantId())
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .body(BodyInserters.fromFormData(form))
                .exchangeToMono(clientResponse -> clientResponse.toEntity(String.class))
                .block();
        } catch (WebClientException e) {
            logger.error("Authentication request failed: {}", e.getMessage(), e);
            throw new AuthenticationException("Authentication failed: " + e.getMessage(), e);
        } catch (DataBufferLimitException e) {
            logger.error("Token response exceeds the in-memory buffer limit: {}", e.getMessage());
            throw new AuthenticationException("Invalid token response: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new AuthenticationException("Authentication failed: no response from token endpoint");
        }

        int status = response.getStatusCode().value();
        String body = response.getBody();
        logger.debug("Auth response status: {}", status);

        if (!response.getStatusCode().is2xxSuccessful()) {
            logger.error("Auth error response ({}): {}", status, body);
            throw new AuthenticationException(null, status, body == null ? null : TextNode.valueOf(body), null);
        }

        JsonNode data = parseTokenResponse(body);
        JsonNode accessToken = data.get("access_token");
        if (accessToken == null || accessToken.isNull() || accessToken.asText().isEmpty()) {
            logger.error("No access token in response, fields present: {}", fieldNames(data));
            throw new AuthenticationException("No access token in response");
        }

        long expiresIn = data.path("expires_in").asLong(DEFAULT_EXPIRES_IN_SECONDS);
        Instant expiresAt = requestedAt.plusSeconds(expiresIn).minus(SAFETY_MARGIN);

        logger.info("Successfully obtained access token, expires in {} seconds", expiresIn);
        return new CachedToken(accessToken.asText(), expiresAt);
    }

    private JsonNode parseTokenResponse(String body) {
        if (body == null || body.isBlank()) {
            logger.error("Empty token response");
            throw new AuthenticationException("No access token in response");
        }
        try {
            JsonNode node = objectMapper.readTree(body);
            if (node == null || !node.isObject()) {
                throw new AuthenticationException("No access token in response");
            }
            return node;
        } catch (JsonProcessingException e) {
            logger.error("Token response is not valid JSON: {}", e.getOriginalMessage());
            throw new AuthenticationException("Invalid token response: " + e.getOriginalMessage(), e);
        }
    }

    private static String fieldNames(JsonNode node) {
        StringBuilder names = new StringBuilder();
        node.fieldNames().forEachRemaining(name -> {
            if (names.length() > 0) names.append(", ");
            names.append(name);
        });
        return names.toString();
    }

    static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
