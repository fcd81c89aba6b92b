package org.tanzu.ruckusmcp.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised on HTTP 429.
 */
public class RateLimitException extends ApiException {

    public RateLimitException(JsonNode detail) {
        super(ErrorKind.RATE_LIMIT, 429, detail, null, "Rate limit exceeded", null);
    }
}
