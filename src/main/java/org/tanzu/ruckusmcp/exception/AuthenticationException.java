package org.tanzu.ruckusmcp.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised when credentials are rejected, the token exchange returns something
 * unusable, or an API call answers 401.
 */
public class AuthenticationException extends RuckusOneException {

    public AuthenticationException(String message) {
        this(message, null, null, null);
    }

    public AuthenticationException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public AuthenticationException(String message, Integer statusCode, JsonNode detail, Throwable cause) {
        super(ErrorKind.AUTHENTICATION, statusCode, detail, message, "Authentication failed", cause);
    }
}
