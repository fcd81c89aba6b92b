package org.tanzu.ruckusmcp.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised for API failures that are not authentication problems: unclassified
 * non-2xx statuses and transport failures. Subclasses narrow the status range.
 */
public class ApiException extends RuckusOneException {

    public ApiException(Integer statusCode, JsonNode detail, String message) {
        this(ErrorKind.GENERIC, statusCode, detail, message, "API error", null);
    }

    public ApiException(String message, Throwable cause) {
        this(ErrorKind.GENERIC, null, null, message, "API error", cause);
    }

    protected ApiException(ErrorKind kind, Integer statusCode, JsonNode detail, String message,
                           String fallbackLabel, Throwable cause) {
        super(kind, statusCode, detail, message, fallbackLabel, cause);
    }
}
