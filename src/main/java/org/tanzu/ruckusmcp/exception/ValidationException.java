package org.tanzu.ruckusmcp.exception;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Raised on HTTP 400, or locally before a request is sent when an argument is
 * known to be invalid (in which case there is no status code).
 */
public class ValidationException extends ApiException {

    public ValidationException(JsonNode detail) {
        super(ErrorKind.VALIDATION, 400, detail, null, "Validation error", null);
    }

    public ValidationException(String localDetail) {
        super(ErrorKind.VALIDATION, null, TextNode.valueOf(localDetail), null, "Validation error", null);
    }
}
