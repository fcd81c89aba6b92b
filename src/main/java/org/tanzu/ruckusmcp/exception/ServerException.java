package org.tanzu.ruckusmcp.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised for any 5xx status.
 */
public class ServerException extends ApiException {

    public ServerException(int statusCode, JsonNode detail) {
        super(ErrorKind.SERVER, statusCode, detail, null, "Server error occurred", null);
    }
}
