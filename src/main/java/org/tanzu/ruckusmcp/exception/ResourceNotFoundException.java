package org.tanzu.ruckusmcp.exception;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raised on HTTP 404, or when a lookup by query returns no match.
 *
 * Resource modules attach the kind and identifier of what they looked up, in
 * which case the message names them (for example "Venue with ID v-1 not found").
 */
public class ResourceNotFoundException extends ApiException {

    private final String resourceKind;
    private final String resourceId;

    public ResourceNotFoundException(JsonNode detail) {
        this(detail, null, null);
    }

    public ResourceNotFoundException(JsonNode detail, String resourceKind, String resourceId) {
        super(ErrorKind.NOT_FOUND, 404, detail, describe(resourceKind, resourceId), "Resource not found", null);
        this.resourceKind = resourceKind;
        this.resourceId = resourceId;
    }

    public String getResourceKind() { return resourceKind; }

    public String getResourceId() { return resourceId; }

    private static String describe(String resourceKind, String resourceId) {
        if (resourceKind == null) {
            return null;
        }
        return resourceId != null
                ? resourceKind + " with ID " + resourceId + " not found"
                : resourceKind + " not found";
    }
}
