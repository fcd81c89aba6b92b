package org.tanzu.ruckusmcp.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import org.tanzu.ruckusmcp.exception.ApiException;
import org.tanzu.ruckusmcp.exception.AuthenticationException;
import org.tanzu.ruckusmcp.exception.RateLimitException;
import org.tanzu.ruckusmcp.exception.ResourceNotFoundException;
import org.tanzu.ruckusmcp.exception.RuckusOneException;
import org.tanzu.ruckusmcp.exception.ServerException;
import org.tanzu.ruckusmcp.exception.ValidationException;

import java.nio.charset.StandardCharsets;

/**
 * Turns a non-2xx response into the matching typed error.
 * 
 * Status mapping: 401 authentication, 404 not found, 400 validation,
 * 429 rate limit, 5xx server, anything else a generic API error.
 */
public class ApiErrorClassifier {

    private final ObjectMapper objectMapper;

    public ApiErrorClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param statusCode HTTP status of the response
     * @param body response body, possibly null
     * @param request the request that produced it, for not-found context; may be null
     * @return the error to throw
     */
    public RuckusOneException classify(int statusCode, byte[] body, ApiRequest request) {
        JsonNode detail = extractDetail(body);

        if (statusCode == 401) {
            return new AuthenticationException(null, statusCode, detail, null);
        }
        if (statusCode == 404) {
            if (request != null && request.getResourceKind() != null) {
                return new ResourceNotFoundException(detail, request.getResourceKind(), request.getResourceId());
            }
            return new ResourceNotFoundException(detail);
        }
        if (statusCode == 400) {
            return new ValidationException(detail);
        }
        if (statusCode == 429) {
            return new RateLimitException(detail);
        }
        if (statusCode >= 500 && statusCode < 600) {
            return new ServerException(statusCode, detail);
        }
        return new ApiException(statusCode, detail, null);
    }

    /**
     * Pulls a human-readable detail out of an error body: the "message" field,
     * else the "error" field, else the whole decoded JSON. A body that does not
     * decode as JSON is returned as text. An empty body has no detail.
     */
    public JsonNode extractDetail(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        String text = new String(body, StandardCharsets.UTF_8);
        JsonNode node;
        try {
            node = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            return TextNode.valueOf(text);
        }
        if (node == null || node.isMissingNode()) {
            return TextNode.valueOf(text);
        }
        if (node.isObject()) {
            JsonNode field = firstPresent(node, "message", "error");
            return field != null ? field : node;
        }
        if (node.isValueNode()) {
            return TextNode.valueOf(node.asText());
        }
        return node;
    }

    private static JsonNode firstPresent(JsonNode node, String... fieldNames) {
        for (String name : fieldNames) {
            JsonNode field = node.get(name);
            if (field == null || field.isNull()) {
                continue;
            }
            if (field.isTextual() && field.asText().isEmpty()) {
                continue;
            }
            return field;
        }
        return null;
    }
}
