package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.TextNode;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;
import org.tanzu.ruckusmcp.client.ApiResult;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base class for the per-resource API modules.
 * 
 * Each module is handed the {@link ApiGateway} of its client session and sends
 * every call through it, so they all share one token cache.
 */
public abstract class ResourceModule {

    protected final ApiGateway gateway;

    protected ResourceModule(ApiGateway gateway) {
        this.gateway = Objects.requireNonNull(gateway, "gateway");
    }

    /**
     * Sends the request and returns its decoded JSON body: JSON null when the
     * body is empty, a text node holding the raw body when it is not JSON.
     */
    protected JsonNode send(ApiRequest.Builder request) {
        ApiResult result = gateway.request(request.build());
        if (result.isJson() || result.isEmpty()) {
            return result.asJson();
        }
        return TextNode.valueOf(result.asText());
    }

    /** Sends a request whose response body is not needed. */
    protected void sendIgnoringBody(ApiRequest.Builder request) {
        gateway.request(request.build());
    }

    /**
     * Extracts the item list from a query response: the response itself when it
     * is an array, otherwise the first array found under one of the given keys.
     */
    protected static JsonNode itemsOf(JsonNode response, String... keys) {
        if (response.isArray()) {
            return response;
        }
        for (String key : keys) {
            JsonNode items = response.path(key);
            if (items.isArray()) {
                return items;
            }
        }
        return JsonNodeFactory.instance.arrayNode();
    }

    /** Copies a caller-supplied map so it can be extended; null becomes empty. */
    protected static Map<String, Object> mutableCopy(Map<String, ?> source) {
        return source == null ? new LinkedHashMap<>() : new LinkedHashMap<>(source);
    }

    protected static void putIfPresent(Map<String, Object> body, String key, Object value) {
        if (value instanceof String && ((String) value).isEmpty()) {
            return;
        }
        if (value != null) {
            body.put(key, value);
        }
    }
}
