package org.tanzu.ruckusmcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import org.springframework.http.ResponseEntity;

import java.nio.charset.StandardCharsets;

/**
 * Successful outcome of an {@link ApiRequest}.
 * 
 * <ul>
 *   <li>{@link Type#EMPTY} - 2xx without a body</li>
 *   <li>{@link Type#JSON} - body decoded because the content type is JSON</li>
 *   <li>{@link Type#BYTES} - any other body, untouched</li>
 *   <li>{@link Type#RAW} - the unprocessed response, when the request asked for it</li>
 * </ul>
 */
public final class ApiResult {

    public enum Type { EMPTY, JSON, BYTES, RAW }

    private static final ApiResult EMPTY = new ApiResult(Type.EMPTY, null, null, null);

    private final Type type;
    private final JsonNode json;
    private final byte[] body;
    private final ResponseEntity<byte[]> rawResponse;

    private ApiResult(Type type, JsonNode json, byte[] body, ResponseEntity<byte[]> rawResponse) {
        this.type = type;
        this.json = json;
        this.body = body;
        this.rawResponse = rawResponse;
    }

    public static ApiResult empty() {
        return EMPTY;
    }

    public static ApiResult json(JsonNode json) {
        return new ApiResult(Type.JSON, json, null, null);
    }

    public static ApiResult bytes(byte[] body) {
        return new ApiResult(Type.BYTES, null, body, null);
    }

    public static ApiResult raw(ResponseEntity<byte[]> response) {
        return new ApiResult(Type.RAW, null, response.getBody(), response);
    }

    public Type getType() { return type; }

    public boolean isEmpty() { return type == Type.EMPTY; }

    public boolean isJson() { return type == Type.JSON; }

    /**
     * The decoded JSON body. An empty result yields a JSON null.
     * 
     * @throws IllegalStateException if the response carried a non-JSON body or was requested raw
     */
    public JsonNode asJson() {
        switch (type) {
            case JSON:
                return json;
            case EMPTY:
                return NullNode.getInstance();
            default:
                throw new IllegalStateException("Response body is not JSON (result type " + type + ")");
        }
    }

    /** Copy of the body bytes for BYTES and RAW results, an empty array otherwise (JSON results included). */
    public byte[] getBody() {
        return body == null ? new byte[0] : body.clone();
    }

    /** Body as UTF-8 text; JSON results are rendered back to compact JSON. */
    public String asText() {
        if (type == Type.JSON) {
            return json.toString();
        }
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    /**
     * The unprocessed response.
     * 
     * @throws IllegalStateException if the request did not ask for a raw response
     */
    public ResponseEntity<byte[]> getRawResponse() {
        if (type != Type.RAW) {
            throw new IllegalStateException("Raw response was not requested");
        }
        return rawResponse;
    }

    @Override
    public String toString() {
        switch (type) {
            case JSON:
                return "ApiResult{JSON " + json + '}';
            case EMPTY:
                return "ApiResult{EMPTY}";
            default:
                return "ApiResult{" + type + ", " + (body == null ? 0 : body.length) + " bytes}";
        }
    }
}
