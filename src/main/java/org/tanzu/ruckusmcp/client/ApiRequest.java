package org.tanzu.ruckusmcp.client;

import org.springframework.http.HttpMethod;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One logical API call: method, path, query parameters, an optional body and
 * extra headers. Built by a resource module, consumed once by {@link ApiGateway}.
 * 
 * At most one body may be given: a JSON body, form data, or a raw body with a
 * caller-supplied Content-Type.
 * 
 * A resource kind and identifier may be attached with {@link Builder#notFoundAs};
 * a 404 answer is then reported as "&lt;kind&gt; with ID &lt;id&gt; not found".
 */
public final class ApiRequest {

    private final HttpMethod method;
    private final String path;
    private final MultiValueMap<String, String> queryParams;
    private final Object jsonBody;
    private final MultiValueMap<String, String> formData;
    private final byte[] rawBody;
    private final Map<String, String> headers;
    private final boolean rawResponse;
    private final String resourceKind;
    private final String resourceId;

    private ApiRequest(Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.queryParams = builder.queryParams;
        this.jsonBody = builder.jsonBody;
        this.formData = builder.formData;
        this.rawBody = builder.rawBody;
        this.headers = Collections.unmodifiableMap(builder.headers);
        this.rawResponse = builder.rawResponse;
        this.resourceKind = builder.resourceKind;
        this.resourceId = builder.resourceId;
    }

    public static Builder builder(HttpMethod method, String path) {
        return new Builder(method, path);
    }

    public static Builder get(String path) { return builder(HttpMethod.GET, path); }

    public static Builder post(String path) { return builder(HttpMethod.POST, path); }

    public static Builder put(String path) { return builder(HttpMethod.PUT, path); }

    public static Builder patch(String path) { return builder(HttpMethod.PATCH, path); }

    public static Builder delete(String path) { return builder(HttpMethod.DELETE, path); }

    public HttpMethod getMethod() { return method; }

    public String getPath() { return path; }

    public MultiValueMap<String, String> getQueryParams() { return queryParams; }

    public Object getJsonBody() { return jsonBody; }

    public MultiValueMap<String, String> getFormData() { return formData; }

    public byte[] getRawBody() { return rawBody; }

    public Map<String, String> getHeaders() { return headers; }

    public boolean isRawResponse() { return rawResponse; }

    public String getResourceKind() { return resourceKind; }

    public String getResourceId() { return resourceId; }

    @Override
    public String toString() {
        return method + " " + path + (queryParams.isEmpty() ? "" : " " + queryParams);
    }

    public static final class Builder {

        private final HttpMethod method;
        private final String path;
        private final MultiValueMap<String, String> queryParams = new LinkedMultiValueMap<>();
        private Object jsonBody;
        private MultiValueMap<String, String> formData;
        private byte[] rawBody;
        private final Map<String, String> headers = new LinkedHashMap<>();
        private boolean rawResponse;
        private String resourceKind;
        private String resourceId;

        private Builder(HttpMethod method, String path) {
            this.method = Objects.requireNonNull(method, "method");
            this.path = Objects.requireNonNull(path, "path");
        }

        /** Adds a query parameter; null values are skipped. */
        public Builder queryParam(String name, Object value) {
            if (value != null) {
                queryParams.add(name, String.valueOf(value));
            }
            return this;
        }

        public Builder queryParams(Map<String, ?> params) {
            if (params != null) {
                params.forEach(this::queryParam);
            }
            return this;
        }

        /** Body serialized as JSON: a map, a list, a JsonNode or any Jackson-serializable object. */
        public Builder jsonBody(Object body) {
            this.jsonBody = body;
            return this;
        }

        /** Body sent as application/x-www-form-urlencoded. */
        public Builder formData(Map<String, String> fields) {
            if (fields != null) {
                MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
                fields.forEach(form::add);
                this.formData = form;
            }
            return this;
        }

        /** Body sent as-is; set the Content-Type with {@link #header}. */
        public Builder rawBody(byte[] body) {
            this.rawBody = body;
            return this;
        }

        public Builder rawBody(String body) {
            return rawBody(body == null ? null : body.getBytes(StandardCharsets.UTF_8));
        }

        /** Extra header; overrides the default headers of the same name. */
        public Builder header(String name, String value) {
            headers.put(name, value);
            return this;
        }

        public Builder headers(Map<String, String> extra) {
            if (extra != null) {
                headers.putAll(extra);
            }
            return this;
        }

        /** Return the unprocessed response on success instead of a decoded body. */
        public Builder rawResponse() {
            this.rawResponse = true;
            return this;
        }

        /** Names what this request addresses, for the message of a 404. */
        public Builder notFoundAs(String kind, String id) {
            this.resourceKind = kind;
            this.resourceId = id;
            return this;
        }

        /**
         * @throws IllegalArgumentException if more than one kind of body was given
         */
        public ApiRequest build() {
            int bodies = (jsonBody != null ? 1 : 0) + (formData != null ? 1 : 0) + (rawBody != null ? 1 : 0);
            if (bodies > 1) {
                throw new IllegalArgumentException("JSON body, form data and raw body are mutually exclusive");
            }
            return new ApiRequest(this);
        }
    }
}
