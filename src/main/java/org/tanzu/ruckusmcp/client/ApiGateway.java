package org.tanzu.ruckusmcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientException;
import org.springframework.web.util.UriComponentsBuilder;
import org.tanzu.ruckusmcp.exception.ApiException;
import org.tanzu.ruckusmcp.exception.RuckusOneException;

import java.io.IOException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;

/**
 * Executes {@link ApiRequest}s against the RUCKUS One API of one region.
 * 
 * For each call the gateway:
 * - resolves the absolute URL from the regional base URL and the request path
 * - takes the auth headers from the {@link TokenAuthority} and lays the
 *   caller's headers over them (the caller wins on conflict)
 * - sends the JSON, form or raw body
 * - blocks until the response arrives and classifies it
 * 
 * A 2xx answer becomes an {@link ApiResult}: the raw response when asked for,
 * EMPTY without a body, decoded JSON for JSON content types (including vendor
 * types such as application/vnd.ruckus.v1+json), raw bytes otherwise.
 * Any other status becomes the typed error chosen by {@link ApiErrorClassifier}.
 * Transport failures become a generic {@link ApiException}. Nothing is retried.
 */
public class ApiGateway {

    private static final Logger logger = LoggerFactory.getLogger(ApiGateway.class);

    private final TokenAuthority tokenAuthority;
    private final WebClient webClient;
    private final String baseUrl;
    private final ObjectMapper objectMapper;
    private final ApiErrorClassifier errorClassifier;

    /**
     * @param tokenAuthority source of the bearer token
     * @param webClient transport
     * @param baseUrl scheme and host of the API, without trailing slash
     */
    public ApiGateway(TokenAuthority tokenAuthority, WebClient webClient, String baseUrl) {
        this.tokenAuthority = tokenAuthority;
        this.webClient = webClient;
        this.baseUrl = TokenAuthority.stripTrailingSlash(baseUrl);
        this.objectMapper = new ObjectMapper();
        this.errorClassifier = new ApiErrorClassifier(objectMapper);
    }

    /**
     * Creates a gateway for a region code; unknown codes use the "na" endpoint.
     */
    public static ApiGateway forRegion(TokenAuthority tokenAuthority, WebClient webClient, String regionCode) {
        return new ApiGateway(tokenAuthority, webClient, Region.resolve(regionCode).baseUrl());
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public TokenAuthority getTokenAuthority() {
        return tokenAuthority;
    }

    /**
     * Sends a request and classifies the outcome.
     * 
     * @param request the call to make
     * @return the decoded success payload
     * @throws RuckusOneException typed error for any non-2xx status, transport
     *         failure, or failed token acquisition
     */
    public ApiResult request(ApiRequest request) {
        URI uri = buildUri(request);
        HttpMethod method = request.getMethod();
        logger.debug("Making {} request to {}", method, uri);

        HttpHeaders headers = new HttpHeaders();
        tokenAuthority.getAuthHeaders().forEach(headers::set);
        request.getHeaders().forEach(headers::set);
        if (request.getFormData() != null && request.getHeaders().keySet().stream()
                .noneMatch(HttpHeaders.CONTENT_TYPE::equalsIgnoreCase)) {
            headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        }

        WebClient.RequestBodySpec spec = webClient.method(method)
            .uri(uri)
            .headers(h -> h.addAll(headers));

        WebClient.RequestHeadersSpec<?> exchange = spec;
        if (request.getJsonBody() != null) {
            logger.debug("Request JSON body: {}", request.getJsonBody());
            exchange = spec.bodyValue(request.getJsonBody());
        } else if (request.getFormData() != null) {
            logger.debug("Request form fields: {}", request.getFormData().keySet());
            exchange = spec.body(BodyInserters.fromFormData(request.getFormData()));
        } else if (request.getRawBody() != null) {
            logger.debug("Request raw body: {} bytes", request.getRawBody().length);
            exchange = spec.bodyValue(request.getRawBody());
        }

        ResponseEntity<byte[]> response;
        try {
            response = exchange
                .exchangeToMono(clientResponse -> clientResponse.toEntity(byte[].class))
                .block();
        } catch (WebClientException e) {
            logger.error("Request {} {} failed: {}", method, uri, e.getMessage(), e);
            throw new ApiException("Request failed: " + e.getMessage(), e);
        } catch (DataBufferLimitException e) {
            logger.error("Response to {} {} exceeds the in-memory buffer limit: {}", method, uri, e.getMessage());
            throw new ApiException("Response too large: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ApiException("Request failed: no response for " + method + " " + uri, null);
        }

        int status = response.getStatusCode().value();
        logger.debug("Response status: {}", status);

        if (status >= 200 && status < 300) {
            return toResult(request, response);
        }

        RuckusOneException error = errorClassifier.classify(status, response.getBody(), request);
        logger.error("Request {} {} failed with status code {}: {}", method, uri, status, error.getMessage());
        throw error;
    }

    public ApiResult get(String path) {
        return request(ApiRequest.get(path).build());
    }

    public ApiResult get(String path, Map<String, ?> queryParams) {
        return request(ApiRequest.get(path).queryParams(queryParams).build());
    }

    public ApiResult post(String path, Object jsonBody) {
        return request(ApiRequest.post(path).jsonBody(jsonBody).build());
    }

    public ApiResult put(String path, Object jsonBody) {
        return request(ApiRequest.put(path).jsonBody(jsonBody).build());
    }

    public ApiResult patch(String path, Object jsonBody) {
        return request(ApiRequest.patch(path).jsonBody(jsonBody).build());
    }

    public ApiResult delete(String path) {
        return request(ApiRequest.delete(path).build());
    }

    public ApiResult delete(String path, Object jsonBody) {
        return request(ApiRequest.delete(path).jsonBody(jsonBody).build());
    }

    private URI buildUri(ApiRequest request) {
        String path = request.getPath();
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
        return UriComponentsBuilder.fromUriString(baseUrl + "/" + path)
            .queryParams(request.getQueryParams())
            .encode()
            .build()
            .toUri();
    }

    private ApiResult toResult(ApiRequest request, ResponseEntity<byte[]> response) {
        if (request.isRawResponse()) {
            return ApiResult.raw(response);
        }
        byte[] body = response.getBody();
        if (body == null || body.length == 0) {
            return ApiResult.empty();
        }
        if (isJsonContentType(response.getHeaders())) {
            try {
                JsonNode json = objectMapper.readTree(body);
                return json == null || json.isMissingNode() ? ApiResult.empty() : ApiResult.json(json);
            } catch (IOException e) {
                logger.warn("Response declared {} but is not valid JSON, returning raw body: {}",
                           response.getHeaders().getFirst(HttpHeaders.CONTENT_TYPE), e.getMessage());
                return ApiResult.bytes(body);
            }
        }
        logger.debug("Response content length: {} bytes", body.length);
        return ApiResult.bytes(body);
    }

    /**
     * True for application/json and any structured-syntax "+json" type.
     */
    static boolean isJsonContentType(HttpHeaders headers) {
        String value = headers.getFirst(HttpHeaders.CONTENT_TYPE);
        if (value == null || value.isBlank()) {
            return false;
        }
        try {
            String subtype = MediaType.parseMediaType(value).getSubtype().toLowerCase(Locale.ROOT);
            return subtype.equals("json") || subtype.endsWith("+json");
        } catch (InvalidMediaTypeException e) {
            return false;
        }
    }
}
