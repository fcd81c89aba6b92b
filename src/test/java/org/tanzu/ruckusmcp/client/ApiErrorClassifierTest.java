package org.tanzu.ruckusmcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.tanzu.ruckusmcp.exception.ResourceNotFoundException;
import org.tanzu.ruckusmcp.exception.RuckusOneException;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class ApiErrorClassifierTest {

    private final ApiErrorClassifier classifier = new ApiErrorClassifier(new ObjectMapper());

    @Test
    void messageFieldWinsOverErrorField() {
        JsonNode detail = classifier.extractDetail(bytes("{\"error\":\"E\",\"message\":\"M\"}"));

        assertEquals("M", detail.asText());
    }

    @Test
    void emptyMessageFallsThroughToErrorField() {
        JsonNode detail = classifier.extractDetail(bytes("{\"message\":\"\",\"error\":\"E\"}"));

        assertEquals("E", detail.asText());
    }

    @Test
    void objectWithoutKnownFieldsIsKeptWhole() {
        JsonNode detail = classifier.extractDetail(bytes("{\"errors\":[{\"code\":\"WIFI-10001\"}]}"));

        assertTrue(detail.isObject());
        assertEquals("WIFI-10001", detail.path("errors").get(0).path("code").asText());
    }

    @Test
    void structuredMessageFieldIsRenderedAsJson() {
        RuckusOneException e = classifier.classify(400, bytes("{\"message\":{\"field\":\"name\"}}"), null);

        assertEquals("{\"field\":\"name\"}", e.getMessage());
    }

    @Test
    void arrayBodyIsKept() {
        JsonNode detail = classifier.extractDetail(bytes("[\"a\",\"b\"]"));

        assertTrue(detail.isArray());
    }

    @Test
    void nonJsonBodyBecomesText() {
        JsonNode detail = classifier.extractDetail(bytes("<html>Bad Gateway</html>"));

        assertTrue(detail.isTextual());
        assertEquals("<html>Bad Gateway</html>", detail.asText());
    }

    @Test
    void emptyBodyHasNoDetail() {
        assertNull(classifier.extractDetail(new byte[0]));
        assertNull(classifier.extractDetail(null));
    }

    @Test
    void notFoundWithoutContextUsesDetail() {
        RuckusOneException e = classifier.classify(404, bytes("{\"message\":\"no such venue\"}"), null);

        ResourceNotFoundException notFound = assertInstanceOf(ResourceNotFoundException.class, e);
        assertEquals("no such venue", notFound.getMessage());
        assertNull(notFound.getResourceKind());
    }

    @Test
    void notFoundWithoutContextOrBodyUsesTemplate() {
        RuckusOneException e = classifier.classify(404, null, null);

        assertEquals("Resource not found (status 404)", e.getMessage());
    }

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }
}
