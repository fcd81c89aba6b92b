package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.tanzu.ruckusmcp.client.StubExchange;
import org.tanzu.ruckusmcp.exception.ResourceNotFoundException;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VenuesTest {

    private StubExchange stub;
    private Venues venues;

    @BeforeEach
    void setUp() {
        stub = new StubExchange();
        venues = new Venues(ResourceTestSupport.gateway(stub));
    }

    @Test
    void listPostsDefaultQuery() {
        stub.enqueue(StubExchange.json(200, "{\"data\":[{\"id\":\"v-1\"}],\"totalCount\":1}"));

        JsonNode response = venues.list(null);

        ClientRequest request = stub.lastApiRequest();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/venues/query", request.url().getPath());
        assertEquals(ResourceTestSupport.json("{\"pageSize\":100,\"page\":0,\"sortOrder\":\"ASC\"}"),
            ResourceTestSupport.jsonBodyOf(request));
        assertEquals("v-1", response.path("data").get(0).path("id").asText());
    }

    @Test
    void missingVenueIsReportedByKindAndId() {
        stub.enqueue(StubExchange.json(404, "{\"message\":\"not found\"}"));

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class, () -> venues.get("v-404"));

        assertEquals("Venue with ID v-404 not found", e.getMessage());
    }

    @Test
    void createOmitsUnsetOptionalFields() {
        stub.enqueue(StubExchange.json(201, "{\"id\":\"v-2\"}"));

        venues.create("Branch", Map.of("city", "Austin", "country", "US"), null, "America/Chicago", Map.of("tags", "retail"));

        JsonNode body = ResourceTestSupport.jsonBodyOf(stub.lastApiRequest());
        assertEquals("Branch", body.path("name").asText());
        assertEquals("Austin", body.path("address").path("city").asText());
        assertEquals("America/Chicago", body.path("timezone").asText());
        assertEquals("retail", body.path("tags").asText());
        assertFalse(body.has("description"));
    }

    @Test
    void deleteAcceptsEmptyResponse() {
        stub.enqueue(StubExchange.empty(204));

        venues.delete("v-1");

        ClientRequest request = stub.lastApiRequest();
        assertEquals(HttpMethod.DELETE, request.method());
        assertEquals("/venues/v-1", request.url().getPath());
    }

    @Test
    void venueClientsAreQueriedUnderVenue() {
        stub.enqueue(StubExchange.json(200, "{\"data\":[]}"));

        venues.getClients("v-1", Map.of("pageSize", 10));

        ClientRequest request = stub.lastApiRequest();
        assertEquals("/venues/v-1/clients/query", request.url().getPath());
        assertEquals(10, ResourceTestSupport.jsonBodyOf(request).path("pageSize").asInt());
    }

    @Test
    void unparseableJsonBodyIsReturnedAsText() {
        stub.enqueue(StubExchange.json(200, "{not json"));

        JsonNode response = venues.get("v-1");

        assertTrue(response.isTextual());
        assertEquals("{not json", response.asText());
    }

    @Test
    void plainTextBodyIsReturnedAsText() {
        stub.enqueue(StubExchange.response(200, "text/plain", "accepted"));

        JsonNode response = venues.get("v-1");

        assertEquals("accepted", response.asText());
    }
}
