package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.tanzu.ruckusmcp.client.StubExchange;
import org.tanzu.ruckusmcp.exception.ResourceNotFoundException;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AccessPointsTest {

    private StubExchange stub;
    private AccessPoints accessPoints;

    @BeforeEach
    void setUp() {
        stub = new StubExchange();
        accessPoints = new AccessPoints(ResourceTestSupport.gateway(stub));
    }

    @Test
    void getQueriesByIdAndReturnsFirstMatch() {
        stub.enqueue(StubExchange.json(200, "{\"data\":[{\"serialNumber\":\"S1\",\"name\":\"Lobby\"}]}"));

        JsonNode ap = accessPoints.get("S1");

        assertEquals("Lobby", ap.path("name").asText());
        JsonNode body = ResourceTestSupport.jsonBodyOf(stub.lastApiRequest());
        assertEquals("ID", body.path("filters").get(0).path("type").asText());
        assertEquals("S1", body.path("filters").get(0).path("value").asText());
    }

    @Test
    void getWithNoMatchIsNotFound() {
        stub.enqueue(StubExchange.json(200, "{\"data\":[]}"));

        ResourceNotFoundException e = assertThrows(ResourceNotFoundException.class, () -> accessPoints.get("S404"));

        assertEquals("AP with ID S404 not found", e.getMessage());
    }

    @Test
    void rebootPostsToApPath() {
        stub.enqueue(StubExchange.json(202, "{\"requestId\":\"r-1\"}"));

        accessPoints.reboot("v-1", "S1");

        ClientRequest request = stub.lastApiRequest();
        assertEquals(HttpMethod.POST, request.method());
        assertEquals("/venues/v-1/aps/S1/reboot", request.url().getPath());
    }

    @Test
    void clientsOfOneApAddSerialFilter() {
        stub.enqueue(StubExchange.json(200, "{\"data\":[]}"));

        accessPoints.getClients("v-1", "S1", null);

        JsonNode body = ResourceTestSupport.jsonBodyOf(stub.lastApiRequest());
        assertEquals("S1", body.path("filters").path("serialNumber").asText());
    }

    @Test
    void addToGroupSendsSerialNumbers() {
        stub.enqueue(StubExchange.empty(200));

        accessPoints.addToGroup("v-1", "g-1", List.of("S1", "S2"));

        ClientRequest request = stub.lastApiRequest();
        assertEquals("/venues/v-1/apGroups/g-1/members", request.url().getPath());
        assertEquals(2, ResourceTestSupport.jsonBodyOf(request).path("serialNumbers").size());
    }

    @Test
    void getClientsKeepsCallerFiltersWhenAddingSerial() {
        stub.enqueue(StubExchange.json(200, "{\"data\":[]}"));

        accessPoints.getClients("v-1", "S1", Map.of("filters", Map.of("venueId", List.of("v-1")), "pageSize", 10));

        JsonNode body = ResourceTestSupport.jsonBodyOf(stub.lastApiRequest());
        assertEquals("S1", body.path("filters").path("serialNumber").asText());
        assertEquals("v-1", body.path("filters").path("venueId").get(0).asText());
        assertEquals(10, body.path("pageSize").asInt());
    }
}
