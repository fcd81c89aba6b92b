package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.tanzu.ruckusmcp.client.StubExchange;
import org.tanzu.ruckusmcp.exception.ValidationException;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class IdentitiesTest {

    private StubExchange stub;
    private Identities identities;

    @BeforeEach
    void setUp() {
        stub = new StubExchange();
        identities = new Identities(ResourceTestSupport.gateway(stub));
    }

    @Test
    void listUsesPagingQueryParameters() {
        stub.enqueue(StubExchange.json(200, "{\"content\":[],\"totalElements\":0}"));

        identities.list(0, 20, null);

        ClientRequest request = stub.lastApiRequest();
        assertEquals(HttpMethod.GET, request.method());
        assertEquals("/identities", request.url().getPath());
        assertEquals("page=0&size=20", request.url().getRawQuery());
    }

    @Test
    void addDeviceUpperCasesMacAndSendsArray() {
        stub.enqueue(StubExchange.json(201, "[{\"macAddress\":\"AA-BB-CC-DD-EE-FF\"}]"));

        identities.addDevice("g-1", "i-1", "aa-bb-cc-dd-ee-ff", "Laptop", null, null);

        ClientRequest request = stub.lastApiRequest();
        assertEquals("/identityGroups/g-1/identities/i-1/devices", request.url().getPath());
        JsonNode body = ResourceTestSupport.jsonBodyOf(request);
        assertTrue(body.isArray());
        assertEquals("AA-BB-CC-DD-EE-FF", body.get(0).path("macAddress").asText());
        assertEquals("Laptop", body.get(0).path("name").asText());
    }

    @Test
    void malformedMacIsRejectedLocally() {
        assertThrows(ValidationException.class,
            () -> identities.addDevice("g-1", "i-1", "AA:BB:CC:DD:EE:FF", null, null, null));
        assertThrows(ValidationException.class,
            () -> identities.addDevice("g-1", "i-1", "AA-BB-CC-DD-EE", null, null, null));
        assertThrows(ValidationException.class,
            () -> identities.addDevice("g-1", "i-1", null, null, null, null));

        assertTrue(stub.requests().isEmpty());
    }

    @Test
    void devicesComeFromIdentityRecord() {
        stub.enqueue(StubExchange.json(200, "{\"id\":\"i-1\",\"devices\":[{\"macAddress\":\"AA-BB-CC-DD-EE-FF\"}]}"));

        JsonNode devices = identities.getDevices("g-1", "i-1");

        assertEquals(1, devices.size());
    }

    @Test
    void updateUsesPatch() {
        stub.enqueue(StubExchange.json(200, "{}"));

        identities.update("g-1", "i-1", Map.of("email", "a@example.com"));

        assertEquals(HttpMethod.PATCH, stub.lastApiRequest().method());
    }

    @Test
    void csvExportReturnsBytes() {
        stub.enqueue(StubExchange.response(200, "text/csv", "name,email\n"));

        byte[] csv = identities.exportCsv("p-1", null);

        assertEquals("name,email\n", new String(csv, StandardCharsets.UTF_8));
        assertEquals("p-1", ResourceTestSupport.jsonBodyOf(stub.lastApiRequest()).path("dpskPoolId").asText());
    }
}
