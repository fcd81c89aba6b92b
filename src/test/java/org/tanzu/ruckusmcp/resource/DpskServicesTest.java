package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.tanzu.ruckusmcp.client.StubExchange;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DpskServicesTest {

    private StubExchange stub;
    private DpskServices dpsk;

    @BeforeEach
    void setUp() {
        stub = new StubExchange();
        dpsk = new DpskServices(ResourceTestSupport.gateway(stub));
    }

    @Test
    void listServicesReturnsDataItems() {
        stub.enqueue(StubExchange.json(200, "{\"data\":[{\"id\":\"p-1\"},{\"id\":\"p-2\"}],\"totalCount\":2}"));

        JsonNode services = dpsk.listServices(null);

        assertTrue(services.isArray());
        assertEquals(2, services.size());
        assertEquals("/dpskServices/query", stub.lastApiRequest().url().getPath());
        assertEquals(0, ResourceTestSupport.jsonBodyOf(stub.lastApiRequest()).size());
    }

    @Test
    void listServicesWithoutDataIsEmpty() {
        stub.enqueue(StubExchange.json(200, "{\"totalCount\":0}"));

        assertEquals(0, dpsk.listServices(null).size());
    }

    @Test
    void devicesAreReadFromDevicesField() {
        stub.enqueue(StubExchange.json(200, "{\"devices\":[{\"mac\":\"AA-BB-CC-DD-EE-FF\"}]}"));

        JsonNode devices = dpsk.listDevices("p-1", "pp-1");

        assertEquals(1, devices.size());
        assertEquals("/dpskServices/p-1/passphrases/pp-1/devices", stub.lastApiRequest().url().getPath());
    }

    @Test
    void deletePassphrasesSendsIdsInBody() {
        stub.enqueue(StubExchange.empty(204));

        dpsk.deletePassphrases("p-1", List.of("pp-1", "pp-2"));

        ClientRequest request = stub.lastApiRequest();
        assertEquals(HttpMethod.DELETE, request.method());
        assertEquals("/dpskServices/p-1/passphrases", request.url().getPath());
        assertEquals(ResourceTestSupport.json("{\"passphraseIds\":[\"pp-1\",\"pp-2\"]}"),
            ResourceTestSupport.jsonBodyOf(request));
    }

    @Test
    void csvImportSendsTextCsvBody() {
        stub.enqueue(StubExchange.json(202, "{\"imported\":1}"));

        JsonNode report = dpsk.importPassphrasesCsv("p-1", "username,passphrase\nalice,secret123\n");

        ClientRequest request = stub.lastApiRequest();
        assertEquals("/dpskServices/p-1/passphrases/csvFiles", request.url().getPath());
        assertEquals("text/csv", request.headers().getFirst(HttpHeaders.CONTENT_TYPE));
        assertEquals("username,passphrase\nalice,secret123\n", StubExchange.bodyOf(request));
        assertEquals(1, report.path("imported").asInt());
    }

    @Test
    void csvExportReturnsDocumentText() {
        stub.enqueue(StubExchange.response(200, "text/csv", "username,passphrase\nalice,secret123\n"));

        String csv = dpsk.exportPassphrasesCsv("p-1", null);

        assertEquals("username,passphrase\nalice,secret123\n", csv);
        assertEquals("/dpskServices/p-1/passphrases/query/csvFiles", stub.lastApiRequest().url().getPath());
    }

    @Test
    void associationWithNetworkIsPutWithEmptyObject() {
        stub.enqueue(StubExchange.empty(200));

        dpsk.associateWithWifiNetwork("w-1", "p-1");

        ClientRequest request = stub.lastApiRequest();
        assertEquals(HttpMethod.PUT, request.method());
        assertEquals("/wifiNetworks/w-1/dpskServices/p-1", request.url().getPath());
        assertEquals("{}", StubExchange.bodyOf(request));
    }
}
