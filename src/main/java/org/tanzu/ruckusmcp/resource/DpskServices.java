package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;

import java.util.List;
import java.util.Map;

/**
 * Dynamic pre-shared key (DPSK) services, their passphrases, and the devices
 * bound to each passphrase.
 * 
 * Listing always goes through the "/query" endpoints; the plain GET listings
 * are deprecated by the API. List operations return the item array rather
 * than the paged envelope.
 */
public class DpskServices extends ResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(DpskServices.class);

    static final String SERVICE = "DPSK service";
    static final String PASSPHRASE = "DPSK passphrase";

    public DpskServices(ApiGateway gateway) {
        super(gateway);
    }

    // Services

    public JsonNode listServices(QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.empty());
        logger.debug("Listing DPSK services with query: {}", body);
        return itemsOf(send(ApiRequest.post("/dpskServices/query").jsonBody(body)), "data");
    }

    public JsonNode getService(String poolId) {
        return send(ApiRequest.get(servicePath(poolId)).notFoundAs(SERVICE, poolId));
    }

    public JsonNode createService(String name, Map<String, ?> settings) {
        Map<String, Object> body = mutableCopy(settings);
        body.put("name", name);
        logger.info("Creating DPSK service '{}'", name);
        return send(ApiRequest.post("/dpskServices").jsonBody(body));
    }

    public JsonNode updateService(String poolId, Map<String, ?> updates) {
        return send(ApiRequest.put(servicePath(poolId)).jsonBody(mutableCopy(updates)).notFoundAs(SERVICE, poolId));
    }

    public void deleteService(String poolId) {
        logger.info("Deleting DPSK service {}", poolId);
        sendIgnoringBody(ApiRequest.delete(servicePath(poolId)).notFoundAs(SERVICE, poolId));
    }

    // Passphrases

    public JsonNode listPassphrases(String poolId, QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.empty());
        logger.debug("Listing passphrases for pool {} with query: {}", poolId, body);
        return itemsOf(send(ApiRequest.post(servicePath(poolId) + "/passphrases/query")
            .jsonBody(body).notFoundAs(SERVICE, poolId)), "data");
    }

    public JsonNode getPassphrase(String poolId, String passphraseId) {
        return send(ApiRequest.get(passphrasePath(poolId, passphraseId)).notFoundAs(PASSPHRASE, passphraseId));
    }

    public JsonNode createPassphrases(String poolId, List<Map<String, Object>> passphrases) {
        logger.info("Creating {} passphrases in pool {}", passphrases.size(), poolId);
        return send(ApiRequest.post(servicePath(poolId) + "/passphrases")
            .jsonBody(Map.of("passphrases", passphrases)).notFoundAs(SERVICE, poolId));
    }

    public JsonNode updatePassphrase(String poolId, String passphraseId, Map<String, ?> updates) {
        return send(ApiRequest.put(passphrasePath(poolId, passphraseId))
            .jsonBody(mutableCopy(updates)).notFoundAs(PASSPHRASE, passphraseId));
    }

    public void deletePassphrases(String poolId, List<String> passphraseIds) {
        logger.info("Deleting {} passphrases from pool {}", passphraseIds.size(), poolId);
        sendIgnoringBody(ApiRequest.delete(servicePath(poolId) + "/passphrases")
            .jsonBody(Map.of("passphraseIds", passphraseIds)).notFoundAs(SERVICE, poolId));
    }

    public JsonNode batchUpdatePassphrases(String poolId, List<Map<String, Object>> updates) {
        logger.info("Batch updating {} passphrases in pool {}", updates.size(), poolId);
        return send(ApiRequest.patch(servicePath(poolId) + "/passphrases")
            .jsonBody(Map.of("passphrases", updates)).notFoundAs(SERVICE, poolId));
    }

    // Devices bound to a passphrase

    public JsonNode listDevices(String poolId, String passphraseId) {
        return itemsOf(send(ApiRequest.get(passphrasePath(poolId, passphraseId) + "/devices")
            .notFoundAs(PASSPHRASE, passphraseId)), "devices", "data");
    }

    public JsonNode addDevices(String poolId, String passphraseId, List<Map<String, String>> devices) {
        return send(ApiRequest.post(passphrasePath(poolId, passphraseId) + "/devices")
            .jsonBody(Map.of("devices", devices)).notFoundAs(PASSPHRASE, passphraseId));
    }

    public JsonNode updateDevices(String poolId, String passphraseId, List<Map<String, String>> devices) {
        return send(ApiRequest.patch(passphrasePath(poolId, passphraseId) + "/devices")
            .jsonBody(Map.of("devices", devices)).notFoundAs(PASSPHRASE, passphraseId));
    }

    public void removeDevices(String poolId, String passphraseId, List<String> deviceMacs) {
        sendIgnoringBody(ApiRequest.delete(passphrasePath(poolId, passphraseId) + "/devices")
            .jsonBody(Map.of("deviceMacs", deviceMacs)).notFoundAs(PASSPHRASE, passphraseId));
    }

    // CSV import / export

    /**
     * Uploads passphrases as CSV.
     * 
     * @param csvContent the CSV document, sent as text/csv
     * @return the import report
     */
    public JsonNode importPassphrasesCsv(String poolId, String csvContent) {
        logger.info("Importing passphrases from CSV into pool {}", poolId);
        return send(ApiRequest.post(servicePath(poolId) + "/passphrases/csvFiles")
            .rawBody(csvContent)
            .header("Content-Type", "text/csv")
            .notFoundAs(SERVICE, poolId));
    }

    /**
     * Downloads passphrases as CSV.
     * 
     * @param query optional filters; null exports everything
     * @return the CSV document
     */
    public String exportPassphrasesCsv(String poolId, QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.empty());
        logger.debug("Exporting passphrases from pool {} to CSV with query: {}", poolId, body);
        return gateway.request(ApiRequest.post(servicePath(poolId) + "/passphrases/query/csvFiles")
            .jsonBody(body)
            .rawResponse()
            .notFoundAs(SERVICE, poolId)
            .build()).asText();
    }

    // Network association

    public JsonNode associateWithWifiNetwork(String wlanId, String dpskServiceId) {
        logger.info("Associating DPSK service {} with WLAN {}", dpskServiceId, wlanId);
        return send(ApiRequest.put("/wifiNetworks/" + wlanId + "/dpskServices/" + dpskServiceId)
            .jsonBody(Map.of())
            .notFoundAs(WifiNetworks.KIND, wlanId));
    }

    private static String servicePath(String poolId) {
        return "/dpskServices/" + poolId;
    }

    private static String passphrasePath(String poolId, String passphraseId) {
        return servicePath(poolId) + "/passphrases/" + passphraseId;
    }
}
