package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;
import org.tanzu.ruckusmcp.exception.ValidationException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Identities (persona records) and their devices.
 * 
 * Identities live inside an identity group, so point operations take both the
 * group ID and the identity ID.
 */
public class Identities extends ResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(Identities.class);

    static final String KIND = "Identity";

    private static final Pattern MAC_ADDRESS = Pattern.compile("^([0-9A-F]{2}-){5}[0-9A-F]{2}$");

    public Identities(ApiGateway gateway) {
        super(gateway);
    }

    /**
     * Lists identities across all groups.
     * 
     * @param page zero-based page
     * @param pageSize items per page
     * @param extraParams further query parameters, may be null
     */
    public JsonNode list(int page, int pageSize, Map<String, ?> extraParams) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("page", page);
        params.put("size", pageSize);
        if (extraParams != null) {
            params.putAll(extraParams);
        }
        logger.debug("Listing identities with parameters: {}", params);
        return send(ApiRequest.get("/identities").queryParams(params));
    }

    /**
     * Queries identities with filtering.
     * 
     * @param dpskPoolId only identities of this DPSK pool, may be null
     * @param ethernetPort ethernet port filter, may be null
     * @param filter additional filter fields, may be null
     * @param sort sort expressions such as "name,asc", may be null
     */
    public JsonNode query(String dpskPoolId, Map<String, ?> ethernetPort, Map<String, ?> filter,
                          int page, int pageSize, List<String> sort) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page", page);
        body.put("size", pageSize);
        putIfPresent(body, "dpskPoolId", dpskPoolId);
        putIfPresent(body, "ethernetPort", ethernetPort);
        putIfPresent(body, "filter", filter);
        putIfPresent(body, "sort", sort);
        logger.debug("Querying identities with parameters: {}", body);
        return send(ApiRequest.post("/identities/query").jsonBody(body));
    }

    public JsonNode get(String groupId, String identityId) {
        return send(ApiRequest.get(identityPath(groupId, identityId)).notFoundAs(KIND, identityId));
    }

    public JsonNode update(String groupId, String identityId, Map<String, ?> fields) {
        return send(ApiRequest.patch(identityPath(groupId, identityId))
            .jsonBody(mutableCopy(fields)).notFoundAs(KIND, identityId));
    }

    public void delete(String groupId, String identityId) {
        logger.info("Deleting identity {} from group {}", identityId, groupId);
        sendIgnoringBody(ApiRequest.delete(identityPath(groupId, identityId)).notFoundAs(KIND, identityId));
    }

    /**
     * Devices are embedded in the identity record; this reads them from there.
     */
    public JsonNode getDevices(String groupId, String identityId) {
        return itemsOf(get(groupId, identityId), "devices");
    }

    /**
     * Binds a device to an identity.
     * 
     * @param macAddress MAC in XX-XX-XX-XX-XX-XX form, any case
     * @throws ValidationException if the MAC address is malformed
     */
    public JsonNode addDevice(String groupId, String identityId, String macAddress, String name,
                              String description, Map<String, ?> extra) {
        String normalizedMac = macAddress == null ? "" : macAddress.toUpperCase(Locale.ROOT);
        if (!MAC_ADDRESS.matcher(normalizedMac).matches()) {
            throw new ValidationException("MAC address must be in format XX-XX-XX-XX-XX-XX");
        }
        Map<String, Object> device = new LinkedHashMap<>();
        device.put("macAddress", normalizedMac);
        putIfPresent(device, "name", name);
        putIfPresent(device, "description", description);
        if (extra != null) {
            device.putAll(extra);
        }
        return send(ApiRequest.post(identityPath(groupId, identityId) + "/devices")
            .jsonBody(List.of(device)).notFoundAs(KIND, identityId));
    }

    public void removeDevice(String groupId, String identityId, String macAddress) {
        sendIgnoringBody(ApiRequest.delete(identityPath(groupId, identityId) + "/devices/" + macAddress)
            .notFoundAs(KIND, identityId));
    }

    /**
     * Exports identities as a CSV file.
     * 
     * @return the file content
     */
    public byte[] exportCsv(String dpskPoolId, Map<String, ?> filter) {
        Map<String, Object> body = new LinkedHashMap<>();
        putIfPresent(body, "dpskPoolId", dpskPoolId);
        putIfPresent(body, "filter", filter);
        logger.debug("Exporting identities to CSV with parameters: {}", body);
        return gateway.request(ApiRequest.post("/identities/csvFile").jsonBody(body).rawResponse().build()).getBody();
    }

    private static String identityPath(String groupId, String identityId) {
        return "/identityGroups/" + groupId + "/identities/" + identityId;
    }
}
