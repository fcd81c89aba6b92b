package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;
import org.tanzu.ruckusmcp.exception.ResourceNotFoundException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Access point operations.
 * 
 * Access points are addressed by venue ID plus serial number for point
 * operations; {@link #get(String)} finds one by ID through the query endpoint
 * since the API has no direct lookup.
 */
public class AccessPoints extends ResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(AccessPoints.class);

    static final String KIND = "AP";

    public AccessPoints(ApiGateway gateway) {
        super(gateway);
    }

    /**
     * Lists access points across venues.
     * 
     * @param query paging and filters, e.g. filters [{type: VENUE, value: id}]; null for the defaults
     * @return the query response, with APs under "data"
     */
    public JsonNode list(QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.defaults());
        logger.debug("Querying APs with data: {}", body);
        return send(ApiRequest.post("/venues/aps/query").jsonBody(body));
    }

    /**
     * Finds an access point by ID.
     * 
     * @param apId AP identifier
     * @return the first matching AP
     * @throws ResourceNotFoundException if the query returns no AP
     */
    public JsonNode get(String apId) {
        logger.debug("Getting AP details for AP ID: {}", apId);
        QueryRequest query = QueryRequest.empty().filters(List.of(Map.of("type", "ID", "value", apId)));
        JsonNode items = itemsOf(send(ApiRequest.post("/venues/aps/query").jsonBody(query.toBody())), "data");
        if (items.isEmpty()) {
            throw new ResourceNotFoundException(null, KIND, apId);
        }
        return items.get(0);
    }

    public JsonNode update(String venueId, String serialNumber, Map<String, ?> fields) {
        return send(ApiRequest.put(apPath(venueId, serialNumber))
            .jsonBody(mutableCopy(fields)).notFoundAs(KIND, serialNumber));
    }

    public JsonNode reboot(String venueId, String serialNumber) {
        logger.info("Rebooting AP {} in venue {}", serialNumber, venueId);
        return send(ApiRequest.post(apPath(venueId, serialNumber) + "/reboot").notFoundAs(KIND, serialNumber));
    }

    /**
     * Lists wireless clients, optionally only those of one AP.
     * 
     * @param venueId venue the AP belongs to
     * @param serialNumber AP serial number, or null for all clients
     * @param query additional query fields, may be null
     */
    public JsonNode getClients(String venueId, String serialNumber, Map<String, ?> query) {
        Map<String, Object> body = mutableCopy(query);
        ApiRequest.Builder request = ApiRequest.post("/venues/aps/clients/query");
        if (serialNumber != null) {
            Object existing = body.get("filters");
            Map<String, Object> filters = new LinkedHashMap<>();
            if (existing instanceof Map) {
                ((Map<?, ?>) existing).forEach((key, value) -> filters.put(String.valueOf(key), value));
            }
            filters.put("serialNumber", serialNumber);
            body.put("filters", filters);
            request.notFoundAs(KIND, serialNumber);
        } else {
            request.notFoundAs(Venues.KIND, venueId);
        }
        return send(request.jsonBody(body));
    }

    public JsonNode getRadioSettings(String venueId, String serialNumber) {
        return send(ApiRequest.get(apPath(venueId, serialNumber) + "/radioSettings").notFoundAs(KIND, serialNumber));
    }

    public JsonNode updateRadioSettings(String venueId, String serialNumber, Map<String, ?> settings) {
        return send(ApiRequest.put(apPath(venueId, serialNumber) + "/radioSettings")
            .jsonBody(mutableCopy(settings)).notFoundAs(KIND, serialNumber));
    }

    public JsonNode getStatistics(String venueId, String serialNumber) {
        return send(ApiRequest.get(apPath(venueId, serialNumber) + "/statistics").notFoundAs(KIND, serialNumber));
    }

    /**
     * Adds access points to an AP group of a venue.
     */
    public JsonNode addToGroup(String venueId, String apGroupId, List<String> serialNumbers) {
        logger.info("Adding {} APs to group {} in venue {}", serialNumbers.size(), apGroupId, venueId);
        return send(ApiRequest.post("/venues/" + venueId + "/apGroups/" + apGroupId + "/members")
            .jsonBody(Map.of("serialNumbers", serialNumbers))
            .notFoundAs("AP group", apGroupId));
    }

    private static String apPath(String venueId, String serialNumber) {
        return "/venues/" + venueId + "/aps/" + serialNumber;
    }
}
