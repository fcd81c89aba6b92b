package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;

import java.util.Map;

/**
 * Venue management: the sites that access points and switches belong to.
 */
public class Venues extends ResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(Venues.class);

    static final String KIND = "Venue";

    public Venues(ApiGateway gateway) {
        super(gateway);
    }

    /**
     * Lists venues.
     * 
     * @param query paging, sorting and search; null for the defaults
     * @return the query response, with venues under "data"
     */
    public JsonNode list(QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.defaults());
        logger.debug("Listing venues with parameters: {}", body);
        return send(ApiRequest.post("/venues/query").jsonBody(body));
    }

    /**
     * @throws org.tanzu.ruckusmcp.exception.ResourceNotFoundException if the venue does not exist
     */
    public JsonNode get(String venueId) {
        return send(ApiRequest.get("/venues/" + venueId).notFoundAs(KIND, venueId));
    }

    /**
     * Creates a venue.
     * 
     * @param name venue name
     * @param address address fields (addressLine, city, country, ...)
     * @param description optional description
     * @param timezone optional time zone name
     * @param extra additional venue properties, may be null
     * @return the created venue
     */
    public JsonNode create(String name, Map<String, ?> address, String description, String timezone,
                           Map<String, ?> extra) {
        Map<String, Object> body = mutableCopy(null);
        body.put("name", name);
        putIfPresent(body, "address", address);
        putIfPresent(body, "description", description);
        putIfPresent(body, "timezone", timezone);
        if (extra != null) {
            body.putAll(extra);
        }
        logger.info("Creating venue '{}'", name);
        return send(ApiRequest.post("/venues").jsonBody(body));
    }

    public JsonNode update(String venueId, Map<String, ?> fields) {
        return send(ApiRequest.put("/venues/" + venueId).jsonBody(mutableCopy(fields)).notFoundAs(KIND, venueId));
    }

    public void delete(String venueId) {
        logger.info("Deleting venue {}", venueId);
        sendIgnoringBody(ApiRequest.delete("/venues/" + venueId).notFoundAs(KIND, venueId));
    }

    public JsonNode getAccessPoints(String venueId) {
        logger.debug("Getting APs for venue {}", venueId);
        return send(ApiRequest.get("/venues/" + venueId + "/aps").notFoundAs(KIND, venueId));
    }

    public JsonNode getSwitches(String venueId, Map<String, ?> query) {
        return send(ApiRequest.post("/venues/" + venueId + "/switches/query")
            .jsonBody(mutableCopy(query)).notFoundAs(KIND, venueId));
    }

    public JsonNode getWifiNetworks(String venueId, Map<String, ?> query) {
        return send(ApiRequest.post("/venues/" + venueId + "/wifiNetworks/query")
            .jsonBody(mutableCopy(query)).notFoundAs(KIND, venueId));
    }

    public JsonNode getClients(String venueId, Map<String, ?> query) {
        return send(ApiRequest.post("/venues/" + venueId + "/clients/query")
            .jsonBody(mutableCopy(query)).notFoundAs(KIND, venueId));
    }
}
