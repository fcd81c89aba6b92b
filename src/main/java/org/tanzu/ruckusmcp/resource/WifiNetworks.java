package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * WiFi network (WLAN) definitions and their deployment to venues.
 */
public class WifiNetworks extends ResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(WifiNetworks.class);

    static final String KIND = "WLAN";

    public WifiNetworks(ApiGateway gateway) {
        super(gateway);
    }

    public JsonNode list(QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.defaults());
        logger.debug("Querying WLANs with data: {}", body);
        return send(ApiRequest.post("/wifiNetworks/query").jsonBody(body));
    }

    public JsonNode get(String wlanId) {
        return send(ApiRequest.get("/wifiNetworks/" + wlanId).notFoundAs(KIND, wlanId));
    }

    /**
     * Creates a WiFi network.
     * 
     * @param name network name
     * @param ssid broadcast SSID
     * @param securityType e.g. "open", "wpa2-psk", "wpa2-enterprise"
     * @param vlanId optional VLAN (1-4094)
     * @param hidden whether the SSID is hidden
     * @param description optional description
     * @param extra additional properties, may be null
     */
    public JsonNode create(String name, String ssid, String securityType, Integer vlanId, boolean hidden,
                           String description, Map<String, ?> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("ssid", ssid);
        body.put("securityType", securityType);
        body.put("hidden", hidden);
        if (vlanId != null) {
            VlanRange.check(vlanId);
            body.put("vlanId", vlanId);
        }
        putIfPresent(body, "description", description);
        if (extra != null) {
            body.putAll(extra);
        }
        logger.info("Creating WLAN '{}' (SSID '{}')", name, ssid);
        return send(ApiRequest.post("/wifiNetworks").jsonBody(body));
    }

    public JsonNode update(String wlanId, Map<String, ?> fields) {
        return send(ApiRequest.put("/wifiNetworks/" + wlanId).jsonBody(mutableCopy(fields)).notFoundAs(KIND, wlanId));
    }

    public void delete(String wlanId) {
        logger.info("Deleting WLAN {}", wlanId);
        sendIgnoringBody(ApiRequest.delete("/wifiNetworks/" + wlanId).notFoundAs(KIND, wlanId));
    }

    /**
     * Lists the networks deployed in one venue.
     * 
     * @param extraFilters filters added next to the venue filter, may be null
     */
    public JsonNode listVenueNetworks(String venueId, String searchString, int pageSize, int page,
                                      Map<String, ?> extraFilters) {
        Map<String, Object> filters = mutableCopy(extraFilters);
        filters.put("venueId", venueId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("pageSize", pageSize);
        body.put("page", page);
        putIfPresent(body, "searchString", searchString);
        body.put("filters", filters);
        return send(ApiRequest.post("/venues/networks/query").jsonBody(body).notFoundAs(Venues.KIND, venueId));
    }

    /**
     * Deploys a network to a venue, or to one AP group of it.
     * 
     * @param apGroupId optional AP group
     * @param extra additional deployment settings, may be null
     */
    public JsonNode deployToVenue(String wlanId, String venueId, String apGroupId, Map<String, ?> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("wifiNetworkId", wlanId);
        putIfPresent(body, "apGroupId", apGroupId);
        if (extra != null) {
            body.putAll(extra);
        }
        logger.info("Deploying WLAN {} to venue {}", wlanId, venueId);
        return send(ApiRequest.post("/venues/" + venueId + "/networks").jsonBody(body).notFoundAs(Venues.KIND, venueId));
    }

    public void undeployFromVenue(String wlanId, String venueId, String apGroupId) {
        logger.info("Removing WLAN {} from venue {}", wlanId, venueId);
        sendIgnoringBody(venueNetwork(ApiRequest.delete(venueNetworkPath(venueId, wlanId)), wlanId, apGroupId));
    }

    public JsonNode getVenueSettings(String wlanId, String venueId, String apGroupId) {
        return send(venueNetwork(ApiRequest.get(venueNetworkPath(venueId, wlanId)), wlanId, apGroupId));
    }

    public JsonNode updateVenueSettings(String wlanId, String venueId, String apGroupId, Map<String, ?> settings) {
        return send(venueNetwork(ApiRequest.put(venueNetworkPath(venueId, wlanId)), wlanId, apGroupId)
            .jsonBody(mutableCopy(settings)));
    }

    private static ApiRequest.Builder venueNetwork(ApiRequest.Builder request, String wlanId, String apGroupId) {
        return request.queryParam("apGroupId", apGroupId).notFoundAs("WLAN deployment", wlanId);
    }

    private static String venueNetworkPath(String venueId, String wlanId) {
        return "/venues/" + venueId + "/networks/" + wlanId;
    }
}
