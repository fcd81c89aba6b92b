package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * VLAN pools, VLAN pool profiles, and AP management VLAN settings.
 */
public class VlanPools extends ResourceModule {

    static final String POOL = "VLAN pool";
    static final String PROFILE = "VLAN pool profile";

    public VlanPools(ApiGateway gateway) {
        super(gateway);
    }

    public JsonNode listPools(QueryRequest query) {
        return send(ApiRequest.post("/vlanPools/query").jsonBody(QueryRequest.bodyOf(query, QueryRequest.defaults())));
    }

    public JsonNode getPool(String poolId) {
        return send(ApiRequest.get("/vlanPools/" + poolId).notFoundAs(POOL, poolId));
    }

    public JsonNode createPool(String name, List<Map<String, Object>> vlans, String description, Map<String, ?> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("vlans", vlans);
        putIfPresent(body, "description", description);
        if (extra != null) {
            body.putAll(extra);
        }
        return send(ApiRequest.post("/vlanPools").jsonBody(body));
    }

    public JsonNode updatePool(String poolId, Map<String, ?> fields) {
        return send(ApiRequest.put("/vlanPools/" + poolId).jsonBody(mutableCopy(fields)).notFoundAs(POOL, poolId));
    }

    public void deletePool(String poolId) {
        sendIgnoringBody(ApiRequest.delete("/vlanPools/" + poolId).notFoundAs(POOL, poolId));
    }

    public JsonNode listProfiles(QueryRequest query) {
        return send(ApiRequest.post("/vlanPoolProfiles/query").jsonBody(QueryRequest.bodyOf(query, QueryRequest.defaults())));
    }

    public JsonNode getProfile(String profileId) {
        return send(ApiRequest.get("/vlanPoolProfiles/" + profileId).notFoundAs(PROFILE, profileId));
    }

    public JsonNode createProfile(String name, String vlanPoolId, String description, Map<String, ?> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("vlanPoolId", vlanPoolId);
        putIfPresent(body, "description", description);
        if (extra != null) {
            body.putAll(extra);
        }
        return send(ApiRequest.post("/vlanPoolProfiles").jsonBody(body));
    }

    public JsonNode updateProfile(String profileId, Map<String, ?> fields) {
        return send(ApiRequest.put("/vlanPoolProfiles/" + profileId)
            .jsonBody(mutableCopy(fields)).notFoundAs(PROFILE, profileId));
    }

    public void deleteProfile(String profileId) {
        sendIgnoringBody(ApiRequest.delete("/vlanPoolProfiles/" + profileId).notFoundAs(PROFILE, profileId));
    }

    public JsonNode getVenueApManagementVlan(String venueId) {
        return send(ApiRequest.get("/venues/" + venueId + "/apManagementTrafficVlanSettings")
            .notFoundAs(Venues.KIND, venueId));
    }

    public JsonNode updateVenueApManagementVlan(String venueId, Map<String, ?> settings) {
        return send(ApiRequest.put("/venues/" + venueId + "/apManagementTrafficVlanSettings")
            .jsonBody(mutableCopy(settings)).notFoundAs(Venues.KIND, venueId));
    }

    public JsonNode getApManagementVlan(String venueId, String serialNumber) {
        return send(ApiRequest.get("/venues/" + venueId + "/aps/" + serialNumber + "/managementTrafficVlanSettings")
            .notFoundAs(AccessPoints.KIND, serialNumber));
    }

    public JsonNode updateApManagementVlan(String venueId, String serialNumber, Map<String, ?> settings) {
        return send(ApiRequest.put("/venues/" + venueId + "/aps/" + serialNumber + "/managementTrafficVlanSettings")
            .jsonBody(mutableCopy(settings)).notFoundAs(AccessPoints.KIND, serialNumber));
    }
}
