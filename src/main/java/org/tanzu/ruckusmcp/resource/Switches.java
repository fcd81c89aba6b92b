package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;

import java.util.Map;

/**
 * Switch operations, including ports and switch-level VLANs.
 */
public class Switches extends ResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(Switches.class);

    static final String KIND = "Switch";

    public Switches(ApiGateway gateway) {
        super(gateway);
    }

    public JsonNode list(QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.defaults());
        logger.debug("Querying switches with data: {}", body);
        return send(ApiRequest.post("/venues/switches/query").jsonBody(body));
    }

    public JsonNode get(String venueId, String switchId) {
        return send(ApiRequest.get(switchPath(venueId, switchId)).notFoundAs(KIND, switchId));
    }

    public JsonNode update(String venueId, String switchId, Map<String, ?> fields) {
        return send(ApiRequest.put(switchPath(venueId, switchId))
            .jsonBody(mutableCopy(fields)).notFoundAs(KIND, switchId));
    }

    public JsonNode reboot(String venueId, String switchId) {
        logger.info("Rebooting switch {} in venue {}", switchId, venueId);
        return send(ApiRequest.post(switchPath(venueId, switchId) + "/reboot").notFoundAs(KIND, switchId));
    }

    public JsonNode getPorts(QueryRequest query) {
        Map<String, Object> body = QueryRequest.bodyOf(query, QueryRequest.defaults());
        return send(ApiRequest.post("/venues/switches/switchPorts/query").jsonBody(body));
    }

    public JsonNode configurePort(String venueId, String switchId, String portId, Map<String, ?> settings) {
        return send(ApiRequest.put(switchPath(venueId, switchId) + "/ports/" + portId)
            .jsonBody(mutableCopy(settings)).notFoundAs("Switch port", portId));
    }

    public JsonNode getVlans(String venueId, String switchId) {
        logger.debug("Getting VLANs for switch {} in venue {}", switchId, venueId);
        return send(ApiRequest.get(switchPath(venueId, switchId) + "/vlans").notFoundAs(KIND, switchId));
    }

    public JsonNode configureVlan(String venueId, String switchId, int vlanId, Map<String, ?> settings) {
        logger.debug("Configuring VLAN {} on switch {}", vlanId, switchId);
        return send(ApiRequest.put(switchPath(venueId, switchId) + "/vlans/" + vlanId)
            .jsonBody(mutableCopy(settings)).notFoundAs("VLAN", String.valueOf(vlanId)));
    }

    /**
     * Creates a VLAN on a switch.
     * 
     * @param vlanId VLAN number, 1-4094
     * @param settings further VLAN properties such as name or igmpSnooping
     * @throws org.tanzu.ruckusmcp.exception.ValidationException if vlanId is out of range
     */
    public JsonNode createVlan(String venueId, String switchId, int vlanId, Map<String, ?> settings) {
        VlanRange.check(vlanId);
        Map<String, Object> body = mutableCopy(null);
        body.put("id", vlanId);
        if (settings != null) {
            body.putAll(settings);
        }
        logger.info("Creating VLAN {} on switch {}", vlanId, switchId);
        return send(ApiRequest.post(switchPath(venueId, switchId) + "/vlans")
            .jsonBody(body).notFoundAs(KIND, switchId));
    }

    public void deleteVlan(String venueId, String switchId, int vlanId) {
        logger.info("Deleting VLAN {} from switch {}", vlanId, switchId);
        sendIgnoringBody(ApiRequest.delete(switchPath(venueId, switchId) + "/vlans/" + vlanId)
            .notFoundAs("VLAN", String.valueOf(vlanId)));
    }

    public JsonNode getStatistics(String venueId, String switchId) {
        return send(ApiRequest.get(switchPath(venueId, switchId) + "/statistics").notFoundAs(KIND, switchId));
    }

    private static String switchPath(String venueId, String switchId) {
        return "/venues/" + venueId + "/switches/" + switchId;
    }
}
