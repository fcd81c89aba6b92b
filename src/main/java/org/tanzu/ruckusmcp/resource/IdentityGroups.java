package org.tanzu.ruckusmcp.resource;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiRequest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Identity groups, their associations, and identity creation within a group.
 */
public class IdentityGroups extends ResourceModule {

    private static final Logger logger = LoggerFactory.getLogger(IdentityGroups.class);

    static final String KIND = "Identity group";

    public IdentityGroups(ApiGateway gateway) {
        super(gateway);
    }

    public JsonNode list() {
        return send(ApiRequest.get("/identityGroups"));
    }

    /**
     * Queries identity groups. Each filter argument may be null.
     */
    public JsonNode query(int page, int pageSize, String certificateTemplateId, String dpskPoolId,
                          String policySetId, String propertyId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("page", page);
        body.put("size", pageSize);
        putIfPresent(body, "certificateTemplateId", certificateTemplateId);
        putIfPresent(body, "dpskPoolId", dpskPoolId);
        putIfPresent(body, "policySetId", policySetId);
        putIfPresent(body, "propertyId", propertyId);
        logger.debug("Querying identity groups with parameters: {}", body);
        return send(ApiRequest.post("/identityGroups/query").jsonBody(body));
    }

    public JsonNode get(String groupId) {
        return send(ApiRequest.get(groupPath(groupId)).notFoundAs(KIND, groupId));
    }

    /**
     * Creates an identity group. Optional associations may be null.
     */
    public JsonNode create(String name, String description, String dpskPoolId, String certificateTemplateId,
                           String policySetId, String propertyId) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        putIfPresent(body, "description", description);
        putIfPresent(body, "dpskPoolId", dpskPoolId);
        putIfPresent(body, "certificateTemplateId", certificateTemplateId);
        putIfPresent(body, "policySetId", policySetId);
        putIfPresent(body, "propertyId", propertyId);
        logger.info("Creating identity group '{}'", name);
        return send(ApiRequest.post("/identityGroups").jsonBody(body));
    }

    public JsonNode update(String groupId, Map<String, ?> fields) {
        return send(ApiRequest.put(groupPath(groupId)).jsonBody(mutableCopy(fields)).notFoundAs(KIND, groupId));
    }

    public void delete(String groupId) {
        logger.info("Deleting identity group {}", groupId);
        sendIgnoringBody(ApiRequest.delete(groupPath(groupId)).notFoundAs(KIND, groupId));
    }

    public JsonNode associateDpskPool(String groupId, String dpskPoolId) {
        return send(ApiRequest.put(groupPath(groupId) + "/dpskPools/" + dpskPoolId).notFoundAs(KIND, groupId));
    }

    public JsonNode associatePolicySet(String groupId, String policySetId) {
        return send(ApiRequest.put(groupPath(groupId) + "/policySets/" + policySetId).notFoundAs(KIND, groupId));
    }

    public JsonNode getIdentity(String groupId, String identityId) {
        return send(ApiRequest.get(groupPath(groupId) + "/identities/" + identityId)
            .notFoundAs(Identities.KIND, identityId));
    }

    /**
     * Creates an identity in a group.
     * 
     * @param vlan optional VLAN assignment, 1-4094
     * @param devices optional devices to bind
     * @throws org.tanzu.ruckusmcp.exception.ValidationException if the VLAN is out of range
     */
    public JsonNode createIdentity(String groupId, String name, String email, String description,
                                   String expirationDate, Integer vlan, List<Map<String, Object>> devices) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        putIfPresent(body, "email", email);
        putIfPresent(body, "description", description);
        putIfPresent(body, "expirationDate", expirationDate);
        if (vlan != null) {
            VlanRange.check(vlan);
            body.put("vlan", vlan);
        }
        if (devices != null && !devices.isEmpty()) {
            body.put("devices", devices);
        }
        logger.debug("Creating identity in group {} with data: {}", groupId, body);
        return send(ApiRequest.post(groupPath(groupId) + "/identities").jsonBody(body).notFoundAs(KIND, groupId));
    }

    private static String groupPath(String groupId) {
        return "/identityGroups/" + groupId;
    }
}
