package org.tanzu.ruckusmcp.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.tanzu.ruckusmcp.client.RuckusOneClient;
import org.tanzu.ruckusmcp.client.TokenAuthority;
import org.tanzu.ruckusmcp.resource.QueryRequest;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Service class that provides MCP (Model Context Protocol) tools for RUCKUS One operations.
 * 
 * This service is the bridge between the MCP server and the RUCKUS One client.
 * It exposes a small set of inventory and lifecycle operations as MCP tools
 * that can be consumed by AI assistants and other MCP clients:
 * - listVenues() / getVenue(): venue inventory
 * - listAccessPoints(), rebootAccessPoint(): access points, optionally per venue
 * - listSwitches(), rebootSwitch(): switches
 * - listWifiNetworks(), deployWifiNetworkToVenue(): WiFi networks
 * - listDpskServices(): DPSK services
 * - listIdentityGroups(): identity groups
 * - refreshApiToken(): forces a new OAuth2 token
 * 
 * Each tool logs its invocation and converts the raw API response into small
 * info objects. Failures are logged and rethrown; the RUCKUS One exception
 * carries the API's own error message, which the MCP client sees as the tool error.
 */
@Service
public class RuckusOneService {

    private static final Logger logger = LoggerFactory.getLogger(RuckusOneService.class);

    /** The RUCKUS One client shared by all tools */
    private final RuckusOneClient client;

    /**
     * Constructs a new RuckusOneService with the specified client.
     * 
     * @param client The RUCKUS One client
     */
    public RuckusOneService(RuckusOneClient client) {
        this.client = client;
        logger.info("RuckusOneService initialized with RuckusOneClient");
    }

    /**
     * MCP tool: Lists the venues of the tenant.
     * 
     * @param searchString optional text to search venue names for
     * @return List of VenueInfo objects
     */
    @Tool(description = "List the venues (sites) of the RUCKUS One tenant")
    public List<VenueInfo> listVenues(
            @ToolParam(description = "Optional text to search venue names for", required = false) String searchString) {
        logger.info("=== MCP TOOL CALLED: listVenues() ===");
        try {
            QueryRequest query = QueryRequest.defaults();
            if (StringUtils.hasText(searchString)) {
                query.searchString(searchString).searchTargetFields(List.of("name"));
            }
            List<VenueInfo> result = new ArrayList<>();
            for (JsonNode venue : dataOf(client.venues().list(query))) {
                result.add(VenueInfo.from(venue));
            }
            logger.info("Retrieved {} venues from RUCKUS One", result.size());
            return result;
        } catch (RuntimeException e) {
            logger.error("Failed to list venues: {}", e.getMessage(), e);
            throw e;
        }
    }

    /**
     * MCP tool: Gets one venue by ID.
     * 
     * @param venueId The venue ID
     * @return VenueInfo for the venue
     */
    @Tool(description = "Get the details of one venue. Parameter: venueId (String) - the venue ID")
    public VenueInfo getVenue(String venueId) {
        logger.info("=== MCP TOOL CALLED: getVenue({}) ===", venueId);
        try {
            return VenueInfo.from(client.venues().get(venueId));
        } catch (RuntimeException e) {
            logger.error("Failed to get venue '{}': {}", venueId, e.getMessage(), e);
            throw e;
        }
    }

    /**
     * MCP tool: Lists access points, across the tenant or in one venue.
     * 
     * @param venueId optional venue ID to restrict the listing to
     * @return List of AccessPointInfo objects
     */
    @Tool(description = "List access points, optionally restricted to one venue")
    public List<AccessPointInfo> listAccessPoints(
            @ToolParam(description = "Optional venue ID to list access points for", required = false) String venueId) {
        logger.info("=== MCP TOOL CALLED: listAccessPoints({}) ===", venueId);
        try {
            QueryRequest query = QueryRequest.defaults();
            if (StringUtils.hasText(venueId)) {
                query.filters(List.of(Map.of("type", "VENUE", "value", venueId)));
            }
            List<AccessPointInfo> result = new ArrayList<>();
            for (JsonNode ap : dataOf(client.accessPoints().list(query))) {
                result.add(AccessPointInfo.from(ap));
            }
            logger.info("Retrieved {} access points from RUCKUS One", result.size());
            return result;
        } catch (RuntimeException e) {
            logger.error("Failed to list access points: {}", e.getMessage(), e);
            throw e;
        }
    }

    @Tool(description = "Reboot an access point. Parameters: venueId (String) - the venue of the AP, serialNumber (String) - the AP serial number")
    public String rebootAccessPoint(String venueId, String serialNumber) {
        logger.info("=== MCP TOOL CALLED: rebootAccessPoint({}, {}) ===", venueId, serialNumber);
        try {
            client.accessPoints().reboot(venueId, serialNumber);
            return "Reboot requested for access point " + serialNumber;
        } catch (RuntimeException e) {
            logger.error("Failed to reboot access point '{}': {}", serialNumber, e.getMessage(), e);
            throw e;
        }
    }

    @Tool(description = "List the switches of the RUCKUS One tenant")
    public List<SwitchInfo> listSwitches() {
        logger.info("=== MCP TOOL CALLED: listSwitches() ===");
        try {
            List<SwitchInfo> result = new ArrayList<>();
            for (JsonNode sw : dataOf(client.switches().list(QueryRequest.defaults()))) {
                result.add(SwitchInfo.from(sw));
            }
            logger.info("Retrieved {} switches from RUCKUS One", result.size());
            return result;
        } catch (RuntimeException e) {
            logger.error("Failed to list switches: {}", e.getMessage(), e);
            throw e;
        }
    }

    @Tool(description = "Reboot a switch. Parameters: venueId (String) - the venue of the switch, switchId (String) - the switch ID")
    public String rebootSwitch(String venueId, String switchId) {
        logger.info("=== MCP TOOL CALLED: rebootSwitch({}, {}) ===", venueId, switchId);
        try {
            client.switches().reboot(venueId, switchId);
            return "Reboot requested for switch " + switchId;
        } catch (RuntimeException e) {
            logger.error("Failed to reboot switch '{}': {}", switchId, e.getMessage(), e);
            throw e;
        }
    }

    @Tool(description = "List the WiFi networks (WLANs) of the RUCKUS One tenant")
    public List<WifiNetworkInfo> listWifiNetworks() {
        logger.info("=== MCP TOOL CALLED: listWifiNetworks() ===");
        try {
            List<WifiNetworkInfo> result = new ArrayList<>();
            for (JsonNode wlan : dataOf(client.wifiNetworks().list(QueryRequest.defaults()))) {
                result.add(WifiNetworkInfo.from(wlan));
            }
            logger.info("Retrieved {} WiFi networks from RUCKUS One", result.size());
            return result;
        } catch (RuntimeException e) {
            logger.error("Failed to list WiFi networks: {}", e.getMessage(), e);
            throw e;
        }
    }

    /**
     * MCP tool: Deploys a WiFi network to a venue.
     * 
     * This is the one tool that changes network configuration for end users,
     * so the description asks the assistant to confirm with the user first.
     */
    @Tool(description = "Deploy a WiFi network to a venue so its access points broadcast it. Confirm with the user before calling.")
    public String deployWifiNetworkToVenue(
            @ToolParam(description = "The WiFi network ID") String wifiNetworkId,
            @ToolParam(description = "The venue ID") String venueId,
            @ToolParam(description = "Optional AP group ID to limit the deployment to", required = false) String apGroupId) {
        logger.info("=== MCP TOOL CALLED: deployWifiNetworkToVenue({}, {}) ===", wifiNetworkId, venueId);
        try {
            client.wifiNetworks().deployToVenue(wifiNetworkId, venueId, apGroupId, null);
            return "WiFi network " + wifiNetworkId + " deployed to venue " + venueId;
        } catch (RuntimeException e) {
            logger.error("Failed to deploy WiFi network '{}' to venue '{}': {}", wifiNetworkId, venueId, e.getMessage(), e);
            throw e;
        }
    }

    @Tool(description = "List the DPSK (dynamic pre-shared key) services of the RUCKUS One tenant")
    public List<DpskServiceInfo> listDpskServices() {
        logger.info("=== MCP TOOL CALLED: listDpskServices() ===");
        try {
            List<DpskServiceInfo> result = new ArrayList<>();
            for (JsonNode service : client.dpskServices().listServices(null)) {
                result.add(DpskServiceInfo.from(service));
            }
            logger.info("Retrieved {} DPSK services from RUCKUS One", result.size());
            return result;
        } catch (RuntimeException e) {
            logger.error("Failed to list DPSK services: {}", e.getMessage(), e);
            throw e;
        }
    }

    @Tool(description = "List the identity groups of the RUCKUS One tenant")
    public List<IdentityGroupInfo> listIdentityGroups() {
        logger.info("=== MCP TOOL CALLED: listIdentityGroups() ===");
        try {
            JsonNode response = client.identityGroups().list();
            JsonNode groups = response.isArray() ? response : response.path("content");
            List<IdentityGroupInfo> result = new ArrayList<>();
            for (JsonNode group : groups) {
                result.add(IdentityGroupInfo.from(group));
            }
            logger.info("Retrieved {} identity groups from RUCKUS One", result.size());
            return result;
        } catch (RuntimeException e) {
            logger.error("Failed to list identity groups: {}", e.getMessage(), e);
            throw e;
        }
    }

    /**
     * MCP tool: Discards the cached API token and authenticates again.
     * 
     * Useful after rotating the client secret or when the API starts
     * rejecting a token before its recorded expiry.
     */
    @Tool(description = "Force a new RUCKUS One API token to be requested")
    public String refreshApiToken() {
        logger.info("=== MCP TOOL CALLED: refreshApiToken() ===");
        try {
            TokenAuthority authority = client.tokenAuthority();
            authority.forceRefresh();
            return "API token refreshed, valid until " + authority.getCachedToken().getExpiresAt();
        } catch (RuntimeException e) {
            logger.error("Failed to refresh API token: {}", e.getMessage(), e);
            throw e;
        }
    }

    /** Query endpoints wrap their items in "data". */
    private static JsonNode dataOf(JsonNode response) {
        return response.isArray() ? response : response.path("data");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Data structure representing a RUCKUS One venue.
     */
    public static class VenueInfo {
        private final String id;
        private final String name;
        private final String addressLine;
        private final String city;
        private final String country;
        private final String status;

        public VenueInfo(String id, String name, String addressLine, String city, String country, String status) {
            this.id = id;
            this.name = name;
            this.addressLine = addressLine;
            this.city = city;
            this.country = country;
            this.status = status;
        }

        static VenueInfo from(JsonNode venue) {
            JsonNode address = venue.path("address");
            return new VenueInfo(
                text(venue, "id"),
                text(venue, "name"),
                venue.has("addressLine") ? text(venue, "addressLine") : text(address, "addressLine"),
                venue.has("city") ? text(venue, "city") : text(address, "city"),
                venue.has("country") ? text(venue, "country") : text(address, "country"),
                text(venue, "status"));
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getAddressLine() { return addressLine; }
        public String getCity() { return city; }
        public String getCountry() { return country; }
        public String getStatus() { return status; }

        @Override
        public String toString() {
            return "VenueInfo{id='" + id + "', name='" + name + "', city='" + (city != null ? city : "N/A") + "'}";
        }
    }

    /**
     * Data structure representing an access point.
     */
    public static class AccessPointInfo {
        private final String serialNumber;
        private final String name;
        private final String macAddress;
        private final String model;
        private final String status;
        private final String firmwareVersion;
        private final String venueId;

        public AccessPointInfo(String serialNumber, String name, String macAddress, String model,
                               String status, String firmwareVersion, String venueId) {
            this.serialNumber = serialNumber;
            this.name = name;
            this.macAddress = macAddress;
            this.model = model;
            this.status = status;
            this.firmwareVersion = firmwareVersion;
            this.venueId = venueId;
        }

        static AccessPointInfo from(JsonNode ap) {
            return new AccessPointInfo(text(ap, "serialNumber"), text(ap, "name"), text(ap, "macAddress"),
                text(ap, "model"), text(ap, "status"), text(ap, "firmwareVersion"), text(ap, "venueId"));
        }

        public String getSerialNumber() { return serialNumber; }
        public String getName() { return name; }
        public String getMacAddress() { return macAddress; }
        public String getModel() { return model; }
        public String getStatus() { return status; }
        public String getFirmwareVersion() { return firmwareVersion; }
        public String getVenueId() { return venueId; }

        @Override
        public String toString() {
            return "AccessPointInfo{serialNumber='" + serialNumber + "', name='" + name + "', status='" + status + "'}";
        }
    }

    /**
     * Data structure representing a switch.
     */
    public static class SwitchInfo {
        private final String id;
        private final String name;
        private final String serialNumber;
        private final String model;
        private final String status;
        private final String venueId;

        public SwitchInfo(String id, String name, String serialNumber, String model, String status, String venueId) {
            this.id = id;
            this.name = name;
            this.serialNumber = serialNumber;
            this.model = model;
            this.status = status;
            this.venueId = venueId;
        }

        static SwitchInfo from(JsonNode sw) {
            return new SwitchInfo(text(sw, "id"), text(sw, "name"), text(sw, "serialNumber"),
                text(sw, "model"), text(sw, "status"), text(sw, "venueId"));
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getSerialNumber() { return serialNumber; }
        public String getModel() { return model; }
        public String getStatus() { return status; }
        public String getVenueId() { return venueId; }

        @Override
        public String toString() {
            return "SwitchInfo{id='" + id + "', name='" + name + "', status='" + status + "'}";
        }
    }

    /**
     * Data structure representing a WiFi network.
     */
    public static class WifiNetworkInfo {
        private final String id;
        private final String name;
        private final String ssid;
        private final int clientCount;

        public WifiNetworkInfo(String id, String name, String ssid, int clientCount) {
            this.id = id;
            this.name = name;
            this.ssid = ssid;
            this.clientCount = clientCount;
        }

        static WifiNetworkInfo from(JsonNode wlan) {
            return new WifiNetworkInfo(text(wlan, "id"), text(wlan, "name"), text(wlan, "ssid"),
                wlan.path("clientCount").asInt(0));
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getSsid() { return ssid; }
        public int getClientCount() { return clientCount; }

        @Override
        public String toString() {
            return "WifiNetworkInfo{id='" + id + "', name='" + name + "', ssid='" + ssid + "'}";
        }
    }

    public static class DpskServiceInfo {
        private final String id;
        private final String name;

        public DpskServiceInfo(String id, String name) {
            this.id = id;
            this.name = name;
        }

        static DpskServiceInfo from(JsonNode service) {
            return new DpskServiceInfo(text(service, "id"), text(service, "name"));
        }

        public String getId() { return id; }
        public String getName() { return name; }

        @Override
        public String toString() {
            return "DpskServiceInfo{id='" + id + "', name='" + name + "'}";
        }
    }

    public static class IdentityGroupInfo {
        private final String id;
        private final String name;
        private final String description;
        private final String dpskPoolId;

        public IdentityGroupInfo(String id, String name, String description, String dpskPoolId) {
            this.id = id;
            this.name = name;
            this.description = description;
            this.dpskPoolId = dpskPoolId;
        }

        static IdentityGroupInfo from(JsonNode group) {
            return new IdentityGroupInfo(text(group, "id"), text(group, "name"),
                text(group, "description"), text(group, "dpskPoolId"));
        }

        public String getId() { return id; }
        public String getName() { return name; }
        public String getDescription() { return description; }
        public String getDpskPoolId() { return dpskPoolId; }

        @Override
        public String toString() {
            return "IdentityGroupInfo{id='" + id + "', name='" + name + "'}";
        }
    }
}
