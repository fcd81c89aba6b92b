/**
 * Per-resource RUCKUS One API modules.
 *
 * <p>Each module wraps one area of the API (venues, access points, switches,
 * WiFi networks, VLAN pools, DPSK services, identities, identity groups) and is
 * constructed with the {@link org.tanzu.ruckusmcp.client.ApiGateway} of its
 * client session. Responses are returned as Jackson {@code JsonNode}s.
 */
package org.tanzu.ruckusmcp.resource;
