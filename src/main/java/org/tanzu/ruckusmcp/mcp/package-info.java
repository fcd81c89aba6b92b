/**
 * MCP tool surface of the RUCKUS One server.
 *
 * <p>{@link org.tanzu.ruckusmcp.mcp.RuckusOneService} exposes selected client
 * operations as Spring AI tools, registered with the MCP server by
 * {@link org.tanzu.ruckusmcp.RuckusMcpApplication}.
 */
package org.tanzu.ruckusmcp.mcp;
