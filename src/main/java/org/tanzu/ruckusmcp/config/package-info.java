/**
 * Configuration for the RUCKUS One MCP server.
 *
 * <p>Provides API credentials and transport settings ({@link org.tanzu.ruckusmcp.config.RuckusOneConfig}),
 * Cloud Foundry VCAP_SERVICES processing ({@link org.tanzu.ruckusmcp.config.RuckusOneConfigProcessor}),
 * and WebClient setup with transport timeouts ({@link org.tanzu.ruckusmcp.config.WebClientConfig}).
 */
package org.tanzu.ruckusmcp.config;
