package org.tanzu.ruckusmcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.ruckusmcp.mcp.RuckusOneService;

import java.util.List;

/**
 * Main Spring Boot application class for the RUCKUS One MCP (Model Context Protocol) Server.
 * 
 * This application provides a Model Context Protocol server that connects to the
 * RUCKUS One cloud API and exposes network management operations (venues, access
 * points, switches, WiFi networks, DPSK services, identity groups) as tools that
 * can be consumed by AI assistants and other MCP clients.
 * 
 * Key features:
 * - OAuth2 client-credentials authentication with a cached, self-refreshing token
 * - Typed error taxonomy for API failures
 * - Supports Cloud Foundry deployment with service binding
 * - Uses Spring Boot configuration properties for flexible configuration
 * 
 * @author RUCKUS One MCP Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties
public class RuckusMcpApplication {

    /**
     * Main application entry point.
     * 
     * The MCP server identity is set as system properties before startup so that
     * it is "ruckus-one-mcp" version "1.0.0" regardless of what the environment
     * provides.
     * 
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        System.setProperty("spring.application.name", "ruckus-one-mcp");
        System.setProperty("spring.ai.mcp.server.name", "ruckus-one-mcp");
        System.setProperty("spring.ai.mcp.server.version", "1.0.0");

        SpringApplication.run(RuckusMcpApplication.class, args);
    }

    /**
     * Registers the RUCKUS One service tools with the MCP server.
     * 
     * @param ruckusOneService The service containing the RUCKUS One tools
     * @return List of ToolCallback objects representing the available MCP tools
     */
    @Bean
    public List<ToolCallback> registerTools(RuckusOneService ruckusOneService) {
        return List.of(ToolCallbacks.from(ruckusOneService));
    }
}
