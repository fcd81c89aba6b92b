package org.tanzu.ruckusmcp;

import org.junit.jupiter.api.Test;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.TestPropertySource;
import org.tanzu.ruckusmcp.client.RuckusOneClient;
import org.tanzu.ruckusmcp.config.RuckusOneConfig;
import org.tanzu.ruckusmcp.mcp.RuckusOneService;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.NONE)
@TestPropertySource(properties = {
    "ruckus.client-id=test-client",
    "ruckus.client-secret=test-secret",
    "ruckus.tenant-id=test-tenant",
    "ruckus.region=eu"
})
class RuckusMcpApplicationTests {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private RuckusOneConfig config;

    @Autowired
    private RuckusOneClient client;

    @Autowired
    private RuckusOneService ruckusOneService;

    @Test
    void contextLoads() {
        assertNotNull(ruckusOneService);
    }

    @Test
    void propertiesAreBound() {
        assertEquals("test-tenant", config.getTenantId());
        assertEquals("eu", config.getRegion());
        assertEquals("https://api.eu.ruckus.cloud", client.gateway().getBaseUrl());
    }

    @Test
    void toolsAreRegistered() {
        List<?> tools = context.getBean("registerTools", List.class);

        List<String> names = tools.stream()
            .map(ToolCallback.class::cast)
            .map(tool -> tool.getToolDefinition().name())
            .collect(Collectors.toList());
        assertTrue(names.contains("listVenues"), names.toString());
        assertTrue(names.contains("deployWifiNetworkToVenue"), names.toString());
        assertTrue(names.contains("refreshApiToken"), names.toString());
    }
}
