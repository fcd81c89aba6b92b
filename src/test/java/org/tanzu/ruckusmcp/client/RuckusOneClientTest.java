package org.tanzu.ruckusmcp.client;

import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.ruckusmcp.config.RuckusOneConfig;
import org.tanzu.ruckusmcp.resource.QueryRequest;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class RuckusOneClientTest {

    @Test
    void modulesShareOneTokenCache() {
        StubExchange stub = new StubExchange()
            .enqueue(StubExchange.json(200, "{\"data\":[]}"))
            .enqueue(StubExchange.json(200, "{\"data\":[]}"));
        RuckusOneClient client = new RuckusOneClient(new Credentials("c", "s", "t", "na"),
            "https://api.example.test", stub.webClient(), new MutableClock(Instant.parse("2024-05-01T12:00:00Z")));

        client.venues().list(QueryRequest.defaults());
        client.switches().list(null);

        assertEquals(1, stub.tokenRequests().size());
        assertEquals(2, stub.apiRequests().size());
        assertSame(client.gateway().getTokenAuthority(), client.tokenAuthority());
    }

    @Test
    void regionalLibraryConstructorTargetsRegionHost() {
        RuckusOneClient client = new RuckusOneClient(new Credentials("c", "s", "t", "asia"), new StubExchange().webClient());

        assertEquals("https://api.asia.ruckus.cloud", client.gateway().getBaseUrl());
    }

    @Test
    void configuredBaseUrlOverridesRegion() {
        RuckusOneConfig config = new RuckusOneConfig();
        config.setClientId("c");
        config.setClientSecret("s");
        config.setTenantId("t");
        config.setRegion("eu");
        config.setBaseUrl("https://ruckus.internal.example/");

        RuckusOneClient client = new RuckusOneClient(config, WebClient.builder());

        assertEquals("https://ruckus.internal.example", client.gateway().getBaseUrl());
        assertEquals("https://ruckus.internal.example", client.tokenAuthority().getBaseUrl());
    }

    @Test
    void missingCredentialsFailOnFirstUse() {
        RuckusOneClient client = new RuckusOneClient(new RuckusOneConfig(), WebClient.builder());

        IllegalStateException e = assertThrows(IllegalStateException.class, client::venues);

        assertTrue(e.getMessage().contains("ruckus.client-id"), e.getMessage());
    }
}
