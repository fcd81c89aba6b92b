package org.tanzu.ruckusmcp.config;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.ruckusmcp.client.ApiGateway;
import org.tanzu.ruckusmcp.client.ApiResult;
import org.tanzu.ruckusmcp.client.Credentials;
import org.tanzu.ruckusmcp.client.TokenAuthority;
import org.tanzu.ruckusmcp.exception.ApiException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class WebClientConfigTest {

    private static final String CSV = "id,name\n" + "identity,x\n".repeat(40_000);

    private HttpServer server;
    private String baseUrl;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/oauth2/token/", exchange -> {
            exchange.getRequestBody().readAllBytes();
            reply(exchange, "application/json", "{\"access_token\":\"local\",\"expires_in\":3600}");
        });
        server.createContext("/identities/csv", exchange -> reply(exchange, "text/csv", CSV));
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void defaultLimitReadsExportsLargerThanCodecDefault() {
        RuckusOneConfig config = new RuckusOneConfig();
        assertTrue(CSV.length() > 256 * 1024);

        ApiResult result = gateway(config).get("/identities/csv");

        assertEquals(CSV, result.asText());
    }

    @Test
    void configuredLimitIsEnforced() {
        RuckusOneConfig config = new RuckusOneConfig();
        config.setMaxInMemorySize(DataSize.ofKilobytes(64));

        ApiException e = assertThrows(ApiException.class, () -> gateway(config).get("/identities/csv"));

        assertTrue(e.getMessage().startsWith("Response too large"), e.getMessage());
    }

    private ApiGateway gateway(RuckusOneConfig config) {
        WebClient webClient = new WebClientConfig().webClientBuilder(config).build();
        Credentials credentials = new Credentials("client-1", "secret-1", "tenant-1", "na");
        TokenAuthority authority = new TokenAuthority(credentials, baseUrl, webClient, Clock.systemUTC());
        return new ApiGateway(authority, webClient, baseUrl);
    }

    private static void reply(HttpExchange exchange, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }
}
