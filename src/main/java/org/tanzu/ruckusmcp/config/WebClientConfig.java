package org.tanzu.ruckusmcp.config;

import io.netty.channel.ChannelOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

/**
 * Configuration class for the WebClient used to talk to the RUCKUS One API.
 * 
 * The builder is shared by the token exchange and by every API call. It sets
 * the transport timeouts from RuckusOneConfig on a Reactor Netty HttpClient,
 * and raises the codec buffer limit to ruckus.max-in-memory-size so large
 * query pages and CSV exports can be read whole.
 * No default Accept header is set: several endpoints answer with vendor JSON
 * types (application/vnd.ruckus.v1+json) or text/csv. Authorization and
 * Content-Type are set per request, since they differ between the token
 * exchange (form body, no bearer) and resource calls.
 */
@Configuration
public class WebClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(WebClientConfig.class);

    /**
     * Creates the WebClient.Builder for RUCKUS One API communication.
     * 
     * @param ruckusOneConfig The configuration holding the transport timeouts
     * @return A configured WebClient.Builder
     */
    @Bean
    public WebClient.Builder webClientBuilder(RuckusOneConfig ruckusOneConfig) {
        logger.info("Configuring WebClient.Builder for RUCKUS One region '{}' (connectTimeout={}, responseTimeout={}, maxInMemorySize={})",
                   ruckusOneConfig.getRegion(), ruckusOneConfig.getConnectTimeout(), ruckusOneConfig.getResponseTimeout(),
                   ruckusOneConfig.getMaxInMemorySize());

        HttpClient httpClient = HttpClient.create()
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) ruckusOneConfig.getConnectTimeout().toMillis())
            .responseTimeout(ruckusOneConfig.getResponseTimeout());

        int maxInMemorySize = (int) ruckusOneConfig.getMaxInMemorySize().toBytes();

        return WebClient.builder()
            .clientConnector(new ReactorClientHttpConnector(httpClient))
            .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(maxInMemorySize));
    }
}
