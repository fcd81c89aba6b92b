package org.tanzu.ruckusmcp.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.DependsOn;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.tanzu.ruckusmcp.config.RuckusOneConfig;
import org.tanzu.ruckusmcp.resource.AccessPoints;
import org.tanzu.ruckusmcp.resource.DpskServices;
import org.tanzu.ruckusmcp.resource.Identities;
import org.tanzu.ruckusmcp.resource.IdentityGroups;
import org.tanzu.ruckusmcp.resource.Switches;
import org.tanzu.ruckusmcp.resource.Venues;
import org.tanzu.ruckusmcp.resource.VlanPools;
import org.tanzu.ruckusmcp.resource.WifiNetworks;

import java.time.Clock;

/**
 * Entry point to the RUCKUS One API.
 * 
 * A client owns one {@link TokenAuthority} and one {@link ApiGateway}, and hands
 * the gateway to every resource module, so all modules of a client share a
 * single cached token.
 * 
 * As a Spring bean the client reads its credentials from {@link RuckusOneConfig}
 * on first use rather than at startup. The server can therefore start before a
 * Cloud Foundry service binding is available; a missing credential surfaces as
 * an {@link IllegalStateException} on the first tool call.
 * 
 * Used as a library, the client is constructed directly from {@link Credentials}.
 */
@Component
@DependsOn("ruckusOneConfigProcessor")
public class RuckusOneClient {

    private static final Logger logger = LoggerFactory.getLogger(RuckusOneClient.class);

    private final RuckusOneConfig config;
    private final WebClient webClient;
    private final Clock clock;

    private final Object initLock = new Object();
    private volatile Session session;

    /**
     * Creates the Spring-managed client.
     * 
     * @param config RUCKUS One configuration, possibly completed from VCAP_SERVICES
     * @param webClientBuilder builder carrying the configured timeouts
     */
    @Autowired
    public RuckusOneClient(RuckusOneConfig config, WebClient.Builder webClientBuilder) {
        this.config = config;
        this.webClient = webClientBuilder.build();
        this.clock = Clock.systemUTC();
    }

    /**
     * Creates a client for the regional endpoint of the given credentials.
     */
    public RuckusOneClient(Credentials credentials, WebClient webClient) {
        this(credentials, Region.resolve(credentials.getRegion()).baseUrl(), webClient, Clock.systemUTC());
    }

    /**
     * Creates a client against an explicit base URL.
     * 
     * @param credentials client credentials
     * @param baseUrl scheme and host of the API
     * @param webClient transport
     * @param clock time source for token expiry
     */
    public RuckusOneClient(Credentials credentials, String baseUrl, WebClient webClient, Clock clock) {
        this.config = null;
        this.webClient = webClient;
        this.clock = clock;
        this.session = new Session(credentials, baseUrl, webClient, clock);
    }

    public Venues venues() { return session().venues; }

    public AccessPoints accessPoints() { return session().accessPoints; }

    public Switches switches() { return session().switches; }

    public WifiNetworks wifiNetworks() { return session().wifiNetworks; }

    public VlanPools vlanPools() { return session().vlanPools; }

    public DpskServices dpskServices() { return session().dpskServices; }

    public Identities identities() { return session().identities; }

    public IdentityGroups identityGroups() { return session().identityGroups; }

    public ApiGateway gateway() { return session().gateway; }

    public TokenAuthority tokenAuthority() { return session().tokenAuthority; }

    private Session session() {
        Session current = session;
        if (current != null) {
            return current;
        }
        synchronized (initLock) {
            if (session == null) {
                session = createSession();
            }
            return session;
        }
    }

    private Session createSession() {
        Credentials credentials;
        try {
            credentials = new Credentials(config.getClientId(), config.getClientSecret(),
                config.getTenantId(), config.getRegion());
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("RUCKUS One is not configured: " + e.getMessage()
                + " (set ruckus.client-id, ruckus.client-secret and ruckus.tenant-id)", e);
        }
        String baseUrl = StringUtils.hasText(config.getBaseUrl())
            ? config.getBaseUrl()
            : Region.resolve(credentials.getRegion()).baseUrl();
        logger.info("Initializing RUCKUS One client for tenant {} at {}", credentials.getTenantId(), baseUrl);
        return new Session(credentials, baseUrl, webClient, clock);
    }

    /** Token authority, gateway and resource modules of one tenant. */
    private static final class Session {

        private final TokenAuthority tokenAuthority;
        private final ApiGateway gateway;
        private final Venues venues;
        private final AccessPoints accessPoints;
        private final Switches switches;
        private final WifiNetworks wifiNetworks;
        private final VlanPools vlanPools;
        private final DpskServices dpskServices;
        private final Identities identities;
        private final IdentityGroups identityGroups;

        private Session(Credentials credentials, String baseUrl, WebClient webClient, Clock clock) {
            this.tokenAuthority = new TokenAuthority(credentials, baseUrl, webClient, clock);
            this.gateway = new ApiGateway(tokenAuthority, webClient, baseUrl);
            this.venues = new Venues(gateway);
            this.accessPoints = new AccessPoints(gateway);
            this.switches = new Switches(gateway);
            this.wifiNetworks = new WifiNetworks(gateway);
            this.vlanPools = new VlanPools(gateway);
            this.dpskServices = new DpskServices(gateway);
            this.identities = new Identities(gateway);
            this.identityGroups = new IdentityGroups(gateway);
        }
    }
}
