package org.tanzu.ruckusmcp.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.unit.DataSize;

import java.time.Duration;

/**
 * Configuration class for RUCKUS One connection settings.
 * 
 * This class uses Spring Boot's @ConfigurationProperties to bind the API
 * credentials from application.properties, environment variables
 * (RUCKUS_CLIENT_ID, RUCKUS_CLIENT_SECRET, ...) and Cloud Foundry service
 * bindings (via RuckusOneConfigProcessor).
 * 
 * Properties are bound using the "ruckus" prefix, so "ruckus.client-id",
 * "ruckus.tenant-id", etc. map to this class.
 */
@Component
@ConfigurationProperties(prefix = "ruckus")
public class RuckusOneConfig {

    /** OAuth2 client identifier */
    private String clientId;

    /** OAuth2 client secret */
    private String clientSecret;

    /** RUCKUS One tenant identifier */
    private String tenantId;

    /** Region code: na, eu or asia (default: na) */
    private String region = "na";

    /** Optional base URL replacing the regional endpoint, e.g. for a private deployment */
    private String baseUrl;

    /** TCP connect timeout for API calls */
    private Duration connectTimeout = Duration.ofSeconds(10);

    /** Time allowed for a response once a request has been written */
    private Duration responseTimeout = Duration.ofSeconds(60);

    /** Largest response body buffered in memory, e.g. a CSV export (default: 16MB) */
    private DataSize maxInMemorySize = DataSize.ofMegabytes(16);

    public String getClientId() { return clientId; }

    public void setClientId(String clientId) { this.clientId = clientId; }

    public String getClientSecret() { return clientSecret; }

    public void setClientSecret(String clientSecret) { this.clientSecret = clientSecret; }

    public String getTenantId() { return tenantId; }

    public void setTenantId(String tenantId) { this.tenantId = tenantId; }

    public String getRegion() { return region; }

    public void setRegion(String region) { this.region = region; }

    public String getBaseUrl() { return baseUrl; }

    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public Duration getConnectTimeout() { return connectTimeout; }

    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getResponseTimeout() { return responseTimeout; }

    public void setResponseTimeout(Duration responseTimeout) { this.responseTimeout = responseTimeout; }

    public DataSize getMaxInMemorySize() { return maxInMemorySize; }

    public void setMaxInMemorySize(DataSize maxInMemorySize) { this.maxInMemorySize = maxInMemorySize; }

    /**
     * Returns a string representation of the configuration.
     * 
     * The client secret is hidden so it never appears in logs.
     * 
     * @return String representation with the secret hidden
     */
    @Override
    public String toString() {
        return "RuckusOneConfig{" +
                "clientId='" + clientId + '\'' +
                ", clientSecret='[HIDDEN]'" +
                ", tenantId='" + tenantId + '\'' +
                ", region='" + region + '\'' +
                ", baseUrl='" + baseUrl + '\'' +
                ", connectTimeout=" + connectTimeout +
                ", responseTimeout=" + responseTimeout +
                ", maxInMemorySize=" + maxInMemorySize +
                '}';
    }
}
