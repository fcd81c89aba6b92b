package org.tanzu.ruckusmcp.client;

/**
 * OAuth2 client credentials for one RUCKUS One tenant.
 */
public final class Credentials {

    private final String clientId;
    private final String clientSecret;
    private final String tenantId;
    private final String region;

    /**
     * @param clientId OAuth2 client ID
     * @param clientSecret OAuth2 client secret
     * @param tenantId RUCKUS One tenant ID
     * @param region region code (na, eu, asia); null means na
     * @throws IllegalArgumentException if client ID, secret or tenant ID is missing
     */
    public Credentials(String clientId, String clientSecret, String tenantId, String region) {
        if (isBlank(clientId) || isBlank(clientSecret) || isBlank(tenantId)) {
            throw new IllegalArgumentException("clientId, clientSecret and tenantId must all be provided");
        }
        this.clientId = clientId;
        this.clientSecret = clientSecret;
        this.tenantId = tenantId;
        this.region = region == null ? Region.NA.getCode() : region;
    }

    public String getClientId() { return clientId; }

    public String getClientSecret() { return clientSecret; }

    public String getTenantId() { return tenantId; }

    public String getRegion() { return region; }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "Credentials{" +
                "clientId='" + clientId + '\'' +
                ", clientSecret='[HIDDEN]'" +
                ", tenantId='" + tenantId + '\'' +
                ", region='" + region + '\'' +
                '}';
    }
}
