package org.tanzu.ruckusmcp.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import jakarta.annotation.PostConstruct;

/**
 * Processor for Cloud Foundry service bindings carrying RUCKUS One credentials.
 * 
 * When the application is bound to a user-provided service whose name contains
 * "ruckus", Cloud Foundry exposes its credentials through VCAP_SERVICES. This
 * processor runs after the configuration properties are bound and fills in any
 * credential that is still missing (null, blank, or an unresolved ${...}
 * placeholder). Values that are already set are left untouched.
 * 
 * Configuration priority (highest to lowest):
 * 1. Environment variables / application.properties, when complete
 * 2. Cloud Foundry service binding (VCAP_SERVICES)
 * 3. Default values
 */
@Component
public class RuckusOneConfigProcessor {

    private static final Logger logger = LoggerFactory.getLogger(RuckusOneConfigProcessor.class);

    private final RuckusOneConfig ruckusOneConfig;

    private final Environment environment;

    private final ObjectMapper objectMapper = new ObjectMapper();

    public RuckusOneConfigProcessor(RuckusOneConfig ruckusOneConfig, Environment environment) {
        this.ruckusOneConfig = ruckusOneConfig;
        this.environment = environment;
    }

    /**
     * Fills missing RUCKUS One credentials from VCAP_SERVICES.
     * 
     * A malformed VCAP_SERVICES document is logged and ignored; the client will
     * then fail on its first token request with an authentication error.
     */
    @PostConstruct
    public void processVCapServices() {
        logger.info("Processing RUCKUS One configuration...");
        logger.info("Current config - Tenant: '{}', Client ID: '{}', Region: '{}', Secret: '{}'",
                   ruckusOneConfig.getTenantId(),
                   ruckusOneConfig.getClientId(),
                   ruckusOneConfig.getRegion(),
                   ruckusOneConfig.getClientSecret() != null ? "***" : "null");

        if (isConfigurationComplete()) {
            logger.info("RUCKUS One configuration is complete from environment variables");
            return;
        }

        String vcapServices = environment.getProperty("VCAP_SERVICES");
        if (vcapServices == null || vcapServices.isEmpty()) {
            logger.warn("VCAP_SERVICES not available and RUCKUS One configuration incomplete");
            return;
        }

        try {
            JsonNode credentials = findRuckusCredentials(objectMapper.readTree(vcapServices));
            if (credentials != null) {
                updateConfigurationFromVCap(credentials);
                logger.info("RUCKUS One configuration updated from VCAP_SERVICES");
            } else {
                logger.warn("No RUCKUS One service found in VCAP_SERVICES");
            }
        } catch (JsonProcessingException e) {
            logger.error("Error processing VCAP_SERVICES: {}", e.getOriginalMessage());
        }
    }

    /**
     * Checks that client id, client secret and tenant id are all present and
     * not placeholders.
     * 
     * @return true if the configuration is complete, false otherwise
     */
    boolean isConfigurationComplete() {
        boolean clientIdValid = isSet(ruckusOneConfig.getClientId());
        boolean secretValid = isSet(ruckusOneConfig.getClientSecret());
        boolean tenantValid = isSet(ruckusOneConfig.getTenantId());

        logger.debug("Configuration validation - Client ID valid: {}, Secret valid: {}, Tenant valid: {}",
                    clientIdValid, secretValid, tenantValid);

        return clientIdValid && secretValid && tenantValid;
    }

    /**
     * Finds the credentials of the first bound service whose name contains "ruckus".
     * 
     * @param vcapServicesNode The parsed VCAP_SERVICES JSON node
     * @return The credentials node, or null if no matching service is bound
     */
    private JsonNode findRuckusCredentials(JsonNode vcapServicesNode) {
        for (JsonNode serviceNode : vcapServicesNode) {
            for (JsonNode service : serviceNode) {
                String serviceName = service.path("name").asText();
                logger.debug("Found service: {}", serviceName);
                if (serviceName.toLowerCase().contains("ruckus")) {
                    logger.info("Found RUCKUS One service: {}", serviceName);
                    return service.path("credentials");
                }
            }
        }
        return null;
    }

    /**
     * Copies credentials into the configuration where the current value is missing.
     * Both snake_case and camelCase credential keys are accepted.
     * 
     * @param credentials The credentials node from VCAP_SERVICES
     */
    private void updateConfigurationFromVCap(JsonNode credentials) {
        if (!isSet(ruckusOneConfig.getClientId())) {
            String clientId = credential(credentials, "client_id", "clientId");
            ruckusOneConfig.setClientId(clientId);
            logger.info("Set client ID from VCAP: {}", clientId);
        }

        if (!isSet(ruckusOneConfig.getClientSecret())) {
            ruckusOneConfig.setClientSecret(credential(credentials, "client_secret", "clientSecret"));
            logger.info("Set client secret from VCAP: ***");
        }

        if (!isSet(ruckusOneConfig.getTenantId())) {
            String tenantId = credential(credentials, "tenant_id", "tenantId");
            ruckusOneConfig.setTenantId(tenantId);
            logger.info("Set tenant ID from VCAP: {}", tenantId);
        }

        if (credentials.hasNonNull("region")) {
            String region = credentials.path("region").asText();
            ruckusOneConfig.setRegion(region);
            logger.info("Set region from VCAP: {}", region);
        }
    }

    private static String credential(JsonNode credentials, String snakeKey, String camelKey) {
        if (credentials.hasNonNull(snakeKey)) {
            return credentials.get(snakeKey).asText();
        }
        return credentials.path(camelKey).asText(null);
    }

    private static boolean isSet(String value) {
        return value != null && !value.trim().isEmpty() && !value.contains("${");
    }
}
