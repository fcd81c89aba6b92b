package org.tanzu.ruckusmcp.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;

class RuckusOneConfigProcessorTest {

    private static final String VCAP = "{\"user-provided\":[{\"name\":\"my-ruckus-one\",\"credentials\":{"
        + "\"client_id\":\"vcap-client\",\"clientSecret\":\"vcap-secret\",\"tenant_id\":\"vcap-tenant\",\"region\":\"eu\"}}]}";

    @Test
    void completeConfigurationIsLeftAlone() {
        RuckusOneConfig config = config("env-client", "env-secret", "env-tenant");
        MockEnvironment environment = new MockEnvironment().withProperty("VCAP_SERVICES", VCAP);

        new RuckusOneConfigProcessor(config, environment).processVCapServices();

        assertEquals("env-client", config.getClientId());
        assertEquals("na", config.getRegion());
    }

    @Test
    void missingAndPlaceholderValuesAreFilledFromServiceBinding() {
        RuckusOneConfig config = config("env-client", "${RUCKUS_CLIENT_SECRET}", " ");
        MockEnvironment environment = new MockEnvironment().withProperty("VCAP_SERVICES", VCAP);
        RuckusOneConfigProcessor processor = new RuckusOneConfigProcessor(config, environment);

        processor.processVCapServices();

        assertEquals("env-client", config.getClientId());
        assertEquals("vcap-secret", config.getClientSecret());
        assertEquals("vcap-tenant", config.getTenantId());
        assertEquals("eu", config.getRegion());
        assertTrue(processor.isConfigurationComplete());
    }

    @Test
    void unrelatedServicesAreIgnored() {
        RuckusOneConfig config = config(null, null, null);
        MockEnvironment environment = new MockEnvironment().withProperty("VCAP_SERVICES",
            "{\"p-mysql\":[{\"name\":\"db\",\"credentials\":{\"client_id\":\"x\"}}]}");

        new RuckusOneConfigProcessor(config, environment).processVCapServices();

        assertNull(config.getClientId());
    }

    @Test
    void malformedServiceDocumentIsIgnored() {
        RuckusOneConfig config = config(null, null, null);
        MockEnvironment environment = new MockEnvironment().withProperty("VCAP_SERVICES", "{not json");

        assertDoesNotThrow(() -> new RuckusOneConfigProcessor(config, environment).processVCapServices());
        assertNull(config.getTenantId());
    }

    @Test
    void toStringHidesSecret() {
        String text = config("c", "top-secret", "t").toString();

        assertFalse(text.contains("top-secret"), text);
    }

    private static RuckusOneConfig config(String clientId, String clientSecret, String tenantId) {
        RuckusOneConfig config = new RuckusOneConfig();
        config.setClientId(clientId);
        config.setClientSecret(clientSecret);
        config.setTenantId(tenantId);
        return config;
    }
}
