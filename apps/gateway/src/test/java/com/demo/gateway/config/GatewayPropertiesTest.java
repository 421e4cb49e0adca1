package com.demo.gateway.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GatewayPropertiesTest {

    private GatewayProperties properties;

    @BeforeEach
    void setup() {
        properties = new GatewayProperties();
        GatewayProperties.Provider grok = new GatewayProperties.Provider();
        grok.setBaseUrl("https://api.grok.ai");
        grok.setCredential("xai");
        properties.getProviders().put("grok", grok);
    }

    @Test
    void testUnsetValues_InheritDefaults() {
        ServiceConfig config = properties.serviceConfig("grok");

        assertEquals(3, config.circuitBreakerConfig().failureThreshold());
        assertEquals(2, config.circuitBreakerConfig().successThreshold());
        assertEquals(30_000, config.circuitBreakerConfig().openDurationMs());
        assertEquals(2, config.retryPolicy().maxRetries());
        assertEquals(1000, config.retryPolicy().baseBackoffMs());
        assertEquals(15_000, config.timeoutMs());
        assertFalse(config.fallbackEnabled());
    }

    @Test
    void testProviderOverrides_WinOverDefaults() {
        GatewayProperties.Provider grok = properties.getProviders().get("grok");
        grok.setFailureThreshold(5);
        grok.setRetryCount(0);
        grok.setTimeoutMs(30_000L);
        properties.getDefaults().setOpenDurationMs(10_000);

        ServiceConfig config = properties.serviceConfig("grok");

        assertEquals(5, config.circuitBreakerConfig().failureThreshold());
        assertEquals(10_000, config.circuitBreakerConfig().openDurationMs());
        assertEquals(0, config.retryPolicy().maxRetries());
        assertEquals(30_000, config.timeoutMs());
    }

    @Test
    void testUnknownProvider_Rejected() {
        assertThrows(IllegalArgumentException.class, () -> properties.serviceConfig("openai"));
    }

    @Test
    void testInvalidValue_FailsFast() {
        properties.getProviders().get("grok").setFailureThreshold(0);

        assertThrows(IllegalArgumentException.class, () -> properties.serviceConfig("grok"));
    }

    @Test
    void testMissingBaseUrl_FailsFast() {
        properties.getProviders().get("grok").setBaseUrl(" ");

        assertThrows(IllegalArgumentException.class, () -> properties.serviceConfig("grok"));
    }
}
