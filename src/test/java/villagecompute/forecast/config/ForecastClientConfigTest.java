/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.config;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;

import villagecompute.forecast.config.ForecastClientConfig.ForecastConfigurationException;
import villagecompute.forecast.request.RequestBuilder;

/**
 * Unit tests for {@link ForecastClientConfig} startup validation and bean producers.
 */
class ForecastClientConfigTest {

    private ForecastClientConfig config;

    @BeforeEach
    void setUp() {
        config = new ForecastClientConfig();
        config.apiKey = "configured_key";
        config.baseUrl = RequestBuilder.DEFAULT_BASE_URL;
        config.connectTimeoutSeconds = 5;
        config.requestTimeoutSeconds = 10;
    }

    @Test
    void testValidateConfiguration_valid() {
        assertDoesNotThrow(config::validateConfiguration);
    }

    @Test
    void testValidateConfiguration_missingApiKey() {
        config.apiKey = null;

        ForecastConfigurationException e = assertThrows(ForecastConfigurationException.class,
                config::validateConfiguration);

        assertTrue(e.getMessage().contains("PIRATEWEATHER_API_KEY"));
    }

    @Test
    void testValidateConfiguration_blankApiKey() {
        config.apiKey = "   ";

        assertThrows(ForecastConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testValidateConfiguration_nonPositiveTimeouts() {
        config.connectTimeoutSeconds = 0;
        assertThrows(ForecastConfigurationException.class, config::validateConfiguration);

        config.connectTimeoutSeconds = 5;
        config.requestTimeoutSeconds = -1;
        assertThrows(ForecastConfigurationException.class, config::validateConfiguration);
    }

    @Test
    void testProducers_createCollaborators() {
        assertNotNull(config.createApiClient(config.createTransport()));
        assertNotNull(config.createResponseDecoder(new ObjectMapper()));
    }
}
