/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.config;

import java.net.http.HttpResponse;
import java.time.Duration;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import villagecompute.forecast.integration.ApiClient;
import villagecompute.forecast.integration.ApiResponseDecoder;
import villagecompute.forecast.integration.HttpClientTransport;
import villagecompute.forecast.request.RequestBuilder;

/**
 * Configuration for the Pirate Weather client.
 *
 * <p>
 * Validates the API key at startup and produces the shared HTTP transport, {@link ApiClient} and
 * {@link ApiResponseDecoder} beans.
 *
 * <p>
 * <b>Configuration Properties:</b>
 * <ul>
 * <li>{@code pirateweather.api-key} - Pirate Weather API key (from PIRATEWEATHER_API_KEY env var)</li>
 * <li>{@code pirateweather.base-url} - Endpoint base (default: https://api.pirateweather.net/forecast)</li>
 * <li>{@code pirateweather.connect-timeout-seconds} - TCP connect timeout (default: 5)</li>
 * <li>{@code pirateweather.request-timeout-seconds} - Per-request timeout (default: 10)</li>
 * </ul>
 *
 * <p>
 * <b>Usage:</b>
 *
 * <pre>
 * &#64;Inject
 * ApiClient&lt;HttpResponse&lt;String&gt;&gt; apiClient;
 * </pre>
 *
 * @see villagecompute.forecast.services.ForecastService
 */
@ApplicationScoped
public class ForecastClientConfig {

    private static final Logger LOG = Logger.getLogger(ForecastClientConfig.class);

    @ConfigProperty(
            name = "pirateweather.api-key")
    String apiKey;

    @ConfigProperty(
            name = "pirateweather.base-url",
            defaultValue = RequestBuilder.DEFAULT_BASE_URL)
    String baseUrl;

    @ConfigProperty(
            name = "pirateweather.connect-timeout-seconds",
            defaultValue = "5")
    int connectTimeoutSeconds;

    @ConfigProperty(
            name = "pirateweather.request-timeout-seconds",
            defaultValue = "10")
    int requestTimeoutSeconds;

    /**
     * Fails fast when the API key is missing or the timeouts are not positive.
     *
     * @throws ForecastConfigurationException
     *             if the configuration is unusable
     */
    @PostConstruct
    public void validateConfiguration() {
        if (apiKey == null || apiKey.trim().isEmpty()) {
            String errorMessage = "PIRATEWEATHER_API_KEY environment variable is not configured. "
                    + "Forecast requests require a valid Pirate Weather API key.";
            LOG.fatal(errorMessage);
            throw new ForecastConfigurationException(errorMessage);
        }
        if (connectTimeoutSeconds <= 0 || requestTimeoutSeconds <= 0) {
            throw new ForecastConfigurationException("Pirate Weather timeouts must be positive, got connect="
                    + connectTimeoutSeconds + "s request=" + requestTimeoutSeconds + "s");
        }
        LOG.infof("Pirate Weather client configured: baseUrl=%s, connectTimeout=%ds, requestTimeout=%ds", baseUrl,
                connectTimeoutSeconds, requestTimeoutSeconds);
    }

    @Produces
    @Singleton
    public HttpClientTransport createTransport() {
        return new HttpClientTransport(Duration.ofSeconds(connectTimeoutSeconds),
                Duration.ofSeconds(requestTimeoutSeconds));
    }

    @Produces
    @Singleton
    public ApiClient<HttpResponse<String>> createApiClient(HttpClientTransport transport) {
        return new ApiClient<>(transport);
    }

    @Produces
    @Singleton
    public ApiResponseDecoder createResponseDecoder(ObjectMapper objectMapper) {
        return new ApiResponseDecoder(objectMapper);
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    /**
     * Exception thrown when the Pirate Weather configuration is invalid or incomplete.
     */
    public static class ForecastConfigurationException extends RuntimeException {

        public ForecastConfigurationException(String message) {
            super(message);
        }
    }
}
