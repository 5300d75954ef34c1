/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.integration;

import org.jboss.logging.Logger;

import villagecompute.forecast.request.ForecastRequest;
import villagecompute.forecast.request.HistoricalRequest;

/**
 * Sends finalized requests to the Pirate Weather forecast and historical endpoints.
 *
 * <p>
 * The client is a pass-through: it hands the URL computed at build time to the transport and returns whatever the
 * transport returns. Status codes are not interpreted, bodies are not parsed, and transport exceptions propagate
 * unchanged. It holds no state besides the transport, so concurrent calls are as safe as the transport is.
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * ApiClient<HttpResponse<String>> client = new ApiClient<>(
 *         new HttpClientTransport(Duration.ofSeconds(5), Duration.ofSeconds(10)));
 *
 * HttpResponse<String> response = client.fetchForecast(
 *         new ForecastRequestBuilder(apiKey, 37.7749, -122.4194).units(Units.SI).build());
 * }
 * </pre>
 *
 * @param <R>
 *            response type of the underlying transport
 * @see <a href="https://docs.pirateweather.net/en/latest/API/">Pirate Weather API Documentation</a>
 */
public class ApiClient<R> {

    private static final Logger LOG = Logger.getLogger(ApiClient.class);

    private final ForecastTransport<R> transport;

    public ApiClient(ForecastTransport<R> transport) {
        if (transport == null) {
            throw new IllegalArgumentException("transport is required");
        }
        this.transport = transport;
    }

    /**
     * Sends a forecast request.
     *
     * @param request
     *            finalized request
     * @return the transport's response, unmodified
     */
    public R fetchForecast(ForecastRequest request) {
        LOG.debugf("Fetching forecast: %s", request.redactedUrl());
        return transport.get(request.url());
    }

    /**
     * Sends a historical (time machine) request.
     *
     * @param request
     *            finalized request
     * @return the transport's response, unmodified
     */
    public R fetchHistorical(HistoricalRequest request) {
        LOG.debugf("Fetching historical data for time %d: %s", request.time(), request.redactedUrl());
        return transport.get(request.url());
    }
}
