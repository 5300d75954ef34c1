/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.services;

import java.net.http.HttpResponse;

import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.forecast.api.types.ApiResponseType;
import villagecompute.forecast.config.ForecastClientConfig;
import villagecompute.forecast.integration.ApiClient;
import villagecompute.forecast.integration.ApiResponseDecoder;
import villagecompute.forecast.request.ForecastRequest;
import villagecompute.forecast.request.ForecastRequestBuilder;
import villagecompute.forecast.request.HistoricalRequest;
import villagecompute.forecast.request.HistoricalRequestBuilder;

/**
 * Service for fetching decoded Pirate Weather forecasts with the configured API key and endpoint.
 *
 * <p>
 * Seeds request builders from {@link ForecastClientConfig}, sends finished requests through {@link ApiClient} and
 * decodes the body. Each call is a single HTTP exchange: there is no retry, caching or rate limiting.
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * @Inject
 * ForecastService forecastService;
 *
 * ForecastRequest request = forecastService.forecastRequest(37.7749, -122.4194)
 *         .excludeBlock(ExcludeBlock.MINUTELY)
 *         .units(Units.SI)
 *         .build();
 * ApiResponseType forecast = forecastService.getForecast(request);
 * }
 * </pre>
 */
@ApplicationScoped
public class ForecastService {

    private static final Logger LOG = Logger.getLogger(ForecastService.class);

    @Inject
    ForecastClientConfig config;

    @Inject
    ApiClient<HttpResponse<String>> apiClient;

    @Inject
    ApiResponseDecoder decoder;

    /**
     * @return forecast builder using the configured base URL and API key
     */
    public ForecastRequestBuilder forecastRequest(double latitude, double longitude) {
        return new ForecastRequestBuilder(config.getBaseUrl(), config.getApiKey(), latitude, longitude);
    }

    /**
     * @param time
     *            UNIX time in seconds
     * @return historical builder using the configured base URL and API key
     */
    public HistoricalRequestBuilder historicalRequest(double latitude, double longitude, long time) {
        return new HistoricalRequestBuilder(config.getBaseUrl(), config.getApiKey(), latitude, longitude, time);
    }

    /**
     * Fetches and decodes a forecast.
     *
     * @param request
     *            finalized forecast request
     * @return decoded response
     * @throws villagecompute.forecast.exceptions.ForecastApiException
     *             if the API answers with a non-2xx status or an undecodable body
     * @throws villagecompute.forecast.exceptions.TransportException
     *             if the HTTP exchange fails
     */
    public ApiResponseType getForecast(ForecastRequest request) {
        HttpResponse<String> response = apiClient.fetchForecast(request);
        ApiResponseType decoded = decoder.decode(response);
        LOG.debugf("Decoded forecast for %.4f,%.4f (timezone=%s)", request.latitude(), request.longitude(),
                decoded.timezone());
        return decoded;
    }

    /**
     * Fetches and decodes historical data.
     *
     * @param request
     *            finalized historical request
     * @return decoded response
     * @throws villagecompute.forecast.exceptions.ForecastApiException
     *             if the API answers with a non-2xx status or an undecodable body
     * @throws villagecompute.forecast.exceptions.TransportException
     *             if the HTTP exchange fails
     */
    public ApiResponseType getHistorical(HistoricalRequest request) {
        HttpResponse<String> response = apiClient.fetchHistorical(request);
        ApiResponseType decoded = decoder.decode(response);
        LOG.debugf("Decoded historical data for %.4f,%.4f at %d", request.latitude(), request.longitude(),
                request.time());
        return decoded;
    }
}
