/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.integration;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

import org.jboss.logging.Logger;

import villagecompute.forecast.exceptions.TransportException;

/**
 * {@link ForecastTransport} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Returns the response as received: any status code, body read as a string. Only failures to complete the exchange
 * (connection errors, timeouts, interruption) raise {@link TransportException}.
 *
 * <p>
 * Thread-safe; a single instance is shared by the application.
 */
public class HttpClientTransport implements ForecastTransport<HttpResponse<String>> {

    private static final Logger LOG = Logger.getLogger(HttpClientTransport.class);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpClientTransport(Duration connectTimeout, Duration requestTimeout) {
        this(HttpClient.newBuilder().followRedirects(HttpClient.Redirect.NORMAL).connectTimeout(connectTimeout).build(),
                requestTimeout);
    }

    public HttpClientTransport(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public HttpResponse<String> get(URI url) {
        HttpRequest request = HttpRequest.newBuilder().uri(url).timeout(requestTimeout)
                .header("Accept", "application/json").GET().build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            LOG.debugf("GET %s returned status %d", url.getHost(), response.statusCode());
            return response;
        } catch (IOException e) {
            throw new TransportException("GET to " + url.getHost() + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("GET to " + url.getHost() + " was interrupted", e);
        }
    }
}
