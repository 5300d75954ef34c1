/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.integration;

import java.net.URI;

/**
 * Performs an HTTP GET for the {@link ApiClient}.
 *
 * <p>
 * Implementations own connection management, timeouts and error signalling. The client never inspects the returned
 * value or the exceptions thrown.
 *
 * @param <R>
 *            response type produced by the transport
 */
@FunctionalInterface
public interface ForecastTransport<R> {

    /**
     * Issues a GET for exactly the given URL.
     *
     * @param url
     *            absolute request URL
     * @return raw response
     */
    R get(URI url);
}
