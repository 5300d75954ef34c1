/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.request;

import java.net.URI;
import java.time.Instant;

import villagecompute.forecast.codec.QueryEncoder;
import villagecompute.forecast.exceptions.ValidationException;

/**
 * Builder for {@link HistoricalRequest}, the point-in-time ("time machine") endpoint.
 *
 * <p>
 * Same shape as {@link ForecastRequestBuilder} plus a required UNIX timestamp, and without {@code extend}. The time is
 * appended to the location segment ({@code .../{lat},{lon},{time}}) and the query order is
 * {@code exclude, lang, units}.
 */
public class HistoricalRequestBuilder extends RequestBuilder<HistoricalRequestBuilder, HistoricalRequest> {

    private final long time;

    /**
     * Creates a builder against {@link #DEFAULT_BASE_URL}.
     *
     * @param time
     *            UNIX time in seconds
     */
    public HistoricalRequestBuilder(String apiKey, double latitude, double longitude, long time) {
        this(DEFAULT_BASE_URL, apiKey, latitude, longitude, time);
    }

    public HistoricalRequestBuilder(String apiKey, double latitude, double longitude, Instant time) {
        this(DEFAULT_BASE_URL, apiKey, latitude, longitude, epochSeconds(time));
    }

    public HistoricalRequestBuilder(String baseUrl, String apiKey, double latitude, double longitude, long time) {
        super(baseUrl, apiKey, latitude, longitude);
        if (time < 0) {
            throw new ValidationException("time must be a non-negative UNIX timestamp, got " + time);
        }
        this.time = time;
    }

    @Override
    protected String pathSuffix() {
        return "," + time;
    }

    @Override
    protected QueryEncoder query() {
        return new QueryEncoder().params(EXCLUDE, exclude()).param(LANG, lang()).param(UNITS, units());
    }

    @Override
    protected HistoricalRequest create(URI url) {
        return new HistoricalRequest(apiKey(), latitude(), longitude(), time, url, exclude(), lang(), units());
    }

    private static long epochSeconds(Instant time) {
        if (time == null) {
            throw new ValidationException("time is required");
        }
        return time.getEpochSecond();
    }
}
