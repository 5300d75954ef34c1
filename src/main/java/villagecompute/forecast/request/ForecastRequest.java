/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.request;

import java.net.URI;
import java.util.List;

import villagecompute.forecast.api.types.ExcludeBlock;
import villagecompute.forecast.api.types.ExtendBy;
import villagecompute.forecast.api.types.Lang;
import villagecompute.forecast.api.types.Units;

/**
 * Finalized request to the forecast endpoint. Normally obtained from {@link ForecastRequestBuilder#build()}.
 *
 * @param apiKey
 *            Pirate Weather API key
 * @param latitude
 *            latitude in decimal degrees
 * @param longitude
 *            longitude in decimal degrees
 * @param url
 *            complete request URL, computed once at build time
 * @param exclude
 *            excluded blocks in insertion order, duplicates included
 * @param extend
 *            hourly extension, or {@code null}
 * @param lang
 *            summary language, or {@code null}
 * @param units
 *            measurement units, or {@code null}
 */
public record ForecastRequest(String apiKey, double latitude, double longitude, URI url, List<ExcludeBlock> exclude,
        ExtendBy extend, Lang lang, Units units) {

    public ForecastRequest {
        exclude = List.copyOf(exclude);
    }

    /**
     * @return the URL with its API key segment masked, for logging
     */
    public String redactedUrl() {
        return RequestBuilder.redactApiKey(url);
    }

    @Override
    public String toString() {
        return "ForecastRequest[url=" + redactedUrl() + "]";
    }
}
