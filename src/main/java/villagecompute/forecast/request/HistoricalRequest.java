/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.request;

import java.net.URI;
import java.time.Instant;
import java.util.List;

import villagecompute.forecast.api.types.ExcludeBlock;
import villagecompute.forecast.api.types.Lang;
import villagecompute.forecast.api.types.Units;

/**
 * Finalized request to the historical (time machine) endpoint. Normally obtained from
 * {@link HistoricalRequestBuilder#build()}.
 *
 * @param time
 *            UNIX time in seconds the data should describe
 */
public record HistoricalRequest(String apiKey, double latitude, double longitude, long time, URI url,
        List<ExcludeBlock> exclude, Lang lang, Units units) {

    public HistoricalRequest {
        exclude = List.copyOf(exclude);
    }

    public Instant instant() {
        return Instant.ofEpochSecond(time);
    }

    public String redactedUrl() {
        return RequestBuilder.redactApiKey(url);
    }

    @Override
    public String toString() {
        return "HistoricalRequest[url=" + redactedUrl() + "]";
    }
}
