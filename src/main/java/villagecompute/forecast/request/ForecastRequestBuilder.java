/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.request;

import java.net.URI;

import villagecompute.forecast.api.types.ExtendBy;
import villagecompute.forecast.codec.QueryEncoder;

/**
 * Builder for {@link ForecastRequest}.
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * List<ExcludeBlock> blocks = new ArrayList<>(List.of(ExcludeBlock.DAILY, ExcludeBlock.ALERTS));
 *
 * ForecastRequest request = new ForecastRequestBuilder(apiKey, 6.66, 66.6)
 *         .excludeBlock(ExcludeBlock.HOURLY)
 *         .excludeBlocks(blocks)
 *         .extend(ExtendBy.HOURLY)
 *         .lang(Lang.ARABIC)
 *         .units(Units.IMPERIAL)
 *         .build();
 * }
 * </pre>
 *
 * Query parameters are emitted in the order {@code exclude, extend, lang, units}.
 */
public class ForecastRequestBuilder extends RequestBuilder<ForecastRequestBuilder, ForecastRequest> {

    private ExtendBy extend;

    /**
     * Creates a builder against {@link #DEFAULT_BASE_URL}.
     */
    public ForecastRequestBuilder(String apiKey, double latitude, double longitude) {
        this(DEFAULT_BASE_URL, apiKey, latitude, longitude);
    }

    public ForecastRequestBuilder(String baseUrl, String apiKey, double latitude, double longitude) {
        super(baseUrl, apiKey, latitude, longitude);
    }

    /**
     * Extends the hourly block from 48 to 168 hours. Passing {@code null} clears a previous value.
     */
    public ForecastRequestBuilder extend(ExtendBy extend) {
        ensureOpen();
        this.extend = extend;
        return self();
    }

    @Override
    protected String pathSuffix() {
        return "";
    }

    @Override
    protected QueryEncoder query() {
        return new QueryEncoder().params(EXCLUDE, exclude()).param(EXTEND, extend).param(LANG, lang())
                .param(UNITS, units());
    }

    @Override
    protected ForecastRequest create(URI url) {
        return new ForecastRequest(apiKey(), latitude(), longitude(), url, exclude(), extend, lang(), units());
    }
}
