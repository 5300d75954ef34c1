/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.request;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.jboss.logging.Logger;

import villagecompute.forecast.api.types.ExcludeBlock;
import villagecompute.forecast.api.types.Lang;
import villagecompute.forecast.api.types.Units;
import villagecompute.forecast.codec.QueryEncoder;
import villagecompute.forecast.exceptions.MalformedUrlException;
import villagecompute.forecast.exceptions.ValidationException;

/**
 * Shared state and URL assembly for the forecast and historical request builders.
 *
 * <p>
 * A builder is created with its required fields, configured through fluent calls that mutate it in place and return
 * {@code this}, then finalized exactly once with {@link #build()}. Single-valued options follow last-call-wins;
 * excluded blocks accumulate in call order, duplicates included. Once built, the builder rejects further use.
 *
 * <h2>URL Layout</h2>
 *
 * <pre>
 * {base}/{apiKey}/{latitude},{longitude}[{suffix}]?{query}
 * </pre>
 *
 * Coordinates are rendered by {@link #formatCoordinate(double)}. The API key is percent-encoded as a path segment.
 * The query comes from the subclass in its fixed parameter order; when it is empty the URL has no {@code ?}.
 *
 * <p>
 * Builders are not thread-safe; the requests they produce are immutable.
 *
 * @param <B>
 *            concrete builder type, returned from fluent calls
 * @param <R>
 *            request type produced by {@link #build()}
 */
public abstract class RequestBuilder<B extends RequestBuilder<B, R>, R> {

    private static final Logger LOG = Logger.getLogger(RequestBuilder.class);

    /** Pirate Weather endpoint serving both forecast and historical requests. */
    public static final String DEFAULT_BASE_URL = "https://api.pirateweather.net/forecast";

    public static final String EXCLUDE = "exclude";
    public static final String EXTEND = "extend";
    public static final String LANG = "lang";
    public static final String UNITS = "units";

    /** Fractional digits used for latitude and longitude in the request path. */
    public static final int COORDINATE_SCALE = 16;

    private final String baseUrl;
    private final String apiKey;
    private final double latitude;
    private final double longitude;
    private final List<ExcludeBlock> exclude = new ArrayList<>();
    private Lang lang;
    private Units units;
    private boolean built;

    protected RequestBuilder(String baseUrl, String apiKey, double latitude, double longitude) {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new ValidationException("Base URL is required");
        }
        if (apiKey == null) {
            throw new ValidationException("API key is required");
        }
        requireFinite("latitude", latitude);
        requireFinite("longitude", longitude);
        this.baseUrl = stripTrailingSlashes(baseUrl);
        this.apiKey = apiKey;
        this.latitude = latitude;
        this.longitude = longitude;
    }

    /**
     * Adds a data block to exclude from the response. May be called repeatedly; duplicates are kept.
     *
     * @param block
     *            block to exclude
     * @return this builder
     */
    public B excludeBlock(ExcludeBlock block) {
        ensureOpen();
        if (block == null) {
            throw new ValidationException("Excluded block must not be null");
        }
        exclude.add(block);
        return self();
    }

    /**
     * Moves every block from {@code blocks} to the exclude list, in iteration order. The source collection is empty
     * afterwards, so it must be mutable. A collection that contains {@code null} or cannot be cleared is rejected and
     * neither it nor this builder is changed.
     *
     * @param blocks
     *            blocks to exclude; drained by this call
     * @return this builder
     * @throws ValidationException
     *             if {@code blocks} is null, contains null or is unmodifiable
     */
    public B excludeBlocks(Collection<ExcludeBlock> blocks) {
        ensureOpen();
        if (blocks == null) {
            throw new ValidationException("Excluded blocks must not be null");
        }
        for (ExcludeBlock block : blocks) {
            if (block == null) {
                throw new ValidationException("Excluded blocks must not contain null");
            }
        }
        List<ExcludeBlock> moved = new ArrayList<>(blocks);
        try {
            blocks.clear();
        } catch (UnsupportedOperationException e) {
            throw new ValidationException("Excluded blocks must be passed in a mutable collection", e);
        }
        exclude.addAll(moved);
        return self();
    }

    /**
     * Sets the language for summaries. Passing {@code null} clears a previous value.
     */
    public B lang(Lang lang) {
        ensureOpen();
        this.lang = lang;
        return self();
    }

    /**
     * Sets the measurement units. Passing {@code null} clears a previous value.
     */
    public B units(Units units) {
        ensureOpen();
        this.units = units;
        return self();
    }

    /**
     * Finalizes the request, computing its URL once.
     *
     * @return immutable request
     * @throws MalformedUrlException
     *             if the assembled URL is not a valid absolute URI
     * @throws IllegalStateException
     *             if this builder was already built
     */
    public final R build() {
        ensureOpen();
        built = true;
        String path = baseUrl + "/" + encodePathSegment(apiKey) + "/" + formatCoordinate(latitude) + ","
                + formatCoordinate(longitude) + pathSuffix();
        URI url = toUri(query().appendTo(path));
        return create(url);
    }

    /**
     * Renders a coordinate as the exact decimal value of the {@code double}, rounded half-even to
     * {@value #COORDINATE_SCALE} fractional digits. {@code 6.66} becomes {@code 6.6600000000000001}. The sign of
     * negative zero and of negative values that round to zero is kept ({@code -0.0000000000000000}).
     *
     * @param value
     *            finite coordinate
     * @return fixed-point string with exactly {@value #COORDINATE_SCALE} digits after the decimal point
     */
    public static String formatCoordinate(double value) {
        String formatted = new BigDecimal(value).setScale(COORDINATE_SCALE, RoundingMode.HALF_EVEN).toPlainString();
        if (Double.doubleToRawLongBits(value) < 0 && formatted.charAt(0) != '-') {
            return "-" + formatted;
        }
        return formatted;
    }

    /**
     * Replaces the API key path segment of a request URL with {@code ***}, for logging.
     *
     * <p>
     * The key is always the segment just before the location segment, which is the last one and never contains a
     * slash. Masking goes by that position, so a key that equals another path segment is still hidden.
     *
     * @param url
     *            URL produced by {@link #build()}
     * @return URL text safe to log
     */
    public static String redactApiKey(URI url) {
        String path = url.getRawPath();
        int locationStart = path == null ? -1 : path.lastIndexOf('/');
        int keyStart = locationStart <= 0 ? -1 : path.lastIndexOf('/', locationStart - 1);
        if (keyStart < 0) {
            return redact(url.toString());
        }
        StringBuilder redacted = new StringBuilder();
        if (url.getScheme() != null) {
            redacted.append(url.getScheme()).append("://");
        }
        if (url.getRawAuthority() != null) {
            redacted.append(url.getRawAuthority());
        }
        redacted.append(path, 0, keyStart + 1).append("***").append(path.substring(locationStart));
        if (url.getRawQuery() != null) {
            redacted.append('?').append(url.getRawQuery());
        }
        return redacted.toString();
    }

    /**
     * @return text appended to the path after the longitude, or an empty string
     */
    protected abstract String pathSuffix();

    /**
     * @return query parameters in the endpoint's fixed order
     */
    protected abstract QueryEncoder query();

    protected abstract R create(URI url);

    @SuppressWarnings("unchecked")
    protected final B self() {
        return (B) this;
    }

    protected final void ensureOpen() {
        if (built) {
            throw new IllegalStateException(getClass().getSimpleName() + " has already been built");
        }
    }

    protected final String apiKey() {
        return apiKey;
    }

    protected final double latitude() {
        return latitude;
    }

    protected final double longitude() {
        return longitude;
    }

    protected final List<ExcludeBlock> exclude() {
        return exclude;
    }

    protected final Lang lang() {
        return lang;
    }

    protected final Units units() {
        return units;
    }

    private static URI toUri(String url) {
        try {
            URI uri = new URI(url);
            if (!uri.isAbsolute()) {
                throw new MalformedUrlException("Request URL is not absolute: " + redact(url));
            }
            return uri;
        } catch (URISyntaxException e) {
            LOG.errorf("Failed to assemble request URL from base %s", redact(url));
            throw new MalformedUrlException("Invalid request URL: " + e.getReason(), e);
        }
    }

    private static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new ValidationException(name + " must be a finite number, got " + value);
        }
    }

    private static String encodePathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlashes(String url) {
        int end = url.length();
        while (end > 0 && url.charAt(end - 1) == '/') {
            end--;
        }
        return url.substring(0, end);
    }

    // Keeps everything up to the API key segment so logs and messages never carry credentials
    private static String redact(String url) {
        int schemeEnd = url.indexOf("://");
        int start = schemeEnd < 0 ? 0 : schemeEnd + 3;
        int hostEnd = url.indexOf('/', start);
        return hostEnd < 0 ? url : url.substring(0, hostEnd) + "/...";
    }
}
