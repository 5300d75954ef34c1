/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.codec;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Serializes optional request parameters into a URL query string in caller-supplied order.
 *
 * <p>
 * Absent values ({@code null}, empty strings, empty collections) are dropped entirely, so the query never contains a
 * bare {@code name=}. Enum values go through their {@link WireToken} form. Collection values are comma-joined into a
 * single parameter; the comma is left literal while everything else follows
 * {@code application/x-www-form-urlencoded} escaping.
 *
 * <pre>
 * {@code
 * String query = new QueryEncoder()
 *         .params("exclude", List.of(ExcludeBlock.HOURLY, ExcludeBlock.DAILY))
 *         .param("lang", Lang.ARABIC)
 *         .param("units", (Units) null)
 *         .encode(); // "exclude=hourly,daily&lang=ar"
 * }
 * </pre>
 */
public final class QueryEncoder {

    private static final String ENCODED_COMMA = "%2C";

    private final List<String> pairs = new ArrayList<>();

    /**
     * Appends a raw scalar parameter.
     *
     * @param name
     *            parameter name
     * @param value
     *            value, skipped when {@code null} or empty
     * @return this encoder
     */
    public QueryEncoder param(String name, String value) {
        if (value != null && !value.isEmpty()) {
            pairs.add(formEncode(name) + "=" + formEncode(value));
        }
        return this;
    }

    /**
     * Appends an enum parameter using its wire token.
     *
     * @param name
     *            parameter name
     * @param value
     *            value, skipped when {@code null}
     * @return this encoder
     */
    public QueryEncoder param(String name, WireToken value) {
        return param(name, value == null ? null : value.token());
    }

    /**
     * Appends a list-valued parameter as one comma-joined value. Order and duplicates are preserved.
     *
     * @param name
     *            parameter name
     * @param values
     *            values, skipped when {@code null} or empty
     * @return this encoder
     */
    public QueryEncoder params(String name, Collection<? extends WireToken> values) {
        if (values == null || values.isEmpty()) {
            return this;
        }
        String joined = values.stream().map(WireToken::token).collect(Collectors.joining(","));
        pairs.add(formEncode(name) + "=" + formEncode(joined).replace(ENCODED_COMMA, ","));
        return this;
    }

    public boolean isEmpty() {
        return pairs.isEmpty();
    }

    /**
     * @return the query string without a leading {@code ?}; empty when no parameter was present
     */
    public String encode() {
        return String.join("&", pairs);
    }

    /**
     * Appends the query string to a URL. Nothing, not even {@code ?}, is appended when no parameter is present.
     *
     * @param base
     *            URL without query component
     * @return URL with query
     */
    public String appendTo(String base) {
        return pairs.isEmpty() ? base : base + "?" + encode();
    }

    private static String formEncode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
