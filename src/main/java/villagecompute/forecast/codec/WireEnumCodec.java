/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.codec;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import villagecompute.forecast.exceptions.UnrecognizedTokenException;

/**
 * Bidirectional lookup table between an enum and its Pirate Weather wire tokens.
 *
 * <p>
 * Each variant has exactly one canonical token, used by {@link #encode(Enum)}. Decoding accepts every canonical token
 * plus any registered input-only aliases; the only alias the API defines today is {@code no} for
 * {@code Lang.NORWEGIAN_BOKMAL}, which still encodes as {@code nb}.
 *
 * <p>
 * The table is independent of Jackson. Enums expose it through {@code @JsonValue}/{@code @JsonCreator} methods that
 * delegate here, so query strings and response bodies follow the same rules.
 *
 * <h2>Usage</h2>
 *
 * <pre>
 * {@code
 * private static final WireEnumCodec<Lang> CODEC = WireEnumCodec.of(Lang.class).alias("no", NORWEGIAN_BOKMAL);
 *
 * CODEC.encode(Lang.ARABIC); // "ar"
 * CODEC.decode("no"); // Lang.NORWEGIAN_BOKMAL
 * }
 * </pre>
 *
 * <p>
 * Instances are immutable once their owning enum has finished class initialization and are safe to share across
 * threads.
 *
 * @param <E>
 *            enum type
 */
public final class WireEnumCodec<E extends Enum<E> & WireToken> {

    private final Class<E> type;
    private final Map<E, String> tokens;
    private final Map<String, E> variants = new LinkedHashMap<>();

    private WireEnumCodec(Class<E> type) {
        this.type = type;
        this.tokens = new EnumMap<>(type);
        for (E variant : type.getEnumConstants()) {
            String token = variant.token();
            if (token == null || token.isEmpty()) {
                throw new IllegalArgumentException(type.getSimpleName() + "." + variant.name() + " has no wire token");
            }
            register(token, variant);
            tokens.put(variant, token);
        }
    }

    /**
     * Builds the table for an enum from each variant's {@link WireToken#token()}.
     *
     * @param type
     *            enum class
     * @return codec with one canonical token per variant
     * @throws IllegalArgumentException
     *             if two variants share a token or a variant has an empty token
     */
    public static <E extends Enum<E> & WireToken> WireEnumCodec<E> of(Class<E> type) {
        return new WireEnumCodec<>(type);
    }

    /**
     * Registers an input-only token for an existing variant. Encoding is unaffected.
     *
     * @param token
     *            additional token accepted by {@link #decode(String)}
     * @param variant
     *            variant the token decodes to
     * @return this codec
     * @throws IllegalArgumentException
     *             if the token is empty or already taken, or the variant is null
     */
    public WireEnumCodec<E> alias(String token, E variant) {
        if (token == null || token.isEmpty() || variant == null) {
            throw new IllegalArgumentException("Alias for " + type.getSimpleName() + " needs a token and a variant");
        }
        register(token, variant);
        return this;
    }

    /**
     * @return the canonical wire token for the variant
     */
    public String encode(E variant) {
        if (variant == null) {
            throw new IllegalArgumentException("Cannot encode null " + type.getSimpleName());
        }
        return tokens.get(variant);
    }

    /**
     * Decodes a wire token. Matching is exact and case-sensitive.
     *
     * @param token
     *            wire token
     * @return matching variant
     * @throws UnrecognizedTokenException
     *             if the token is null or not registered
     */
    public E decode(String token) {
        E variant = token == null ? null : variants.get(token);
        if (variant == null) {
            throw new UnrecognizedTokenException(type, token);
        }
        return variant;
    }

    /**
     * @return every token {@link #decode(String)} accepts, canonical tokens first, then aliases
     */
    public Map<String, E> acceptedTokens() {
        return Collections.unmodifiableMap(variants);
    }

    public Class<E> type() {
        return type;
    }

    private void register(String token, E variant) {
        E existing = variants.putIfAbsent(token, variant);
        if (existing != null) {
            throw new IllegalArgumentException(
                    "Duplicate " + type.getSimpleName() + " token \"" + token + "\" for " + existing + " and " + variant);
        }
    }
}
