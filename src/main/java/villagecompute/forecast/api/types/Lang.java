/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import villagecompute.forecast.codec.WireEnumCodec;
import villagecompute.forecast.codec.WireToken;

/**
 * Language for summaries in response data ({@code lang} query parameter).
 *
 * <p>
 * {@link #NORWEGIAN_BOKMAL} is the one irregular variant: it decodes from both {@code nb} and the legacy {@code no},
 * but always encodes as {@code nb}.
 */
public enum Lang implements WireToken {

    ARABIC("ar"),
    AZERBAIJANI("az"),
    BELARUSIAN("be"),
    BULGARIAN("bg"),
    BOSNIAN("bs"),
    CATALAN("ca"),
    CZECH("cz"),
    DANISH("da"),
    GERMAN("de"),
    GREEK("el"),
    ENGLISH("en"),
    SPANISH("es"),
    ESTONIAN("et"),
    FINNISH("fi"),
    FRENCH("fr"),
    CROATIAN("hr"),
    HUNGARIAN("hu"),
    INDONESIAN("id"),
    ICELANDIC("is"),
    ITALIAN("it"),
    JAPANESE("ja"),
    GEORGIAN("ka"),
    KOREAN("ko"),
    CORNISH("kw"),
    NORWEGIAN_BOKMAL("nb"),
    DUTCH("nl"),
    POLISH("pl"),
    PORTUGUESE("pt"),
    ROMANIAN("ro"),
    RUSSIAN("ru"),
    SLOVAK("sk"),
    SLOVENIAN("sl"),
    SERBIAN("sr"),
    SWEDISH("sv"),
    TETUM("tet"),
    TURKISH("tr"),
    UKRAINIAN("uk"),
    IGPAY_ATINLAY("x-pig-latin"),
    SIMPLIFIED_CHINESE("zh"),
    TRADITIONAL_CHINESE("zh-tw");

    /** Legacy token still accepted for Norwegian Bokmål. */
    public static final String NORWEGIAN_LEGACY_TOKEN = "no";

    private static final WireEnumCodec<Lang> CODEC = WireEnumCodec.of(Lang.class).alias(NORWEGIAN_LEGACY_TOKEN,
            NORWEGIAN_BOKMAL);

    private final String token;

    Lang(String token) {
        this.token = token;
    }

    @JsonValue
    @Override
    public String token() {
        return token;
    }

    @JsonCreator
    public static Lang fromToken(String token) {
        return CODEC.decode(token);
    }

    public static WireEnumCodec<Lang> codec() {
        return CODEC;
    }
}
