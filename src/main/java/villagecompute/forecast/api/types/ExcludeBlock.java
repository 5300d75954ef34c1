/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import villagecompute.forecast.codec.WireEnumCodec;
import villagecompute.forecast.codec.WireToken;

/**
 * Data block to leave out of a forecast or historical response ({@code exclude} query parameter).
 */
public enum ExcludeBlock implements WireToken {

    CURRENTLY("currently"),
    MINUTELY("minutely"),
    HOURLY("hourly"),
    DAILY("daily"),
    ALERTS("alerts"),
    FLAGS("flags");

    private static final WireEnumCodec<ExcludeBlock> CODEC = WireEnumCodec.of(ExcludeBlock.class);

    private final String token;

    ExcludeBlock(String token) {
        this.token = token;
    }

    @JsonValue
    @Override
    public String token() {
        return token;
    }

    @JsonCreator
    public static ExcludeBlock fromToken(String token) {
        return CODEC.decode(token);
    }

    public static WireEnumCodec<ExcludeBlock> codec() {
        return CODEC;
    }
}
