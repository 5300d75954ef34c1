/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import villagecompute.forecast.codec.WireEnumCodec;
import villagecompute.forecast.codec.WireToken;

/**
 * Extends the hourly block of a forecast response from 48 to 168 hours ({@code extend} query parameter).
 *
 * <p>
 * The API accepts a single value today.
 */
public enum ExtendBy implements WireToken {

    HOURLY("hourly");

    private static final WireEnumCodec<ExtendBy> CODEC = WireEnumCodec.of(ExtendBy.class);

    private final String token;

    ExtendBy(String token) {
        this.token = token;
    }

    @JsonValue
    @Override
    public String token() {
        return token;
    }

    @JsonCreator
    public static ExtendBy fromToken(String token) {
        return CODEC.decode(token);
    }

    public static WireEnumCodec<ExtendBy> codec() {
        return CODEC;
    }
}
