/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import villagecompute.forecast.codec.WireEnumCodec;
import villagecompute.forecast.codec.WireToken;

/**
 * Kind of precipitation occurring at a point in time.
 */
public enum PrecipType implements WireToken {

    RAIN("rain"),
    SNOW("snow"),
    SLEET("sleet");

    private static final WireEnumCodec<PrecipType> CODEC = WireEnumCodec.of(PrecipType.class);

    private final String token;

    PrecipType(String token) {
        this.token = token;
    }

    @JsonValue
    @Override
    public String token() {
        return token;
    }

    @JsonCreator
    public static PrecipType fromToken(String token) {
        return CODEC.decode(token);
    }

    public static WireEnumCodec<PrecipType> codec() {
        return CODEC;
    }
}
