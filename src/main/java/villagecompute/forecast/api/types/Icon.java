/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import villagecompute.forecast.codec.WireEnumCodec;
import villagecompute.forecast.codec.WireToken;

/**
 * Icon name suggested by the API for displaying a data point or block.
 */
public enum Icon implements WireToken {

    CLEAR_DAY("clear-day"),
    CLEAR_NIGHT("clear-night"),
    RAIN("rain"),
    SNOW("snow"),
    SLEET("sleet"),
    WIND("wind"),
    FOG("fog"),
    CLOUDY("cloudy"),
    PARTLY_CLOUDY_DAY("partly-cloudy-day"),
    PARTLY_CLOUDY_NIGHT("partly-cloudy-night"),
    HAIL("hail"),
    THUNDERSTORM("thunderstorm"),
    TORNADO("tornado");

    private static final WireEnumCodec<Icon> CODEC = WireEnumCodec.of(Icon.class);

    private final String token;

    Icon(String token) {
        this.token = token;
    }

    @JsonValue
    @Override
    public String token() {
        return token;
    }

    @JsonCreator
    public static Icon fromToken(String token) {
        return CODEC.decode(token);
    }

    public static WireEnumCodec<Icon> codec() {
        return CODEC;
    }
}
