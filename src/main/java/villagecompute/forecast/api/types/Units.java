/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import villagecompute.forecast.codec.WireEnumCodec;
import villagecompute.forecast.codec.WireToken;

/**
 * Measurement units for response data ({@code units} query parameter and {@code flags.units} in responses).
 */
public enum Units implements WireToken {

    AUTO("auto"), // selected from the requested location
    CA("ca"), // SI with wind speed in km/h
    UK("uk2"), // SI with distances in miles and wind speed in mph
    IMPERIAL("us"),
    SI("si");

    private static final WireEnumCodec<Units> CODEC = WireEnumCodec.of(Units.class);

    private final String token;

    Units(String token) {
        this.token = token;
    }

    @JsonValue
    @Override
    public String token() {
        return token;
    }

    @JsonCreator
    public static Units fromToken(String token) {
        return CODEC.decode(token);
    }

    public static WireEnumCodec<Units> codec() {
        return CODEC;
    }
}
