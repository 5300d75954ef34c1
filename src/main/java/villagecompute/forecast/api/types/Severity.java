/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.api.types;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import villagecompute.forecast.codec.WireEnumCodec;
import villagecompute.forecast.codec.WireToken;

/**
 * Severity of a weather alert.
 */
public enum Severity implements WireToken {

    ADVISORY("advisory"),
    WATCH("watch"),
    WARNING("warning");

    private static final WireEnumCodec<Severity> CODEC = WireEnumCodec.of(Severity.class);

    private final String token;

    Severity(String token) {
        this.token = token;
    }

    @JsonValue
    @Override
    public String token() {
        return token;
    }

    @JsonCreator
    public static Severity fromToken(String token) {
        return CODEC.decode(token);
    }

    public static WireEnumCodec<Severity> codec() {
        return CODEC;
    }
}
