/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.exceptions;

/**
 * Exception thrown when a wire token cannot be decoded into a known enum variant.
 *
 * <p>
 * Decoding never falls back to a default variant. Callers see the enum type and the exact token the API (or caller)
 * supplied.
 */
public class UnrecognizedTokenException extends RuntimeException {

    private final Class<?> enumType;
    private final String token;

    public UnrecognizedTokenException(Class<?> enumType, String token) {
        super("Unrecognized " + enumType.getSimpleName() + " token: " + (token == null ? "null" : "\"" + token + "\""));
        this.enumType = enumType;
        this.token = token;
    }

    public Class<?> getEnumType() {
        return enumType;
    }

    public String getToken() {
        return token;
    }
}
