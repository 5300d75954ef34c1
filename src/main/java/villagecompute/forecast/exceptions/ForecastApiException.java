/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.exceptions;

/**
 * Exception thrown when the Pirate Weather API answers with a non-success status or a body that cannot be decoded.
 */
public class ForecastApiException extends RuntimeException {

    private final int statusCode;

    public ForecastApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public ForecastApiException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * @return HTTP status of the response that caused the failure
     */
    public int getStatusCode() {
        return statusCode;
    }
}
