/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.exceptions;

/**
 * Exception thrown when request input validation fails (e.g., non-finite coordinates, negative timestamp).
 *
 * <p>
 * Extends RuntimeException per project standards.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
