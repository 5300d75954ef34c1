/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.exceptions;

/**
 * Exception thrown by the HTTP transport when a GET cannot be completed (I/O failure, timeout, interruption).
 *
 * <p>
 * The API client propagates this exception as-is; it is never retried or re-wrapped.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
