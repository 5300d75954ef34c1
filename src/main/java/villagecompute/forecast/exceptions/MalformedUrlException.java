/*
 * Copyright (c) 2025 VillageCompute Inc. All rights reserved.
 */
package villagecompute.forecast.exceptions;

/**
 * Exception thrown when a request URL cannot be assembled into a syntactically valid URI.
 *
 * <p>
 * Well-formed coordinates and API keys never trigger this; it signals a broken base URL or an invariant violation and
 * must not be retried.
 */
public class MalformedUrlException extends RuntimeException {

    public MalformedUrlException(String message) {
        super(message);
    }

    public MalformedUrlException(String message, Throwable cause) {
        super(message, cause);
    }
}
