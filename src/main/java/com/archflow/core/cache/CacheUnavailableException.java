package com.archflow.core.cache;

/**
 * The backing fingerprint store could not be reached or returned unreadable data.
 * Never escapes {@link DesignCache}.
 */
public class CacheUnavailableException extends RuntimeException {

    public CacheUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
