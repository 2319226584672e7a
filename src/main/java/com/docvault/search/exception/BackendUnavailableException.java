package com.docvault.search.exception;

/**
 * The search backend could not be reached (connection or I/O failure, or retries exhausted).
 */
public class BackendUnavailableException extends SearchBackendException {
    public BackendUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
