package com.docvault.search.exception;

/**
 * The search backend answered with an error or a payload that could not be read.
 */
public class SearchBackendException extends RuntimeException {
    public SearchBackendException(String message) {
        super(message);
    }

    public SearchBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
