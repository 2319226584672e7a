package com.docvault.search.exception;

/**
 * Raised at the HTTP boundary when a looked-up document does not exist.
 */
public class DocumentNotFoundException extends RuntimeException {
    public DocumentNotFoundException(String message) {
        super(message);
    }
}
