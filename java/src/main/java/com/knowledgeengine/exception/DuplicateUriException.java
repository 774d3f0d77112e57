package com.knowledgeengine.exception;

/**
 * Exception thrown when a create or move would collide with an existing node URI.
 */
public class DuplicateUriException extends RuntimeException {

    public DuplicateUriException(String message) {
        super(message);
    }

    public DuplicateUriException(String resource, String identifier) {
        super(String.format("%s with identifier '%s' already exists", resource, identifier));
    }
}
