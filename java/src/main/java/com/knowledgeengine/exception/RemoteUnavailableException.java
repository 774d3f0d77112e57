package com.knowledgeengine.exception;

/**
 * Exception raised when a remote workspace cannot be reached in time.
 * Traversal and link turn it into a warning; only an explicit fetch reports it as an error.
 */
public class RemoteUnavailableException extends RuntimeException {

    private final String uri;

    public RemoteUnavailableException(String uri, String message) {
        super(message);
        this.uri = uri;
    }

    public RemoteUnavailableException(String uri, String message, Throwable cause) {
        super(message, cause);
        this.uri = uri;
    }

    public String getUri() {
        return uri;
    }
}
