package com.knowledgeengine.exception;

/**
 * Exception thrown when a request is structurally invalid: a malformed URI,
 * an out-of-range weight, or content on a resource node.
 */
public class InvalidRequestException extends RuntimeException {

    public InvalidRequestException(String message) {
        super(message);
    }
}
