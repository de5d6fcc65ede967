package com.crawlpilot.orchestrator.backend;

/**
 * Thrown when the remote browser backend returns an error status or is unreachable.
 */
public class BackendException extends RuntimeException {

    public BackendException(String message) {
        super(message);
    }

    public BackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
