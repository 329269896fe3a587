package com.example.checkout.infrastructure.exception;

/**
 * A collaborator answered with a server error or could not be reached.
 * Surfaces to the orchestrator as an {@code unavailable} failure marked retryable.
 */
public class RetryableServiceException extends RuntimeException {

    private final String collaborator;
    private final int statusCode;

    public RetryableServiceException(String collaborator, int statusCode, String message) {
        super(message);
        this.collaborator = collaborator;
        this.statusCode = statusCode;
    }

    public String getCollaborator() {
        return collaborator;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
