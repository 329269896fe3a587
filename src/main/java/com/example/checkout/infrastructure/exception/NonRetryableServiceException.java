package com.example.checkout.infrastructure.exception;

/**
 * A collaborator refused the request with a 4xx status.
 * Adapters map specific codes to domain reasons (404 on the catalog, 402 on payment),
 * everything else becomes a {@code rejected} failure.
 */
public class NonRetryableServiceException extends RuntimeException {

    private final String collaborator;
    private final int statusCode;

    public NonRetryableServiceException(String collaborator, int statusCode, String message) {
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
