package com.z254.prism.exception;

/**
 * Wraps a failure of the upstream monitoring API (non-2xx status, unreadable body).
 */
public class CollaboratorException extends PrismException {

    public static final String CODE = "UPSTREAM_ERROR";

    private final String collaborator;

    public CollaboratorException(String collaborator, String message, Throwable cause) {
        super(collaborator + " request failed: " + message, CODE,
                "The monitoring API returned an error. Try again later or check the portal status.", cause);
        this.collaborator = collaborator;
    }

    public String getCollaborator() {
        return collaborator;
    }
}
