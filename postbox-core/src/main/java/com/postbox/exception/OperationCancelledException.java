package com.postbox.exception;

import com.postbox.cancellation.CancellationToken;

import java.util.concurrent.CancellationException;

/**
 * Thrown when a cancellation token fires while an operation is pending.
 */
public class OperationCancelledException extends CancellationException {

    /** The token that fired, may be null when not known. */
    private final transient CancellationToken token;

    /**
     * Creates a new OperationCancelledException scoped to the given token.
     *
     * @param token the token that fired
     */
    public OperationCancelledException(CancellationToken token) {
        this("Operation was cancelled", token);
    }

    /**
     * Creates a new OperationCancelledException with a detail message.
     *
     * @param message the detail message
     * @param token the token that fired
     */
    public OperationCancelledException(String message, CancellationToken token) {
        super(message);
        this.token = token;
    }

    /**
     * Creates a new OperationCancelledException that masks the given cause.
     *
     * @param token the token the operation was scoped to
     * @param cause the underlying failure
     */
    public OperationCancelledException(CancellationToken token, Throwable cause) {
        this("Operation was cancelled", token);
        initCause(cause);
    }

    /**
     * Returns the token this cancellation is scoped to.
     *
     * @return the token, or null if not specified
     */
    public CancellationToken getToken() {
        return token;
    }
}
