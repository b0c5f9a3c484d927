package io.github.drompincen.labseed.runtime.error;

/**
 * A remote call failed. {@code status} is the HTTP status, or 0 when no response was received.
 */
public class TransportException extends SeedException {

    public static final int NO_RESPONSE = 0;

    private final int status;

    public TransportException(int status, String message) {
        super(message);
        this.status = status;
    }

    public TransportException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public int getStatus() {
        return status;
    }

    /** The platform refused the operation for this account or tier. */
    public boolean isAuthorizationDenied() {
        return status == 403;
    }

    public boolean isNotFound() {
        return status == 404;
    }
}
