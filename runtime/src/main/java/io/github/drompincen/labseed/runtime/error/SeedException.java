package io.github.drompincen.labseed.runtime.error;

/**
 * Base of every fatal failure raised while seeding.
 */
public class SeedException extends RuntimeException {

    public SeedException(String message) {
        super(message);
    }

    public SeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
