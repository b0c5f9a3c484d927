package io.github.drompincen.labseed.runtime.materialize;

import io.github.drompincen.labseed.runtime.platform.RemoteRef;

/**
 * Outcome of materializing one declaration. {@code ref} is null when the entity kind is
 * not supported in its container.
 */
public record Materialization(Declaration declaration, Outcome outcome, RemoteRef ref) {

    public enum Outcome {
        CREATED,
        REUSED,
        UNSUPPORTED
    }

    public static Materialization created(Declaration declaration, RemoteRef ref) {
        return new Materialization(declaration, Outcome.CREATED, ref);
    }

    public static Materialization reused(Declaration declaration, RemoteRef ref) {
        return new Materialization(declaration, Outcome.REUSED, ref);
    }

    public static Materialization unsupported(Declaration declaration) {
        return new Materialization(declaration, Outcome.UNSUPPORTED, null);
    }

    public boolean isUnsupported() {
        return outcome == Outcome.UNSUPPORTED;
    }
}
