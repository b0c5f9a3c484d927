package io.github.drompincen.labseed.runtime.context;

/**
 * What to do when a declared entity's name is already taken in its container.
 */
public enum DuplicatePolicy {
    /** Adopt the existing entity and keep going. Makes re-runs idempotent. */
    REUSE,
    /** Abort the run with a conflict, leaving the existing entity untouched. */
    REJECT;

    public static DuplicatePolicy parse(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
