package io.github.drompincen.labseed.runtime.platform;

import io.github.drompincen.labseed.protocol.document.EntityKind;

import java.util.Optional;

/**
 * Optional platform features that are only available on some tiers.
 */
public enum Capability {
    EPICS,
    ITERATIONS;

    public static Optional<Capability> requiredFor(EntityKind kind) {
        return switch (kind) {
            case EPIC -> Optional.of(EPICS);
            case ITERATION -> Optional.of(ITERATIONS);
            default -> Optional.empty();
        };
    }

    public String displayName() {
        return name().toLowerCase();
    }
}
