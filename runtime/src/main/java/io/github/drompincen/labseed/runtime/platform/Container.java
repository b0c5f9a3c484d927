package io.github.drompincen.labseed.runtime.platform;

import io.github.drompincen.labseed.protocol.document.EntityKind;

/**
 * A remote group or project that other entities are created in.
 */
public record Container(
        EntityKind kind,
        long id,
        String name,
        String fullPath,
        CapabilityDescriptor capabilities
) {
    public Container {
        if (kind != EntityKind.GROUP && kind != EntityKind.PROJECT) {
            throw new IllegalArgumentException("Container must be a group or project, got " + kind);
        }
        capabilities = capabilities == null ? CapabilityDescriptor.unknown() : capabilities;
    }

    public boolean isGroup() {
        return kind == EntityKind.GROUP;
    }

    @Override
    public String toString() {
        return kind.displayName() + " " + fullPath;
    }
}
