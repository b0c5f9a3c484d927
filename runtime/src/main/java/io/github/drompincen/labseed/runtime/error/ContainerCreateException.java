package io.github.drompincen.labseed.runtime.error;

import io.github.drompincen.labseed.protocol.document.EntityKind;

/**
 * A group or project could not be found or created, so nothing nested in it can be.
 */
public class ContainerCreateException extends SeedException {

    private final EntityKind kind;
    private final String containerName;

    public ContainerCreateException(EntityKind kind, String containerName, String message) {
        super("Cannot materialize " + kind.displayName() + " '" + containerName + "': " + message);
        this.kind = kind;
        this.containerName = containerName;
    }

    public ContainerCreateException(EntityKind kind, String containerName, Throwable cause) {
        super("Cannot materialize " + kind.displayName() + " '" + containerName + "': " + cause.getMessage(), cause);
        this.kind = kind;
        this.containerName = containerName;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getContainerName() {
        return containerName;
    }
}
