package io.github.drompincen.labseed.runtime.error;

import io.github.drompincen.labseed.protocol.document.EntityKind;

/**
 * An entity with the declared name already exists and the run rejects duplicates.
 */
public class ConflictException extends SeedException {

    private final EntityKind kind;
    private final String name;

    public ConflictException(EntityKind kind, String name, String where) {
        super(kind.displayName() + " '" + name + "' already exists in " + where + " and duplicates are rejected");
        this.kind = kind;
        this.name = name;
    }

    public EntityKind getKind() {
        return kind;
    }

    public String getName() {
        return name;
    }
}
