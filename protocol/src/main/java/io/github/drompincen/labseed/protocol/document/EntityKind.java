package io.github.drompincen.labseed.protocol.document;

public enum EntityKind {
    GROUP,
    PROJECT,
    LABEL,
    MILESTONE,
    ITERATION,
    EPIC,
    ISSUE,
    USER,
    MEMBER;

    public String displayName() {
        return name().toLowerCase();
    }
}
