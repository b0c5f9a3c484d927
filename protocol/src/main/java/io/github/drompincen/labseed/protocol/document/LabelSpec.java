package io.github.drompincen.labseed.protocol.document;

public record LabelSpec(
        String id,
        String name,
        String color,
        String description
) {}
