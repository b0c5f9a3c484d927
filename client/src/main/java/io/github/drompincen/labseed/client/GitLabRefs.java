package io.github.drompincen.labseed.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.platform.CapabilityDescriptor;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps GitLab REST payloads to engine refs and containers.
 */
final class GitLabRefs {

    private GitLabRefs() {}

    static RemoteRef toRef(EntityKind kind, JsonNode node, Container container) {
        return switch (kind) {
            case GROUP -> {
                long parentId = node.path("parent_id").asLong(0);
                yield new RemoteRef(kind, node.path("id").asLong(), 0, node.path("name").asText(),
                        parentId == 0 ? null : EntityKind.GROUP, parentId, null, text(node, "description"), List.of());
            }
            case PROJECT -> new RemoteRef(kind, node.path("id").asLong(), 0, node.path("name").asText(),
                    EntityKind.GROUP, node.path("namespace").path("id").asLong(containerId(container)),
                    null, text(node, "description"), List.of());
            case USER -> RemoteRef.of(kind, node.path("id").asLong(), node.path("username").asText());
            case LABEL -> new RemoteRef(kind, node.path("id").asLong(), 0, node.path("name").asText(),
                    containerKind(container), containerId(container), null, text(node, "description"), List.of());
            case MILESTONE -> {
                EntityKind owner = node.hasNonNull("group_id") ? EntityKind.GROUP
                        : node.hasNonNull("project_id") ? EntityKind.PROJECT : containerKind(container);
                long ownerId = node.hasNonNull("group_id") ? node.path("group_id").asLong()
                        : node.path("project_id").asLong(containerId(container));
                yield new RemoteRef(kind, node.path("id").asLong(), node.path("iid").asLong(),
                        node.path("title").asText(), owner, ownerId, text(node, "state"),
                        text(node, "description"), List.of());
            }
            case ITERATION -> new RemoteRef(kind, node.path("id").asLong(), node.path("iid").asLong(),
                    node.path("title").asText(), EntityKind.GROUP,
                    node.path("group_id").asLong(containerId(container)), text(node, "state"),
                    text(node, "description"), List.of());
            case EPIC -> new RemoteRef(kind, node.path("id").asLong(), node.path("iid").asLong(),
                    node.path("title").asText(), EntityKind.GROUP,
                    node.path("group_id").asLong(containerId(container)), text(node, "state"),
                    text(node, "description"), labels(node));
            case ISSUE -> new RemoteRef(kind, node.path("id").asLong(), node.path("iid").asLong(),
                    node.path("title").asText(), EntityKind.PROJECT,
                    node.path("project_id").asLong(containerId(container)), text(node, "state"),
                    text(node, "description"), labels(node));
            case MEMBER -> throw new IllegalArgumentException("Memberships have no ref");
        };
    }

    static Container toContainer(EntityKind kind, JsonNode node, CapabilityDescriptor groupCapabilities) {
        if (kind == EntityKind.GROUP) {
            return new Container(kind, node.path("id").asLong(), node.path("name").asText(),
                    node.path("full_path").asText(), groupCapabilities);
        }
        return new Container(kind, node.path("id").asLong(), node.path("name").asText(),
                node.path("path_with_namespace").asText(), CapabilityDescriptor.none());
    }

    /** Name or title field used for exact-match lookups. */
    static String nameOf(EntityKind kind, JsonNode node) {
        return switch (kind) {
            case GROUP, PROJECT, LABEL -> node.path("name").asText();
            case USER -> node.path("username").asText();
            default -> node.path("title").asText();
        };
    }

    private static List<String> labels(JsonNode node) {
        List<String> labels = new ArrayList<>();
        for (JsonNode label : node.path("labels")) {
            // with_labels_details=true returns objects instead of names
            labels.add(label.isObject() ? label.path("name").asText() : label.asText());
        }
        return labels;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static EntityKind containerKind(Container container) {
        return container == null ? null : container.kind();
    }

    private static long containerId(Container container) {
        return container == null ? 0 : container.id();
    }
}
