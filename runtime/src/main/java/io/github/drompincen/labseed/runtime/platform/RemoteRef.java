package io.github.drompincen.labseed.runtime.platform;

import io.github.drompincen.labseed.protocol.document.EntityKind;

import java.util.List;

/**
 * Handle on an entity that exists remotely.
 *
 * @param id            platform-wide id
 * @param iid           id within the container (epics, issues), 0 when the kind has none
 * @param name          name or title
 * @param containerKind kind of the enclosing container, null for top-level entities
 * @param containerId   id of the enclosing container, 0 for top-level entities
 * @param state         remote state as reported by the platform, may be null
 * @param description   remote description, may be null
 * @param labels        label names currently attached
 */
public record RemoteRef(
        EntityKind kind,
        long id,
        long iid,
        String name,
        EntityKind containerKind,
        long containerId,
        String state,
        String description,
        List<String> labels
) {
    public RemoteRef {
        labels = labels == null ? List.of() : List.copyOf(labels);
    }

    public static RemoteRef of(EntityKind kind, long id, String name) {
        return new RemoteRef(kind, id, 0, name, null, 0, null, null, List.of());
    }

    public boolean isClosed() {
        return "closed".equals(state);
    }
}
