package io.github.drompincen.labseed.runtime.registry;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Logical id to remote entity mapping, one table per entity kind, for one run.
 * Entries are write-once: an id is never remapped or removed.
 */
public class ReferenceRegistry {

    private final Map<EntityKind, Map<String, RemoteRef>> tables = new EnumMap<>(EntityKind.class);

    /**
     * Maps {@code logicalId} to {@code ref}. Registering the same remote entity again is a
     * no-op and returns false.
     *
     * @throws IllegalStateException if the id is already mapped to a different entity
     */
    public boolean register(EntityKind kind, String logicalId, RemoteRef ref) {
        if (logicalId == null || ref == null) {
            throw new IllegalArgumentException("logicalId and ref are required");
        }
        Map<String, RemoteRef> table = tables.computeIfAbsent(kind, k -> new LinkedHashMap<>());
        RemoteRef existing = table.get(logicalId);
        if (existing == null) {
            table.put(logicalId, ref);
            return true;
        }
        if (existing.id() == ref.id()) {
            return false;
        }
        throw new IllegalStateException(kind.displayName() + " '" + logicalId
                + "' is already registered to remote id " + existing.id() + ", refusing " + ref.id());
    }

    public Optional<RemoteRef> lookup(EntityKind kind, String logicalId) {
        if (logicalId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tables.getOrDefault(kind, Map.of()).get(logicalId));
    }

    public Optional<Long> remoteId(EntityKind kind, String logicalId) {
        return lookup(kind, logicalId).map(RemoteRef::id);
    }

    /** Labels are addressed by name on the platform, so their registry value is the name. */
    public Optional<String> labelName(String logicalId) {
        return lookup(EntityKind.LABEL, logicalId).map(RemoteRef::name);
    }

    public boolean contains(EntityKind kind, String logicalId) {
        return lookup(kind, logicalId).isPresent();
    }

    public Map<String, RemoteRef> snapshot(EntityKind kind) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(tables.getOrDefault(kind, Map.of())));
    }

    public int size(EntityKind kind) {
        return tables.getOrDefault(kind, Map.of()).size();
    }
}
