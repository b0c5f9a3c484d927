package io.github.drompincen.labseed.runtime.platform;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.error.TransportException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Platform fake for engine tests. Keeps entities in memory, records every find, create
 * and update in call order, and can be told to deny epics or iterations with a 403.
 */
public class InMemoryPlatformClient implements PlatformClient {

    private final Map<Long, RemoteRef> entities = new LinkedHashMap<>();
    private final Map<Long, Map<String, Object>> applied = new HashMap<>();
    private final Map<String, RemoteRef> users = new HashMap<>();
    private final Map<String, Container> existingGroups = new HashMap<>();
    private final Map<String, Integer> memberships = new HashMap<>();
    private final List<String> calls = new ArrayList<>();

    private long nextId = 100;
    private RemoteRef me = RemoteRef.of(EntityKind.USER, 1, "root");
    private CapabilityDescriptor groupCapabilities = CapabilityDescriptor.unknown();
    private boolean epicsDenied;
    private boolean iterationsDenied;

    // -----------------------------------------------------------------------
    // Setup
    // -----------------------------------------------------------------------

    public InMemoryPlatformClient withUser(long id, String username) {
        users.put(username, RemoteRef.of(EntityKind.USER, id, username));
        return this;
    }

    public InMemoryPlatformClient withCurrentUser(long id, String username) {
        me = RemoteRef.of(EntityKind.USER, id, username);
        return this;
    }

    public InMemoryPlatformClient withExistingGroup(String fullPath) {
        long id = nextId++;
        existingGroups.put(fullPath, new Container(EntityKind.GROUP, id, fullPath, fullPath, groupCapabilities));
        return this;
    }

    public InMemoryPlatformClient withGroupCapabilities(CapabilityDescriptor capabilities) {
        this.groupCapabilities = capabilities;
        return this;
    }

    public InMemoryPlatformClient denyEpics() {
        this.epicsDenied = true;
        return this;
    }

    public InMemoryPlatformClient denyIterations() {
        this.iterationsDenied = true;
        return this;
    }

    // -----------------------------------------------------------------------
    // Inspection
    // -----------------------------------------------------------------------

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public List<String> callsMatching(String fragment) {
        return calls.stream().filter(c -> c.contains(fragment)).toList();
    }

    public void clearCalls() {
        calls.clear();
    }

    public List<RemoteRef> entities(EntityKind kind) {
        return entities.values().stream().filter(e -> e.kind() == kind).toList();
    }

    public RemoteRef entity(EntityKind kind, String name) {
        return entities(kind).stream().filter(e -> e.name().equals(name)).findFirst()
                .orElseThrow(() -> new AssertionError("no " + kind.displayName() + " named " + name));
    }

    /** Fields other than labels, description and state applied to an entity by updates. */
    public Map<String, Object> applied(long id) {
        return applied.getOrDefault(id, Map.of());
    }

    public Optional<Integer> membership(long containerId, long userId) {
        return Optional.ofNullable(memberships.get(containerId + ":" + userId));
    }

    // -----------------------------------------------------------------------
    // PlatformClient
    // -----------------------------------------------------------------------

    @Override
    public RemoteRef currentUser() {
        calls.add("current user");
        return me;
    }

    @Override
    public Optional<RemoteRef> findUser(String username) {
        calls.add("find user " + username);
        return Optional.ofNullable(users.get(username));
    }

    @Override
    public Optional<Container> resolveGroup(String fullPath) {
        return Optional.ofNullable(existingGroups.get(fullPath));
    }

    @Override
    public Container describe(RemoteRef ref) {
        CapabilityDescriptor capabilities = ref.kind() == EntityKind.GROUP ? groupCapabilities : CapabilityDescriptor.none();
        return new Container(ref.kind(), ref.id(), ref.name(), ref.name(), capabilities);
    }

    @Override
    public Optional<RemoteRef> find(EntityKind kind, Container container, String name) {
        calls.add("find " + kind.displayName() + " " + name);
        deny(kind);
        long containerId = container == null ? 0 : container.id();
        return entities.values().stream()
                .filter(e -> e.kind() == kind && e.containerId() == containerId && e.name().equals(name))
                .findFirst();
    }

    @Override
    public RemoteRef create(EntityKind kind, Container container, Map<String, Object> fields) {
        deny(kind);
        String name = (String) (fields.containsKey("title") ? fields.get("title") : fields.get("name"));
        calls.add("create " + kind.displayName() + " " + name);
        long id = nextId++;
        long iid = kind == EntityKind.EPIC || kind == EntityKind.ISSUE ? id - 99 : 0;
        String state = kind == EntityKind.MILESTONE || kind == EntityKind.ITERATION ? "active" : "opened";
        RemoteRef ref = new RemoteRef(kind, id, iid, name,
                container == null ? null : container.kind(), container == null ? 0 : container.id(),
                state, (String) fields.get("description"), List.of());
        entities.put(id, ref);
        return ref;
    }

    @Override
    public RemoteRef update(RemoteRef ref, Map<String, Object> fields) {
        calls.add("update " + ref.kind().displayName() + " " + ref.name() + " " + new TreeSet<>(fields.keySet()));
        deny(ref.kind());
        if (epicsDenied && (fields.containsKey("epic_id") || fields.containsKey("parent_id"))) {
            throw new TransportException(403, "403 Forbidden");
        }
        RemoteRef current = entities.getOrDefault(ref.id(), ref);
        List<String> labels = current.labels();
        String description = current.description();
        String state = current.state();
        for (Map.Entry<String, Object> field : fields.entrySet()) {
            switch (field.getKey()) {
                case "labels" -> labels = Arrays.asList(((String) field.getValue()).split(","));
                case "description" -> description = (String) field.getValue();
                case "state_event" -> state = "close".equals(field.getValue()) ? "closed" : "opened";
                default -> applied.computeIfAbsent(ref.id(), k -> new HashMap<>()).put(field.getKey(), field.getValue());
            }
        }
        RemoteRef updated = new RemoteRef(current.kind(), current.id(), current.iid(), current.name(),
                current.containerKind(), current.containerId(), state, description, labels);
        entities.put(updated.id(), updated);
        return updated;
    }

    @Override
    public RemoteRef refresh(RemoteRef ref) {
        return entities.getOrDefault(ref.id(), ref);
    }

    @Override
    public boolean isReady(RemoteRef project) {
        return true;
    }

    @Override
    public Optional<Integer> findMemberAccessLevel(Container container, long userId) {
        return membership(container.id(), userId);
    }

    @Override
    public void addMember(Container container, long userId, int accessLevel) {
        calls.add("add member " + userId + " to " + container.name());
        memberships.put(container.id() + ":" + userId, accessLevel);
    }

    @Override
    public RemoteRef createIteration(Container group, Map<String, Object> fields) {
        if (iterationsDenied) {
            throw new TransportException(403, "iterations are not available");
        }
        return create(EntityKind.ITERATION, group, fields);
    }

    private void deny(EntityKind kind) {
        if (kind == EntityKind.EPIC && epicsDenied) {
            throw new TransportException(403, "403 Forbidden");
        }
        if (kind == EntityKind.ITERATION && iterationsDenied) {
            throw new TransportException(403, "403 Forbidden");
        }
    }
}
