package io.github.drompincen.labseed.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.error.TransportException;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link PlatformClient} over the GitLab REST v4 API, with iterations created through
 * {@link GraphQlIterationChannel}.
 *
 * <p>Lookups use the API's {@code search} or {@code title} filter and then keep only an
 * exact name match, since search is a substring match.
 */
@Component
public class GitLabClient implements PlatformClient {

    private static final Logger log = LoggerFactory.getLogger(GitLabClient.class);
    private static final int PAGE_SIZE = 100;

    private final GitLabTransport transport;
    private final GraphQlIterationChannel iterations;
    private final GitLabProperties properties;

    public GitLabClient(GitLabTransport transport, GraphQlIterationChannel iterations, GitLabProperties properties) {
        this.transport = transport;
        this.iterations = iterations;
        this.properties = properties;
    }

    // -----------------------------------------------------------------------
    // Users and containers
    // -----------------------------------------------------------------------

    @Override
    public RemoteRef currentUser() {
        RemoteRef me = GitLabRefs.toRef(EntityKind.USER, transport.get("/user"), null);
        log.info("Authenticated as {}", me.name());
        return me;
    }

    @Override
    public Optional<RemoteRef> findUser(String username) {
        JsonNode users = transport.get("/users", query("username", username));
        for (JsonNode user : users) {
            if (username.equalsIgnoreCase(user.path("username").asText())) {
                return Optional.of(GitLabRefs.toRef(EntityKind.USER, user, null));
            }
        }
        return Optional.empty();
    }

    @Override
    public Optional<Container> resolveGroup(String fullPath) {
        return transport.getOptional("/groups/" + GitLabTransport.encode(fullPath))
                .map(node -> GitLabRefs.toContainer(EntityKind.GROUP, node, properties.groupCapabilities()));
    }

    @Override
    public Container describe(RemoteRef ref) {
        JsonNode node = transport.get(containerPath(ref.kind(), ref.id()));
        return GitLabRefs.toContainer(ref.kind(), node, properties.groupCapabilities());
    }

    // -----------------------------------------------------------------------
    // Find, create, update
    // -----------------------------------------------------------------------

    @Override
    public Optional<RemoteRef> find(EntityKind kind, Container container, String name) {
        return switch (kind) {
            case GROUP -> container == null
                    ? findExact(kind, null, "/groups", name, query("search", name, "top_level_only", true))
                    : findExact(kind, container, containerPath(container) + "/subgroups", name, query("search", name));
            case PROJECT -> findExact(kind, container, containerPath(container) + "/projects", name,
                    query("search", name, "with_shared", false));
            case LABEL -> findExact(kind, container, containerPath(container) + "/labels", name,
                    query("search", name, "include_ancestor_groups", false));
            case MILESTONE -> findExact(kind, container, containerPath(container) + "/milestones", name,
                    query("title", name));
            case ITERATION -> findExact(kind, container, containerPath(container) + "/iterations", name,
                    query("search", name, "include_ancestors", false));
            case EPIC -> findExact(kind, container, containerPath(container) + "/epics", name,
                    query("search", name, "include_ancestor_groups", false, "include_descendant_groups", false));
            case ISSUE -> findExact(kind, container, containerPath(container) + "/issues", name,
                    query("search", name, "in", "title", "scope", "all"));
            default -> throw new IllegalArgumentException("Cannot look up " + kind.displayName() + " entities");
        };
    }

    /**
     * Walks the result pages of a filtered listing until an entity named exactly {@code name}
     * turns up or a short page marks the end of the listing.
     */
    private Optional<RemoteRef> findExact(EntityKind kind, Container container, String path, String name,
                                          Map<String, Object> filter) {
        for (int page = 1; ; page++) {
            Map<String, Object> pageQuery = new LinkedHashMap<>(filter);
            pageQuery.put("per_page", PAGE_SIZE);
            pageQuery.put("page", page);
            JsonNode candidates = transport.get(path, pageQuery);
            for (JsonNode candidate : candidates) {
                if (name.equals(GitLabRefs.nameOf(kind, candidate)) && ownedBy(kind, container, candidate)) {
                    return Optional.of(GitLabRefs.toRef(kind, candidate, container));
                }
            }
            if (candidates.size() < PAGE_SIZE) {
                return Optional.empty();
            }
            log.debug("No exact match for {} '{}' on page {} of {}", kind.displayName(), name, page, path);
        }
    }

    // a group listing also returns projects shared into the group from other namespaces
    private static boolean ownedBy(EntityKind kind, Container container, JsonNode candidate) {
        if (kind != EntityKind.PROJECT || container == null) {
            return true;
        }
        return candidate.path("namespace").path("id").asLong(container.id()) == container.id();
    }

    @Override
    public RemoteRef create(EntityKind kind, Container container, Map<String, Object> fields) {
        Map<String, Object> body = new LinkedHashMap<>(fields);
        String path = switch (kind) {
            case GROUP -> {
                if (container != null) {
                    body.put("parent_id", container.id());
                }
                yield "/groups";
            }
            case PROJECT -> {
                body.put("namespace_id", container.id());
                yield "/projects";
            }
            case LABEL -> containerPath(container) + "/labels";
            case MILESTONE -> containerPath(container) + "/milestones";
            case EPIC -> containerPath(container) + "/epics";
            case ISSUE -> containerPath(container) + "/issues";
            case ITERATION -> throw new IllegalArgumentException("Iterations are created with createIteration");
            default -> throw new IllegalArgumentException("Cannot create " + kind.displayName() + " entities");
        };
        return GitLabRefs.toRef(kind, transport.post(path, body), container);
    }

    @Override
    public RemoteRef update(RemoteRef ref, Map<String, Object> fields) {
        return GitLabRefs.toRef(ref.kind(), transport.put(entityPath(ref), fields), containerOf(ref));
    }

    @Override
    public RemoteRef refresh(RemoteRef ref) {
        if (ref.kind() == EntityKind.LABEL || ref.kind() == EntityKind.ITERATION || ref.kind() == EntityKind.USER) {
            return ref;
        }
        return GitLabRefs.toRef(ref.kind(), transport.get(entityPath(ref)), containerOf(ref));
    }

    @Override
    public boolean isReady(RemoteRef project) {
        JsonNode node = transport.get(containerPath(EntityKind.PROJECT, project.id()));
        String importStatus = node.path("import_status").asText("none");
        boolean importing = !"none".equals(importStatus) && !"finished".equals(importStatus);
        return !importing && !node.path("empty_repo").asBoolean(true);
    }

    // -----------------------------------------------------------------------
    // Members
    // -----------------------------------------------------------------------

    @Override
    public Optional<Integer> findMemberAccessLevel(Container container, long userId) {
        return transport.getOptional(containerPath(container) + "/members/all/" + userId)
                .map(member -> member.path("access_level").asInt());
    }

    @Override
    public void addMember(Container container, long userId, int accessLevel) {
        try {
            transport.post(containerPath(container) + "/members",
                    Map.of("user_id", userId, "access_level", accessLevel));
        } catch (TransportException e) {
            if (e.getStatus() != 409) {
                throw e;
            }
            log.debug("User {} is already a direct member of {}, raising access to {}", userId, container, accessLevel);
            transport.put(containerPath(container) + "/members/" + userId, Map.of("access_level", accessLevel));
        }
    }

    @Override
    public RemoteRef createIteration(Container group, Map<String, Object> fields) {
        return iterations.create(group, fields);
    }

    // -----------------------------------------------------------------------
    // Paths
    // -----------------------------------------------------------------------

    private static String containerPath(Container container) {
        if (container == null) {
            throw new IllegalArgumentException("A container is required");
        }
        return containerPath(container.kind(), container.id());
    }

    private static String containerPath(EntityKind kind, long id) {
        return switch (kind) {
            case GROUP -> "/groups/" + id;
            case PROJECT -> "/projects/" + id;
            default -> throw new IllegalArgumentException(kind.displayName() + " is not a container");
        };
    }

    static String entityPath(RemoteRef ref) {
        return switch (ref.kind()) {
            case GROUP, PROJECT -> containerPath(ref.kind(), ref.id());
            case EPIC -> containerPath(EntityKind.GROUP, ref.containerId()) + "/epics/" + ref.iid();
            case ISSUE -> containerPath(EntityKind.PROJECT, ref.containerId()) + "/issues/" + ref.iid();
            case MILESTONE -> containerPath(ref.containerKind(), ref.containerId()) + "/milestones/" + ref.id();
            default -> throw new IllegalArgumentException("Cannot address " + ref.kind().displayName() + " entities");
        };
    }

    private static Container containerOf(RemoteRef ref) {
        if (ref.containerKind() == null) {
            return null;
        }
        return new Container(ref.containerKind(), ref.containerId(), null, null, null);
    }

    private static Map<String, Object> query(Object... keyValues) {
        Map<String, Object> query = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            query.put((String) keyValues[i], keyValues[i + 1]);
        }
        return query;
    }
}
