package io.github.drompincen.labseed.runtime.platform;

import io.github.drompincen.labseed.protocol.document.EntityKind;

import java.util.Map;
import java.util.Optional;

/**
 * Remote operations the engine needs from a collaboration platform. Implementations
 * are synchronous and report failures as {@link io.github.drompincen.labseed.runtime.error.TransportException}.
 *
 * <p>Field maps use the platform's own parameter names. A {@code null} container in
 * {@link #find} and {@link #create} means the instance root (top-level groups).
 */
public interface PlatformClient {

    RemoteRef currentUser();

    Optional<RemoteRef> findUser(String username);

    /** Resolves an existing group by full path, used for the optional parent of top-level groups. */
    Optional<Container> resolveGroup(String fullPath);

    /** Builds the container descriptor, capabilities included, for a group or project ref. */
    Container describe(RemoteRef ref);

    Optional<RemoteRef> find(EntityKind kind, Container container, String name);

    RemoteRef create(EntityKind kind, Container container, Map<String, Object> fields);

    RemoteRef update(RemoteRef ref, Map<String, Object> fields);

    RemoteRef refresh(RemoteRef ref);

    /** True once a freshly created project finished its asynchronous repository setup. */
    boolean isReady(RemoteRef project);

    /** Access level of the user in the container, inherited memberships included. */
    Optional<Integer> findMemberAccessLevel(Container container, long userId);

    void addMember(Container container, long userId, int accessLevel);

    /**
     * Creates an iteration through the secondary structured-mutation channel, since
     * the primary API cannot create iterations.
     */
    RemoteRef createIteration(Container group, Map<String, Object> fields);
}
