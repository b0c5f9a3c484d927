package io.github.drompincen.labseed.protocol.document;

import java.util.List;

/**
 * Root of a seed document: the users referenced by memberships and assignments,
 * and the top-level groups.
 */
public record SeedDocument(
        List<UserSpec> users,
        List<GroupSpec> groups
) {
    public SeedDocument {
        users = users == null ? List.of() : List.copyOf(users);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }
}
