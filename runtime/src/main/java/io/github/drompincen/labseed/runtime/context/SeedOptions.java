package io.github.drompincen.labseed.runtime.context;

import java.time.Duration;

/**
 * Per-run settings.
 *
 * @param parentPath          full path of an existing group that top-level groups are created in, or null
 * @param visibility          visibility of created groups and projects
 * @param settlePollInterval  delay between readiness checks of a new project
 * @param settleTimeout       give up waiting for project readiness after this long
 */
public record SeedOptions(
        DuplicatePolicy duplicatePolicy,
        LinkMode linkMode,
        String parentPath,
        String visibility,
        Duration settlePollInterval,
        Duration settleTimeout
) {
    public SeedOptions {
        duplicatePolicy = duplicatePolicy == null ? DuplicatePolicy.REUSE : duplicatePolicy;
        linkMode = linkMode == null ? LinkMode.INLINE : linkMode;
        parentPath = parentPath == null || parentPath.isBlank() ? null : parentPath.strip();
        visibility = visibility == null || visibility.isBlank() ? "private" : visibility;
        settlePollInterval = settlePollInterval == null ? Duration.ofMillis(500) : settlePollInterval;
        settleTimeout = settleTimeout == null ? Duration.ofSeconds(30) : settleTimeout;
    }

    public static SeedOptions defaults() {
        return new SeedOptions(null, null, null, null, null, null);
    }

    public SeedOptions withDuplicatePolicy(DuplicatePolicy policy) {
        return new SeedOptions(policy, linkMode, parentPath, visibility, settlePollInterval, settleTimeout);
    }

    public SeedOptions withLinkMode(LinkMode mode) {
        return new SeedOptions(duplicatePolicy, mode, parentPath, visibility, settlePollInterval, settleTimeout);
    }

    public SeedOptions withParentPath(String path) {
        return new SeedOptions(duplicatePolicy, linkMode, path, visibility, settlePollInterval, settleTimeout);
    }
}
