package io.github.drompincen.labseed.runtime.link;

import io.github.drompincen.labseed.runtime.platform.RemoteRef;

/**
 * Attaches an issue to an iteration. Kept behind its own interface because the platform
 * offers no structured field for it; only the implementation changes if one appears.
 */
public interface IterationLinker {

    /**
     * @return the updated issue, or {@code issue} unchanged when it is already linked
     */
    RemoteRef link(RemoteRef issue, RemoteRef iteration);
}
