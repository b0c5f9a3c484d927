package io.github.drompincen.labseed.runtime.link;

import io.github.drompincen.labseed.runtime.materialize.Declaration;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;

/**
 * A materialized entity whose relationships still have to be applied.
 */
public record PendingLink(Declaration declaration, RemoteRef ref, LinkSet links) {

    public String subject() {
        return declaration.kind().displayName() + " " + declaration.subject();
    }
}
