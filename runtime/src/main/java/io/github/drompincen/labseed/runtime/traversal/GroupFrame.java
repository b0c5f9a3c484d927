package io.github.drompincen.labseed.runtime.traversal;

import io.github.drompincen.labseed.protocol.document.GroupSpec;
import io.github.drompincen.labseed.runtime.platform.Container;

/**
 * A group waiting to be visited, with the container it is created in (null for the
 * instance root) and its nesting depth.
 */
record GroupFrame(GroupSpec group, Container parent, int depth) {}
