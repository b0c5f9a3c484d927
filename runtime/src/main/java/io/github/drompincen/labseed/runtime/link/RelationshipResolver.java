package io.github.drompincen.labseed.runtime.link;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.capability.CapabilityProbe;
import io.github.drompincen.labseed.runtime.context.RunContext;
import io.github.drompincen.labseed.runtime.platform.Capability;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import io.github.drompincen.labseed.runtime.registry.ReferenceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies the deferred relationships of a materialized entity, in this order: labels,
 * parent epic, milestone, iteration, weight, assignees, then the closed state.
 *
 * <p>Every reference goes through the {@link ReferenceRegistry}. An unregistered id is
 * reported as a reference gap and only that link is skipped.
 */
@Service
public class RelationshipResolver {

    private static final Logger log = LoggerFactory.getLogger(RelationshipResolver.class);

    private final PlatformClient client;
    private final CapabilityProbe capabilityProbe;
    private final IterationLinker iterationLinker;

    public RelationshipResolver(PlatformClient client, CapabilityProbe capabilityProbe, IterationLinker iterationLinker) {
        this.client = client;
        this.capabilityProbe = capabilityProbe;
        this.iterationLinker = iterationLinker;
    }

    public RemoteRef resolve(RunContext ctx, PendingLink link) {
        if (link.links().isEmpty()) {
            return link.ref();
        }
        log.debug("Resolving relationships of {}", link.subject());
        RemoteRef current = link.ref();
        current = attachLabels(ctx, link, current);
        current = linkParentEpic(ctx, link, current);
        current = linkMilestone(ctx, link, current);
        current = linkIteration(ctx, link, current);
        current = applyWeight(ctx, link, current);
        current = assign(ctx, link, current);
        current = applyState(ctx, link, current);
        return current;
    }

    // -----------------------------------------------------------------------
    // Labels: set union with what the entity already carries
    // -----------------------------------------------------------------------

    private RemoteRef attachLabels(RunContext ctx, PendingLink link, RemoteRef current) {
        if (link.links().labelIds().isEmpty()) {
            return current;
        }
        Set<String> labels = new LinkedHashSet<>(current.labels());
        List<String> added = new ArrayList<>();
        for (String labelId : link.links().labelIds()) {
            Optional<String> name = ctx.registry().labelName(labelId);
            if (name.isEmpty()) {
                ctx.report().referenceGap(EntityKind.LABEL, labelId, link.subject());
                continue;
            }
            if (labels.add(name.get())) {
                added.add(name.get());
            }
        }
        if (added.isEmpty()) {
            log.debug("{} already carries its labels", link.subject());
            return current;
        }
        return update(ctx, link, current, Map.of("labels", String.join(",", labels)), "labels " + added);
    }

    // -----------------------------------------------------------------------
    // Parent epic
    // -----------------------------------------------------------------------

    private RemoteRef linkParentEpic(RunContext ctx, PendingLink link, RemoteRef current) {
        String parentId = link.links().parentEpicId();
        if (parentId == null) {
            return current;
        }
        Optional<RemoteRef> parent = ctx.registry().lookup(EntityKind.EPIC, parentId);
        if (parent.isEmpty()) {
            ctx.report().referenceGap(EntityKind.EPIC, parentId, link.subject());
            return current;
        }
        String field = current.kind() == EntityKind.EPIC ? "parent_id" : "epic_id";
        return guardedUpdate(ctx, link, current, Capability.EPICS, parent.get().containerId(),
                Map.of(field, parent.get().id()), "parent epic '" + parent.get().name() + "'");
    }

    // -----------------------------------------------------------------------
    // Milestone and iteration
    // -----------------------------------------------------------------------

    private RemoteRef linkMilestone(RunContext ctx, PendingLink link, RemoteRef current) {
        String milestoneId = link.links().milestoneId();
        if (milestoneId == null) {
            return current;
        }
        Optional<RemoteRef> milestone = ctx.registry().lookup(EntityKind.MILESTONE, milestoneId);
        if (milestone.isEmpty()) {
            ctx.report().referenceGap(EntityKind.MILESTONE, milestoneId, link.subject());
            return current;
        }
        return update(ctx, link, current, Map.of("milestone_id", milestone.get().id()),
                "milestone '" + milestone.get().name() + "'");
    }

    private RemoteRef linkIteration(RunContext ctx, PendingLink link, RemoteRef current) {
        String iterationId = link.links().iterationId();
        if (iterationId == null) {
            return current;
        }
        Optional<RemoteRef> iteration = ctx.registry().lookup(EntityKind.ITERATION, iterationId);
        if (iteration.isEmpty()) {
            ctx.report().referenceGap(EntityKind.ITERATION, iterationId, link.subject());
            return current;
        }
        AtomicReference<RemoteRef> result = new AtomicReference<>(current);
        boolean done = capabilityProbe.attempt(ctx, iteration.get().containerId(), Capability.ITERATIONS,
                link.declaration().kind(), link.declaration().subject(),
                () -> result.set(iterationLinker.link(current, iteration.get())));
        if (done) {
            ctx.report().linked(link.declaration().kind(), link.declaration().subject(),
                    "iteration '" + iteration.get().name() + "'");
        }
        return result.get();
    }

    // -----------------------------------------------------------------------
    // Weight, assignees, state
    // -----------------------------------------------------------------------

    private RemoteRef applyWeight(RunContext ctx, PendingLink link, RemoteRef current) {
        Integer weight = link.links().weight();
        if (weight == null) {
            return current;
        }
        return update(ctx, link, current, Map.of("weight", weight), "weight " + weight, false);
    }

    private RemoteRef assign(RunContext ctx, PendingLink link, RemoteRef current) {
        if (link.links().assigneeIds().isEmpty()) {
            return current;
        }
        List<Long> accountIds = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (String userId : link.links().assigneeIds()) {
            Optional<RemoteRef> user = ctx.registry().lookup(EntityKind.USER, userId);
            if (user.isEmpty()) {
                ctx.report().referenceGap(EntityKind.USER, userId, link.subject());
                continue;
            }
            accountIds.add(user.get().id());
            names.add(user.get().name());
        }
        if (accountIds.isEmpty()) {
            return current;
        }
        return update(ctx, link, current, Map.of("assignee_ids", accountIds), "assignees " + names);
    }

    private RemoteRef applyState(RunContext ctx, PendingLink link, RemoteRef current) {
        if (!link.links().close() || current.isClosed()) {
            return current;
        }
        return update(ctx, link, current, Map.of("state_event", "close"), "closed", false);
    }

    // -----------------------------------------------------------------------
    // Remote updates
    // -----------------------------------------------------------------------

    private RemoteRef update(RunContext ctx, PendingLink link, RemoteRef current,
                             Map<String, Object> fields, String detail) {
        return update(ctx, link, current, fields, detail, true);
    }

    private RemoteRef update(RunContext ctx, PendingLink link, RemoteRef current,
                             Map<String, Object> fields, String detail, boolean relationship) {
        if (current.kind() == EntityKind.EPIC) {
            return guardedUpdate(ctx, link, current, Capability.EPICS, current.containerId(), fields, detail, relationship);
        }
        RemoteRef updated = client.update(current, fields);
        report(ctx, link, detail, relationship);
        return updated;
    }

    private RemoteRef guardedUpdate(RunContext ctx, PendingLink link, RemoteRef current, Capability capability,
                                    long containerId, Map<String, Object> fields, String detail) {
        return guardedUpdate(ctx, link, current, capability, containerId, fields, detail, true);
    }

    private RemoteRef guardedUpdate(RunContext ctx, PendingLink link, RemoteRef current, Capability capability,
                                    long containerId, Map<String, Object> fields, String detail,
                                    boolean relationship) {
        AtomicReference<RemoteRef> result = new AtomicReference<>(current);
        boolean done = capabilityProbe.attempt(ctx, containerId, capability,
                link.declaration().kind(), link.declaration().subject(),
                () -> result.set(client.update(current, fields)));
        if (done) {
            report(ctx, link, detail, relationship);
        }
        return result.get();
    }

    private void report(RunContext ctx, PendingLink link, String detail, boolean relationship) {
        if (relationship) {
            ctx.report().linked(link.declaration().kind(), link.declaration().subject(), detail);
        } else {
            ctx.report().updated(link.declaration().kind(), link.declaration().subject(), detail);
        }
    }
}
