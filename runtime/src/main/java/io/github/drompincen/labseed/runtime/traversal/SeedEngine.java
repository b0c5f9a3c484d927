package io.github.drompincen.labseed.runtime.traversal;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.protocol.document.EpicSpec;
import io.github.drompincen.labseed.protocol.document.GroupSpec;
import io.github.drompincen.labseed.protocol.document.IssueSpec;
import io.github.drompincen.labseed.protocol.document.IterationSpec;
import io.github.drompincen.labseed.protocol.document.LabelSpec;
import io.github.drompincen.labseed.protocol.document.MilestoneSpec;
import io.github.drompincen.labseed.protocol.document.ProjectSpec;
import io.github.drompincen.labseed.protocol.document.SeedDocument;
import io.github.drompincen.labseed.runtime.context.LinkMode;
import io.github.drompincen.labseed.runtime.context.RunContext;
import io.github.drompincen.labseed.runtime.context.SeedOptions;
import io.github.drompincen.labseed.runtime.error.ContainerCreateException;
import io.github.drompincen.labseed.runtime.error.TransportException;
import io.github.drompincen.labseed.runtime.link.LinkSet;
import io.github.drompincen.labseed.runtime.link.PendingLink;
import io.github.drompincen.labseed.runtime.link.RelationshipResolver;
import io.github.drompincen.labseed.runtime.materialize.Declaration;
import io.github.drompincen.labseed.runtime.materialize.EntityMaterializer;
import io.github.drompincen.labseed.runtime.materialize.Materialization;
import io.github.drompincen.labseed.runtime.materialize.MembershipMaterializer;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Walks a seed document and materializes it.
 *
 * <p>Users are resolved first. Groups are then visited depth-first from an explicit stack;
 * inside a group the order is members, labels, iterations, milestones, epics, projects,
 * subgroups, and inside a project members, labels, milestones, issues. A container always
 * exists remotely before anything nested in it is processed, and a container that cannot
 * be materialized ends the run.
 */
@Service
public class SeedEngine {

    private static final Logger log = LoggerFactory.getLogger(SeedEngine.class);

    private final PlatformClient client;
    private final EntityMaterializer materializer;
    private final MembershipMaterializer memberships;
    private final RelationshipResolver resolver;

    public SeedEngine(PlatformClient client,
                      EntityMaterializer materializer,
                      MembershipMaterializer memberships,
                      RelationshipResolver resolver) {
        this.client = client;
        this.materializer = materializer;
        this.memberships = memberships;
        this.resolver = resolver;
    }

    /**
     * Materializes {@code document}. Fatal conditions propagate as
     * {@link io.github.drompincen.labseed.runtime.error.SeedException}; whatever was created
     * before stays in place.
     *
     * @return the context of the finished run, holding its registry and report
     */
    public RunContext run(SeedDocument document, SeedOptions options) {
        RunContext ctx = new RunContext(options);
        log.info("Seeding {} top-level group(s), link mode {}, duplicates {}",
                document.groups().size(), ctx.options().linkMode(), ctx.options().duplicatePolicy());

        memberships.resolveUsers(ctx, document.users());

        Container root = resolveRoot(ctx);
        Deque<GroupFrame> stack = new ArrayDeque<>();
        pushAll(stack, document.groups(), root, 0);
        while (!stack.isEmpty()) {
            visitGroup(ctx, stack.pop(), stack);
        }

        if (ctx.options().linkMode() == LinkMode.DEFERRED) {
            log.info("Resolving {} deferred relationship set(s)", ctx.deferredLinks().size());
            for (PendingLink link : ctx.deferredLinks()) {
                resolver.resolve(ctx, link);
            }
        }

        log.info("Seeding finished: {}", ctx.report().summary());
        return ctx;
    }

    // -----------------------------------------------------------------------
    // Containers
    // -----------------------------------------------------------------------

    private Container resolveRoot(RunContext ctx) {
        String parentPath = ctx.options().parentPath();
        if (parentPath == null) {
            return null;
        }
        try {
            Container parent = client.resolveGroup(parentPath)
                    .orElseThrow(() -> new ContainerCreateException(EntityKind.GROUP, parentPath,
                            "parent group does not exist"));
            log.info("Creating top-level groups under {}", parent);
            return parent;
        } catch (TransportException e) {
            throw new ContainerCreateException(EntityKind.GROUP, parentPath, e);
        }
    }

    private Container materializeContainer(RunContext ctx, Container parent, Declaration declaration) {
        try {
            Materialization result = materializer.materialize(ctx, parent, declaration);
            return client.describe(result.ref());
        } catch (TransportException e) {
            throw new ContainerCreateException(declaration.kind(), declaration.name(), e);
        }
    }

    private static void pushAll(Deque<GroupFrame> stack, List<GroupSpec> groups, Container parent, int depth) {
        for (int i = groups.size() - 1; i >= 0; i--) {
            stack.push(new GroupFrame(groups.get(i), parent, depth));
        }
    }

    // -----------------------------------------------------------------------
    // Group and project visits
    // -----------------------------------------------------------------------

    private void visitGroup(RunContext ctx, GroupFrame frame, Deque<GroupFrame> stack) {
        GroupSpec spec = frame.group();
        log.debug("Visiting group '{}' at depth {}", spec.name(), frame.depth());
        Container group = materializeContainer(ctx, frame.parent(),
                Declaration.group(spec, ctx.options().visibility()));

        memberships.grant(ctx, group, spec.members());
        for (LabelSpec label : spec.labels()) {
            materialize(ctx, group, Declaration.label(label), LinkSet.none());
        }
        for (IterationSpec iteration : spec.iterations()) {
            materialize(ctx, group, Declaration.iteration(iteration), LinkSet.none());
        }
        for (MilestoneSpec milestone : spec.milestones()) {
            materialize(ctx, group, Declaration.milestone(milestone), LinkSet.forMilestone(milestone));
        }
        for (EpicSpec epic : spec.epics()) {
            materialize(ctx, group, Declaration.epic(epic), LinkSet.forEpic(epic));
        }
        for (ProjectSpec project : spec.projects()) {
            visitProject(ctx, group, project);
        }
        pushAll(stack, spec.subgroups(), group, frame.depth() + 1);
    }

    private void visitProject(RunContext ctx, Container group, ProjectSpec spec) {
        Container project = materializeContainer(ctx, group,
                Declaration.project(spec, ctx.options().visibility()));

        memberships.grant(ctx, project, spec.members());
        for (LabelSpec label : spec.labels()) {
            materialize(ctx, project, Declaration.label(label), LinkSet.none());
        }
        for (MilestoneSpec milestone : spec.milestones()) {
            materialize(ctx, project, Declaration.milestone(milestone), LinkSet.forMilestone(milestone));
        }
        for (IssueSpec issue : spec.issues()) {
            materialize(ctx, project, Declaration.issue(issue), LinkSet.forIssue(issue));
        }
    }

    // -----------------------------------------------------------------------
    // Leaf entities
    // -----------------------------------------------------------------------

    private void materialize(RunContext ctx, Container container, Declaration declaration, LinkSet links) {
        Materialization result = materializer.materialize(ctx, container, declaration);
        if (result.isUnsupported() || links.isEmpty()) {
            return;
        }
        PendingLink pending = new PendingLink(declaration, result.ref(), links);
        if (ctx.options().linkMode() == LinkMode.DEFERRED) {
            ctx.defer(pending);
        } else {
            resolver.resolve(ctx, pending);
        }
    }
}
