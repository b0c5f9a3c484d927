package io.github.drompincen.labseed.runtime.materialize;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.capability.CapabilityProbe;
import io.github.drompincen.labseed.runtime.context.DuplicatePolicy;
import io.github.drompincen.labseed.runtime.context.RunContext;
import io.github.drompincen.labseed.runtime.error.ConflictException;
import io.github.drompincen.labseed.runtime.error.TransportException;
import io.github.drompincen.labseed.runtime.platform.Capability;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Finds or creates one declared entity in its container and registers the result.
 *
 * <p>Lookup is by exact name or title. What happens on a hit is decided by the run's
 * {@link DuplicatePolicy}. Tier-gated kinds are checked with the {@link CapabilityProbe}
 * first and come back {@link Materialization.Outcome#UNSUPPORTED} instead of failing.
 */
@Service
public class EntityMaterializer {

    private static final Logger log = LoggerFactory.getLogger(EntityMaterializer.class);

    private final PlatformClient client;
    private final CapabilityProbe capabilityProbe;
    private final ProjectSettler projectSettler;

    public EntityMaterializer(PlatformClient client, CapabilityProbe capabilityProbe, ProjectSettler projectSettler) {
        this.client = client;
        this.capabilityProbe = capabilityProbe;
        this.projectSettler = projectSettler;
    }

    /**
     * @param container the enclosing group or project, null for a top-level group
     * @throws ConflictException  if the name is taken and duplicates are rejected
     * @throws TransportException for any remote failure that is not a capability gap
     */
    public Materialization materialize(RunContext ctx, Container container, Declaration declaration) {
        EntityKind kind = declaration.kind();
        Capability capability = Capability.requiredFor(kind).orElse(null);

        if (capability != null && !capabilityProbe.isUsable(ctx, container, capability)) {
            ctx.report().capabilityGap(kind, declaration.subject(),
                    where(container) + " does not support " + capability.displayName());
            return Materialization.unsupported(declaration);
        }

        try {
            Optional<RemoteRef> existing = client.find(kind, container, declaration.name());
            if (existing.isPresent()) {
                return reuse(ctx, container, declaration, existing.get());
            }
            return create(ctx, container, declaration);
        } catch (TransportException e) {
            if (capability != null && capabilityProbe.recordGap(ctx, container.id(), capability,
                    kind, declaration.subject(), e)) {
                return Materialization.unsupported(declaration);
            }
            throw e;
        }
    }

    // -----------------------------------------------------------------------
    // Reuse or reject an existing entity
    // -----------------------------------------------------------------------

    private Materialization reuse(RunContext ctx, Container container, Declaration declaration, RemoteRef existing) {
        if (ctx.options().duplicatePolicy() == DuplicatePolicy.REJECT) {
            throw new ConflictException(declaration.kind(), declaration.name(), where(container));
        }
        ctx.report().reused(declaration.kind(), declaration.subject(), where(container));
        register(ctx, declaration, existing);
        return Materialization.reused(declaration, existing);
    }

    // -----------------------------------------------------------------------
    // Create a missing entity
    // -----------------------------------------------------------------------

    private Materialization create(RunContext ctx, Container container, Declaration declaration) {
        RemoteRef created = declaration.kind() == EntityKind.ITERATION
                ? client.createIteration(container, declaration.fields())
                : client.create(declaration.kind(), container, declaration.fields());
        ctx.report().created(declaration.kind(), declaration.subject(), where(container));

        if (declaration.kind() == EntityKind.PROJECT) {
            created = projectSettler.awaitReady(created, ctx.options());
        }
        register(ctx, declaration, created);
        return Materialization.created(declaration, created);
    }

    private void register(RunContext ctx, Declaration declaration, RemoteRef ref) {
        if (declaration.logicalId() == null) {
            return;
        }
        if (ctx.registry().register(declaration.kind(), declaration.logicalId(), ref)) {
            log.debug("Registered {} '{}' -> {}", declaration.kind().displayName(), declaration.logicalId(), ref.id());
        }
    }

    static String where(Container container) {
        return container == null ? "instance root" : container.toString();
    }
}
