package io.github.drompincen.labseed.runtime.capability;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.context.RunContext;
import io.github.drompincen.labseed.runtime.error.TransportException;
import io.github.drompincen.labseed.runtime.platform.Capability;
import io.github.drompincen.labseed.runtime.platform.CapabilityDescriptor;
import io.github.drompincen.labseed.runtime.platform.Container;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Decides whether a tier-gated feature can be used in a container.
 *
 * <p>The container's {@link CapabilityDescriptor} answers first. When it does not know,
 * the operation is attempted and an authorization-denied response is turned into a
 * capability gap, remembered for that container for the rest of the run. Any other
 * failure is re-raised.
 */
@Component
public class CapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(CapabilityProbe.class);

    public boolean isUsable(RunContext ctx, Container container, Capability capability) {
        if (container == null) {
            return false;
        }
        if (container.capabilities().of(capability) == CapabilityDescriptor.Support.UNSUPPORTED) {
            return false;
        }
        return !ctx.hasCapabilityGap(container.id(), capability);
    }

    /**
     * Classifies a failed call made on behalf of {@code capability}.
     *
     * @return true if the failure was a capability gap and has been recorded; false if the
     *         caller must re-raise it
     */
    public boolean recordGap(RunContext ctx, long containerId, Capability capability,
                             EntityKind kind, String subject, TransportException failure) {
        if (!failure.isAuthorizationDenied()) {
            return false;
        }
        ctx.markCapabilityGap(containerId, capability);
        ctx.report().capabilityGap(kind, subject,
                capability.displayName() + " not available (" + failure.getMessage() + ")");
        log.debug("Marked {} unavailable for container {}", capability.displayName(), containerId);
        return true;
    }

    /**
     * Runs {@code call}; an authorization-denied failure becomes a recorded gap.
     *
     * @return true if the call completed, false if it hit a capability gap
     * @throws TransportException for every other failure
     */
    public boolean attempt(RunContext ctx, long containerId, Capability capability,
                           EntityKind kind, String subject, Runnable call) {
        if (ctx.hasCapabilityGap(containerId, capability)) {
            ctx.report().capabilityGap(kind, subject, capability.displayName() + " not available");
            return false;
        }
        try {
            call.run();
            return true;
        } catch (TransportException e) {
            if (recordGap(ctx, containerId, capability, kind, subject, e)) {
                return false;
            }
            throw e;
        }
    }
}
