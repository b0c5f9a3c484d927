package io.github.drompincen.labseed.runtime.context;

import io.github.drompincen.labseed.runtime.link.PendingLink;
import io.github.drompincen.labseed.runtime.platform.Capability;
import io.github.drompincen.labseed.runtime.registry.ReferenceRegistry;
import io.github.drompincen.labseed.runtime.report.RunReport;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * State scoped to a single run, handed to every component that needs it.
 */
public class RunContext {

    private final SeedOptions options;
    private final ReferenceRegistry registry = new ReferenceRegistry();
    private final RunReport report = new RunReport();
    private final Set<String> capabilityGaps = new HashSet<>();
    private final List<PendingLink> deferredLinks = new ArrayList<>();

    public RunContext(SeedOptions options) {
        this.options = options == null ? SeedOptions.defaults() : options;
    }

    public SeedOptions options() {
        return options;
    }

    public ReferenceRegistry registry() {
        return registry;
    }

    public RunReport report() {
        return report;
    }

    public void markCapabilityGap(long containerId, Capability capability) {
        capabilityGaps.add(gapKey(containerId, capability));
    }

    public boolean hasCapabilityGap(long containerId, Capability capability) {
        return capabilityGaps.contains(gapKey(containerId, capability));
    }

    public void defer(PendingLink link) {
        deferredLinks.add(link);
    }

    public List<PendingLink> deferredLinks() {
        return Collections.unmodifiableList(deferredLinks);
    }

    private static String gapKey(long containerId, Capability capability) {
        return containerId + ":" + capability;
    }
}
