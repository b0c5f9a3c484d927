package io.github.drompincen.labseed.runtime.platform;

import java.util.EnumMap;
import java.util.Map;

/**
 * What a container is known to support, fixed when the container is resolved.
 * {@link Support#UNKNOWN} means the answer is only learned by issuing the operation.
 */
public record CapabilityDescriptor(Map<Capability, Support> support) {

    public enum Support {
        SUPPORTED,
        UNSUPPORTED,
        UNKNOWN
    }

    public CapabilityDescriptor {
        support = support == null ? Map.of() : Map.copyOf(support);
    }

    public static CapabilityDescriptor of(Support epics, Support iterations) {
        Map<Capability, Support> map = new EnumMap<>(Capability.class);
        map.put(Capability.EPICS, epics);
        map.put(Capability.ITERATIONS, iterations);
        return new CapabilityDescriptor(map);
    }

    public static CapabilityDescriptor none() {
        return of(Support.UNSUPPORTED, Support.UNSUPPORTED);
    }

    public static CapabilityDescriptor unknown() {
        return of(Support.UNKNOWN, Support.UNKNOWN);
    }

    public Support of(Capability capability) {
        return support.getOrDefault(capability, Support.UNKNOWN);
    }
}
