package io.github.drompincen.labseed.runtime.context;

/**
 * When relationships (labels, parent epic, milestone, iteration, assignees, state) are applied.
 */
public enum LinkMode {
    /** Right after each entity is materialized. A reference to a later declaration is a gap. */
    INLINE,
    /** In a second pass, after every entity in the document has been materialized. */
    DEFERRED;

    public static LinkMode parse(String value) {
        return valueOf(value.trim().toUpperCase());
    }
}
