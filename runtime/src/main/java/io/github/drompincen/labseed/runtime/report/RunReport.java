package io.github.drompincen.labseed.runtime.report;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Trace of every create, reuse, skip and link decision taken during one run.
 * Each decision is logged as it is recorded.
 */
public class RunReport {

    private static final Logger log = LoggerFactory.getLogger(RunReport.class);

    public enum Action {
        CREATED,
        REUSED,
        UPDATED,
        LINKED,
        SKIPPED,
        CAPABILITY_GAP,
        REFERENCE_GAP
    }

    public record Entry(Action action, EntityKind kind, String subject, String detail) {

        public boolean isGap() {
            return action == Action.CAPABILITY_GAP || action == Action.REFERENCE_GAP;
        }
    }

    private final List<Entry> entries = new ArrayList<>();

    public void created(EntityKind kind, String subject, String detail) {
        log.info("Created {} {} in {}", kind.displayName(), subject, detail);
        add(Action.CREATED, kind, subject, detail);
    }

    public void reused(EntityKind kind, String subject, String detail) {
        log.info("{} {} already exists in {}", capitalize(kind), subject, detail);
        add(Action.REUSED, kind, subject, detail);
    }

    public void updated(EntityKind kind, String subject, String detail) {
        log.info("Updated {} {}: {}", kind.displayName(), subject, detail);
        add(Action.UPDATED, kind, subject, detail);
    }

    public void linked(EntityKind kind, String subject, String detail) {
        log.info("Linked {} {}: {}", kind.displayName(), subject, detail);
        add(Action.LINKED, kind, subject, detail);
    }

    public void skipped(EntityKind kind, String subject, String reason) {
        log.warn("Skipped {} {}: {}", kind.displayName(), subject, reason);
        add(Action.SKIPPED, kind, subject, reason);
    }

    public void capabilityGap(EntityKind kind, String subject, String reason) {
        log.warn("Skipped {} {}: {}", kind.displayName(), subject, reason);
        add(Action.CAPABILITY_GAP, kind, subject, reason);
    }

    /**
     * A reference from {@code referencedBy} to a logical id of {@code kind} that is not
     * registered. The link is dropped; sibling links are still applied.
     */
    public void referenceGap(EntityKind kind, String logicalId, String referencedBy) {
        String detail = kind.displayName() + " '" + logicalId + "' referenced by " + referencedBy + " is not registered";
        log.warn("Reference gap: {}", detail);
        add(Action.REFERENCE_GAP, kind, logicalId, detail);
    }

    public List<Entry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Entry> entries(Action action) {
        return entries.stream().filter(e -> e.action() == action).toList();
    }

    public long count(Action action, EntityKind kind) {
        return entries.stream().filter(e -> e.action() == action && e.kind() == kind).count();
    }

    public Map<Action, Integer> totals() {
        Map<Action, Integer> totals = new EnumMap<>(Action.class);
        for (Entry entry : entries) {
            totals.merge(entry.action(), 1, Integer::sum);
        }
        return totals;
    }

    public String summary() {
        Map<Action, Integer> totals = totals();
        StringBuilder sb = new StringBuilder();
        for (Action action : Action.values()) {
            int n = totals.getOrDefault(action, 0);
            if (n == 0) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append(", ");
            }
            sb.append(action.name().toLowerCase().replace('_', ' ')).append('=').append(n);
        }
        return sb.isEmpty() ? "nothing to do" : sb.toString();
    }

    private void add(Action action, EntityKind kind, String subject, String detail) {
        entries.add(new Entry(action, kind, subject, detail));
    }

    private static String capitalize(EntityKind kind) {
        String name = kind.displayName();
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }
}
