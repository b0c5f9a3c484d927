package io.github.drompincen.labseed.protocol.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * Group-level iteration. The declared state is informational: GitLab derives an
 * iteration's state from its dates.
 */
public record IterationSpec(
        String id,
        String title,
        String description,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("due_date") LocalDate dueDate,
        IterationState state
) {
    public enum IterationState {
        @JsonProperty("upcoming") UPCOMING,
        @JsonProperty("current") CURRENT,
        @JsonProperty("active") ACTIVE,
        @JsonProperty("closed") CLOSED
    }
}
