package io.github.drompincen.labseed.protocol.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record MilestoneSpec(
        String id,
        String title,
        String description,
        @JsonProperty("start_date") LocalDate startDate,
        @JsonProperty("due_date") LocalDate dueDate,
        MilestoneState state
) {
    public MilestoneSpec {
        state = state == null ? MilestoneState.ACTIVE : state;
    }

    public enum MilestoneState {
        @JsonProperty("active") ACTIVE,
        @JsonProperty("closed") CLOSED
    }
}
