package io.github.drompincen.labseed.protocol.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record IssueSpec(
        String id,
        String title,
        String description,
        EntityState state,
        @JsonProperty("label_ids") List<String> labelIds,
        @JsonProperty("parent_epic_id") String parentEpicId,
        @JsonProperty("milestone_id") String milestoneId,
        @JsonProperty("iteration_id") String iterationId,
        Integer weight,
        @JsonProperty("assignee_ids") List<String> assigneeIds
) {
    public IssueSpec {
        state = state == null ? EntityState.OPENED : state;
        labelIds = labelIds == null ? List.of() : List.copyOf(labelIds);
        assigneeIds = assigneeIds == null ? List.of() : List.copyOf(assigneeIds);
    }
}
