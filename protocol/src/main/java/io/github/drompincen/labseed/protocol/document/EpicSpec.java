package io.github.drompincen.labseed.protocol.document;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record EpicSpec(
        String id,
        String title,
        String description,
        EntityState state,
        @JsonProperty("label_ids") List<String> labelIds,
        @JsonProperty("parent_epic_id") String parentEpicId
) {
    public EpicSpec {
        state = state == null ? EntityState.OPENED : state;
        labelIds = labelIds == null ? List.of() : List.copyOf(labelIds);
    }
}
