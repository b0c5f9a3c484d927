package io.github.drompincen.labseed.runtime.link;

import io.github.drompincen.labseed.protocol.document.EntityState;
import io.github.drompincen.labseed.protocol.document.EpicSpec;
import io.github.drompincen.labseed.protocol.document.IssueSpec;
import io.github.drompincen.labseed.protocol.document.MilestoneSpec;

import java.util.List;

/**
 * Relationships and post-creation updates declared for one entity, by logical id.
 */
public record LinkSet(
        List<String> labelIds,
        String parentEpicId,
        String milestoneId,
        String iterationId,
        Integer weight,
        List<String> assigneeIds,
        boolean close
) {
    public LinkSet {
        labelIds = labelIds == null ? List.of() : List.copyOf(labelIds);
        assigneeIds = assigneeIds == null ? List.of() : List.copyOf(assigneeIds);
    }

    public static LinkSet none() {
        return new LinkSet(List.of(), null, null, null, null, List.of(), false);
    }

    public static LinkSet forEpic(EpicSpec epic) {
        return new LinkSet(epic.labelIds(), epic.parentEpicId(), null, null, null, List.of(),
                epic.state() == EntityState.CLOSED);
    }

    public static LinkSet forIssue(IssueSpec issue) {
        return new LinkSet(issue.labelIds(), issue.parentEpicId(), issue.milestoneId(), issue.iterationId(),
                issue.weight(), issue.assigneeIds(), issue.state() == EntityState.CLOSED);
    }

    public static LinkSet forMilestone(MilestoneSpec milestone) {
        return new LinkSet(List.of(), null, null, null, null, List.of(),
                milestone.state() == MilestoneSpec.MilestoneState.CLOSED);
    }

    public boolean isEmpty() {
        return labelIds.isEmpty() && parentEpicId == null && milestoneId == null && iterationId == null
                && weight == null && assigneeIds.isEmpty() && !close;
    }
}
