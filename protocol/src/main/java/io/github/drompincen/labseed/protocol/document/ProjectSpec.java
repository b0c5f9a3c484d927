package io.github.drompincen.labseed.protocol.document;

import java.util.List;

/**
 * A project nested in a group. Children are processed as members, labels,
 * milestones, then issues.
 */
public record ProjectSpec(
        String name,
        String description,
        List<MemberSpec> members,
        List<LabelSpec> labels,
        List<MilestoneSpec> milestones,
        List<IssueSpec> issues
) {
    public ProjectSpec {
        members = members == null ? List.of() : List.copyOf(members);
        labels = labels == null ? List.of() : List.copyOf(labels);
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
