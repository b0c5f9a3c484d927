package io.github.drompincen.labseed.protocol.document;

import java.util.List;

/**
 * A group and everything declared inside it. Subgroups nest recursively; children are
 * processed as members, labels, iterations, milestones, epics, projects, then subgroups.
 */
public record GroupSpec(
        String name,
        String description,
        List<MemberSpec> members,
        List<LabelSpec> labels,
        List<IterationSpec> iterations,
        List<MilestoneSpec> milestones,
        List<EpicSpec> epics,
        List<ProjectSpec> projects,
        List<GroupSpec> subgroups
) {
    public GroupSpec {
        members = members == null ? List.of() : List.copyOf(members);
        labels = labels == null ? List.of() : List.copyOf(labels);
        iterations = iterations == null ? List.of() : List.copyOf(iterations);
        milestones = milestones == null ? List.of() : List.copyOf(milestones);
        epics = epics == null ? List.of() : List.copyOf(epics);
        projects = projects == null ? List.of() : List.copyOf(projects);
        subgroups = subgroups == null ? List.of() : List.copyOf(subgroups);
    }
}
