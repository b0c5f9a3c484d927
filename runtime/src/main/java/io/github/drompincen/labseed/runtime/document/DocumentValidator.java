package io.github.drompincen.labseed.runtime.document;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.protocol.document.EpicSpec;
import io.github.drompincen.labseed.protocol.document.GroupSpec;
import io.github.drompincen.labseed.protocol.document.IssueSpec;
import io.github.drompincen.labseed.protocol.document.IterationSpec;
import io.github.drompincen.labseed.protocol.document.LabelSpec;
import io.github.drompincen.labseed.protocol.document.MemberSpec;
import io.github.drompincen.labseed.protocol.document.MilestoneSpec;
import io.github.drompincen.labseed.protocol.document.ProjectSpec;
import io.github.drompincen.labseed.protocol.document.SeedDocument;
import io.github.drompincen.labseed.protocol.document.UserSpec;
import io.github.drompincen.labseed.runtime.materialize.Slugs;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Structural checks on a parsed document. Cross-references are not checked here: an
 * unknown reference is a reference gap at link time, not a document error.
 */
class DocumentValidator {

    private static final Pattern COLOR = Pattern.compile("^#[0-9A-Fa-f]{6}$");

    List<String> validate(SeedDocument document) {
        List<String> problems = new ArrayList<>();
        Map<EntityKind, Set<String>> seen = new EnumMap<>(EntityKind.class);

        if (document.groups().isEmpty()) {
            problems.add("document declares no groups");
        }
        for (UserSpec user : document.users()) {
            checkId(problems, seen, EntityKind.USER, user.id(), "user");
            if (isBlank(user.username())) {
                problems.add("user '" + user.id() + "' has no username");
            }
        }
        for (GroupSpec group : document.groups()) {
            validateGroup(problems, seen, group, "");
        }
        return problems;
    }

    private void validateGroup(List<String> problems, Map<EntityKind, Set<String>> seen, GroupSpec group, String path) {
        if (isBlank(group.name())) {
            problems.add("group under '" + path + "' has no name");
            return;
        }
        String where = path.isEmpty() ? group.name() : path + "/" + group.name();
        checkPath(problems, "group", where, group.name());
        checkMembers(problems, group.members(), where);
        for (LabelSpec label : group.labels()) {
            checkLabel(problems, seen, label, where);
        }
        for (IterationSpec iteration : group.iterations()) {
            checkId(problems, seen, EntityKind.ITERATION, iteration.id(), "iteration in " + where);
            checkTitle(problems, iteration.title(), "iteration", iteration.id());
        }
        for (MilestoneSpec milestone : group.milestones()) {
            checkMilestone(problems, seen, milestone, where);
        }
        for (EpicSpec epic : group.epics()) {
            checkId(problems, seen, EntityKind.EPIC, epic.id(), "epic in " + where);
            checkTitle(problems, epic.title(), "epic", epic.id());
            if (epic.id() != null && epic.id().equals(epic.parentEpicId())) {
                problems.add("epic '" + epic.id() + "' is its own parent");
            }
        }
        for (ProjectSpec project : group.projects()) {
            validateProject(problems, seen, project, where);
        }
        for (GroupSpec subgroup : group.subgroups()) {
            validateGroup(problems, seen, subgroup, where);
        }
    }

    private static void checkPath(List<String> problems, String kind, String where, String name) {
        if (!Slugs.isDerivable(name)) {
            problems.add(kind + " '" + where + "' has no letters or digits to build a URL path from");
        }
    }

    private void validateProject(List<String> problems, Map<EntityKind, Set<String>> seen,
                                 ProjectSpec project, String groupPath) {
        if (isBlank(project.name())) {
            problems.add("project in '" + groupPath + "' has no name");
            return;
        }
        String where = groupPath + "/" + project.name();
        checkPath(problems, "project", where, project.name());
        checkMembers(problems, project.members(), where);
        for (LabelSpec label : project.labels()) {
            checkLabel(problems, seen, label, where);
        }
        for (MilestoneSpec milestone : project.milestones()) {
            checkMilestone(problems, seen, milestone, where);
        }
        for (IssueSpec issue : project.issues()) {
            checkId(problems, seen, EntityKind.ISSUE, issue.id(), "issue in " + where);
            checkTitle(problems, issue.title(), "issue", issue.id());
            if (issue.weight() != null && issue.weight() < 0) {
                problems.add("issue '" + issue.id() + "' has negative weight " + issue.weight());
            }
        }
    }

    private void checkLabel(List<String> problems, Map<EntityKind, Set<String>> seen, LabelSpec label, String where) {
        checkId(problems, seen, EntityKind.LABEL, label.id(), "label in " + where);
        if (isBlank(label.name())) {
            problems.add("label '" + label.id() + "' has no name");
        }
        if (label.color() == null || !COLOR.matcher(label.color()).matches()) {
            problems.add("label '" + label.id() + "' color '" + label.color() + "' is not #RRGGBB");
        }
    }

    private void checkMilestone(List<String> problems, Map<EntityKind, Set<String>> seen,
                                MilestoneSpec milestone, String where) {
        checkId(problems, seen, EntityKind.MILESTONE, milestone.id(), "milestone in " + where);
        checkTitle(problems, milestone.title(), "milestone", milestone.id());
        if (milestone.startDate() != null && milestone.dueDate() != null
                && milestone.dueDate().isBefore(milestone.startDate())) {
            problems.add("milestone '" + milestone.id() + "' is due before it starts");
        }
    }

    private void checkMembers(List<String> problems, List<MemberSpec> members, String where) {
        for (MemberSpec member : members) {
            if (isBlank(member.userId())) {
                problems.add("member of '" + where + "' has no user_id");
            }
        }
    }

    private void checkId(List<String> problems, Map<EntityKind, Set<String>> seen,
                         EntityKind kind, String id, String where) {
        if (isBlank(id)) {
            problems.add(where + " has no id");
            return;
        }
        if (!seen.computeIfAbsent(kind, k -> new HashSet<>()).add(id)) {
            problems.add("duplicate " + kind.displayName() + " id '" + id + "' (" + where + ")");
        }
    }

    private void checkTitle(List<String> problems, String title, String kind, String id) {
        if (isBlank(title)) {
            problems.add(kind + " '" + id + "' has no title");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
