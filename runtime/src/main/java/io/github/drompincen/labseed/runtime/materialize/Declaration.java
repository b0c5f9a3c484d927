package io.github.drompincen.labseed.runtime.materialize;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.protocol.document.EpicSpec;
import io.github.drompincen.labseed.protocol.document.GroupSpec;
import io.github.drompincen.labseed.protocol.document.IssueSpec;
import io.github.drompincen.labseed.protocol.document.IterationSpec;
import io.github.drompincen.labseed.protocol.document.LabelSpec;
import io.github.drompincen.labseed.protocol.document.MilestoneSpec;
import io.github.drompincen.labseed.protocol.document.ProjectSpec;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A declared entity reduced to what creation needs: its kind, its logical id (null for
 * groups and projects), the name it is looked up by, and the creation fields.
 */
public record Declaration(
        EntityKind kind,
        String logicalId,
        String name,
        Map<String, Object> fields
) {
    public Declaration {
        fields = fields == null ? Map.of() : Map.copyOf(fields);
    }

    public String subject() {
        return logicalId == null ? "'" + name + "'" : "'" + name + "' (" + logicalId + ")";
    }

    public static Declaration group(GroupSpec group, String visibility) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", group.name());
        fields.put("path", Slugs.of(group.name()));
        fields.put("description", nullToEmpty(group.description()));
        fields.put("visibility", visibility);
        return new Declaration(EntityKind.GROUP, null, group.name(), fields);
    }

    public static Declaration project(ProjectSpec project, String visibility) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", project.name());
        fields.put("path", Slugs.of(project.name()));
        fields.put("description", nullToEmpty(project.description()));
        fields.put("visibility", visibility);
        fields.put("initialize_with_readme", true);
        return new Declaration(EntityKind.PROJECT, null, project.name(), fields);
    }

    public static Declaration label(LabelSpec label) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("name", label.name());
        if (label.color() != null) {
            fields.put("color", label.color());
        }
        fields.put("description", nullToEmpty(label.description()));
        return new Declaration(EntityKind.LABEL, label.id(), label.name(), fields);
    }

    public static Declaration milestone(MilestoneSpec milestone) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", milestone.title());
        fields.put("description", nullToEmpty(milestone.description()));
        if (milestone.startDate() != null) {
            fields.put("start_date", milestone.startDate().toString());
        }
        if (milestone.dueDate() != null) {
            fields.put("due_date", milestone.dueDate().toString());
        }
        return new Declaration(EntityKind.MILESTONE, milestone.id(), milestone.title(), fields);
    }

    public static Declaration iteration(IterationSpec iteration) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", iteration.title());
        fields.put("description", nullToEmpty(iteration.description()));
        if (iteration.startDate() != null) {
            fields.put("start_date", iteration.startDate().toString());
        }
        if (iteration.dueDate() != null) {
            fields.put("due_date", iteration.dueDate().toString());
        }
        return new Declaration(EntityKind.ITERATION, iteration.id(), iteration.title(), fields);
    }

    public static Declaration epic(EpicSpec epic) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", epic.title());
        fields.put("description", nullToEmpty(epic.description()));
        return new Declaration(EntityKind.EPIC, epic.id(), epic.title(), fields);
    }

    public static Declaration issue(IssueSpec issue) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("title", issue.title());
        fields.put("description", nullToEmpty(issue.description()));
        return new Declaration(EntityKind.ISSUE, issue.id(), issue.title(), fields);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
