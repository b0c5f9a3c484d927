package io.github.drompincen.labseed.runtime.materialize;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.protocol.document.EpicSpec;
import io.github.drompincen.labseed.protocol.document.GroupSpec;
import io.github.drompincen.labseed.protocol.document.IterationSpec;
import io.github.drompincen.labseed.protocol.document.LabelSpec;
import io.github.drompincen.labseed.protocol.document.ProjectSpec;
import io.github.drompincen.labseed.runtime.capability.CapabilityProbe;
import io.github.drompincen.labseed.runtime.context.DuplicatePolicy;
import io.github.drompincen.labseed.runtime.context.RunContext;
import io.github.drompincen.labseed.runtime.context.SeedOptions;
import io.github.drompincen.labseed.runtime.error.ConflictException;
import io.github.drompincen.labseed.runtime.error.TransportException;
import io.github.drompincen.labseed.runtime.platform.CapabilityDescriptor;
import io.github.drompincen.labseed.runtime.platform.CapabilityDescriptor.Support;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import io.github.drompincen.labseed.runtime.report.RunReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EntityMaterializerTest {

    @Mock
    private PlatformClient client;
    @Mock
    private ProjectSettler projectSettler;

    private EntityMaterializer materializer;
    private RunContext ctx;

    private final Container group = new Container(EntityKind.GROUP, 1, "Platform", "platform",
            CapabilityDescriptor.unknown());

    @BeforeEach
    void setUp() {
        materializer = new EntityMaterializer(client, new CapabilityProbe(), projectSettler);
        ctx = new RunContext(SeedOptions.defaults());
    }

    @Test
    void createsWhenAbsentAndRegisters() {
        RemoteRef created = RemoteRef.of(EntityKind.LABEL, 11, "bug");
        when(client.find(EntityKind.LABEL, group, "bug")).thenReturn(Optional.empty());
        when(client.create(eq(EntityKind.LABEL), eq(group), anyMap())).thenReturn(created);

        Materialization result = materializer.materialize(ctx, group,
                Declaration.label(new LabelSpec("l1", "bug", "#ff0000", null)));

        assertThat(result.outcome()).isEqualTo(Materialization.Outcome.CREATED);
        assertThat(ctx.registry().labelName("l1")).contains("bug");
        verify(client).create(EntityKind.LABEL, group, Map.of("name", "bug", "color", "#ff0000", "description", ""));
    }

    @Test
    void reusesExistingByDefault() {
        RemoteRef existing = RemoteRef.of(EntityKind.LABEL, 11, "bug");
        when(client.find(EntityKind.LABEL, group, "bug")).thenReturn(Optional.of(existing));

        Materialization result = materializer.materialize(ctx, group,
                Declaration.label(new LabelSpec("l1", "bug", "#ff0000", null)));

        assertThat(result.outcome()).isEqualTo(Materialization.Outcome.REUSED);
        assertThat(result.ref()).isSameAs(existing);
        assertThat(ctx.registry().remoteId(EntityKind.LABEL, "l1")).contains(11L);
        verify(client, never()).create(any(), any(), anyMap());
        assertThat(ctx.report().count(RunReport.Action.REUSED, EntityKind.LABEL)).isEqualTo(1);
    }

    @Test
    void rejectPolicyRaisesConflictAndRegistersNothing() {
        ctx = new RunContext(SeedOptions.defaults().withDuplicatePolicy(DuplicatePolicy.REJECT));
        when(client.find(EntityKind.LABEL, group, "bug")).thenReturn(Optional.of(RemoteRef.of(EntityKind.LABEL, 11, "bug")));

        assertThatThrownBy(() -> materializer.materialize(ctx, group,
                Declaration.label(new LabelSpec("l1", "bug", "#ff0000", null))))
                .isInstanceOf(ConflictException.class)
                .hasMessageContaining("bug");
        assertThat(ctx.registry().contains(EntityKind.LABEL, "l1")).isFalse();
    }

    @Test
    void unsupportedCapabilityMakesNoRemoteCall() {
        Container free = new Container(EntityKind.GROUP, 2, "Free", "free",
                CapabilityDescriptor.of(Support.UNSUPPORTED, Support.UNSUPPORTED));

        Materialization result = materializer.materialize(ctx, free,
                Declaration.epic(new EpicSpec("e1", "Core", null, null, null, null)));

        assertThat(result.isUnsupported()).isTrue();
        assertThat(result.ref()).isNull();
        verifyNoInteractions(client);
        assertThat(ctx.report().count(RunReport.Action.CAPABILITY_GAP, EntityKind.EPIC)).isEqualTo(1);
    }

    @Test
    void forbiddenOnUnknownCapabilityBecomesGap() {
        when(client.find(EntityKind.EPIC, group, "Core")).thenThrow(new TransportException(403, "403 Forbidden"));

        Materialization first = materializer.materialize(ctx, group,
                Declaration.epic(new EpicSpec("e1", "Core", null, null, null, null)));
        Materialization second = materializer.materialize(ctx, group,
                Declaration.epic(new EpicSpec("e2", "Edge", null, null, null, null)));

        assertThat(first.isUnsupported()).isTrue();
        assertThat(second.isUnsupported()).isTrue();
        verify(client, times(1)).find(any(), any(), any());
    }

    @Test
    void otherTransportFailuresPropagate() {
        when(client.find(EntityKind.EPIC, group, "Core")).thenThrow(new TransportException(500, "boom"));

        assertThatThrownBy(() -> materializer.materialize(ctx, group,
                Declaration.epic(new EpicSpec("e1", "Core", null, null, null, null))))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void iterationsUseTheSecondaryChannel() {
        RemoteRef iteration = RemoteRef.of(EntityKind.ITERATION, 30, "Sprint 1");
        when(client.find(EntityKind.ITERATION, group, "Sprint 1")).thenReturn(Optional.empty());
        when(client.createIteration(eq(group), anyMap())).thenReturn(iteration);

        materializer.materialize(ctx, group, Declaration.iteration(new IterationSpec("s1", "Sprint 1", null,
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 14), null)));

        verify(client).createIteration(group, Map.of("title", "Sprint 1", "description", "",
                "start_date", "2024-01-01", "due_date", "2024-01-14"));
        verify(client, never()).create(any(), any(), anyMap());
        assertThat(ctx.registry().remoteId(EntityKind.ITERATION, "s1")).contains(30L);
    }

    @Test
    void newProjectsAreSettled() {
        RemoteRef created = RemoteRef.of(EntityKind.PROJECT, 40, "svc");
        RemoteRef settled = RemoteRef.of(EntityKind.PROJECT, 40, "svc");
        when(client.find(EntityKind.PROJECT, group, "svc")).thenReturn(Optional.empty());
        when(client.create(eq(EntityKind.PROJECT), eq(group), anyMap())).thenReturn(created);
        when(projectSettler.awaitReady(created, ctx.options())).thenReturn(settled);

        Materialization result = materializer.materialize(ctx, group,
                Declaration.project(new ProjectSpec("svc", null, null, null, null, null), "private"));

        assertThat(result.ref()).isSameAs(settled);
    }

    @Test
    void reusedProjectsAreNotSettled() {
        when(client.find(EntityKind.PROJECT, group, "svc"))
                .thenReturn(Optional.of(RemoteRef.of(EntityKind.PROJECT, 40, "svc")));

        materializer.materialize(ctx, group,
                Declaration.project(new ProjectSpec("svc", null, null, null, null, null), "private"));

        verifyNoInteractions(projectSettler);
    }

    @Test
    void topLevelGroupsAreCreatedAtTheRoot() {
        when(client.find(EntityKind.GROUP, null, "Platform Team")).thenReturn(Optional.empty());
        when(client.create(eq(EntityKind.GROUP), isNull(), anyMap()))
                .thenReturn(RemoteRef.of(EntityKind.GROUP, 1, "Platform Team"));

        materializer.materialize(ctx, null, Declaration.group(
                new GroupSpec("Platform Team", null, null, null, null, null, null, null, null), "private"));

        verify(client).create(EntityKind.GROUP, null, Map.of("name", "Platform Team", "path", "platform-team",
                "description", "", "visibility", "private"));
        assertThat(ctx.report().entries(RunReport.Action.CREATED))
                .singleElement()
                .satisfies(e -> assertThat(e.detail()).isEqualTo("instance root"));
    }
}
