package io.github.drompincen.labseed.runtime.link;

import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.platform.PlatformClient;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class QuickActionIterationLinkerTest {

    @Mock
    private PlatformClient client;

    private QuickActionIterationLinker linker;
    private final RemoteRef sprint = RemoteRef.of(EntityKind.ITERATION, 77, "Sprint 1");

    @BeforeEach
    void setUp() {
        linker = new QuickActionIterationLinker(client);
    }

    private static RemoteRef issue(String description) {
        return new RemoteRef(EntityKind.ISSUE, 5, 1, "Fix X", EntityKind.PROJECT, 3, "opened", description, List.of());
    }

    @Test
    void appendsDirectiveAfterExistingDescription() {
        RemoteRef issue = issue("Crash on start.\n");
        when(client.update(issue, Map.of("description", "Crash on start.\n\n/iteration *iteration:77"))).thenReturn(issue);

        linker.link(issue, sprint);

        verify(client).update(issue, Map.of("description", "Crash on start.\n\n/iteration *iteration:77"));
    }

    @Test
    void directiveAloneForEmptyDescription() {
        RemoteRef issue = issue(null);
        when(client.update(issue, Map.of("description", "/iteration *iteration:77"))).thenReturn(issue);

        linker.link(issue, sprint);

        verify(client).update(issue, Map.of("description", "/iteration *iteration:77"));
    }

    @Test
    void doesNotAppendTwice() {
        RemoteRef issue = issue("Crash.\n\n/iteration *iteration:77");

        RemoteRef result = linker.link(issue, sprint);

        assertThat(result).isSameAs(issue);
        verifyNoInteractions(client);
    }
}
