package io.github.drompincen.labseed.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.error.TransportException;
import io.github.drompincen.labseed.runtime.platform.CapabilityDescriptor;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GraphQlIterationChannelTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Mock
    private GitLabTransport transport;

    private GraphQlIterationChannel channel;
    private final Container group = new Container(EntityKind.GROUP, 3, "Platform", "acme/platform",
            CapabilityDescriptor.unknown());

    @BeforeEach
    void setUp() {
        channel = new GraphQlIterationChannel(transport);
    }

    @Test
    void createsIterationAndParsesGlobalId() throws Exception {
        when(transport.graphql(eq(GraphQlIterationChannel.CREATE_ITERATION), anyMap())).thenReturn(MAPPER.readTree("""
                {"iterationCreate": {"iteration": {"id": "gid://gitlab/Iteration/42", "iid": "5",
                  "title": "Sprint 1", "state": "upcoming"}, "errors": []}}
                """));

        RemoteRef iteration = channel.create(group, Map.of("title", "Sprint 1", "description", "",
                "start_date", "2025-03-03", "due_date", "2025-03-14"));

        assertThat(iteration.id()).isEqualTo(42);
        assertThat(iteration.iid()).isEqualTo(5);
        assertThat(iteration.containerId()).isEqualTo(3);
        assertThat(iteration.state()).isEqualTo("upcoming");
        verify(transport).graphql(GraphQlIterationChannel.CREATE_ITERATION, Map.of("input", Map.of(
                "groupPath", "acme/platform", "title", "Sprint 1",
                "startDate", "2025-03-03", "dueDate", "2025-03-14")));
    }

    @Test
    void mutationErrorsFail() throws Exception {
        when(transport.graphql(eq(GraphQlIterationChannel.CREATE_ITERATION), anyMap())).thenReturn(MAPPER.readTree("""
                {"iterationCreate": {"iteration": null, "errors": ["Dates cannot overlap with other existing Iterations"]}}
                """));

        assertThatThrownBy(() -> channel.create(group, Map.of("title", "Sprint 1")))
                .isInstanceOf(TransportException.class)
                .hasMessageContaining("overlap");
    }

    @Test
    void parsesGlobalIds() {
        assertThat(GraphQlIterationChannel.globalIdNumber("gid://gitlab/Iteration/7")).isEqualTo(7);
        assertThatThrownBy(() -> GraphQlIterationChannel.globalIdNumber("gid://gitlab/Iteration/x"))
                .isInstanceOf(TransportException.class);
    }
}
