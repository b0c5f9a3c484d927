package io.github.drompincen.labseed.client;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.labseed.protocol.document.EntityKind;
import io.github.drompincen.labseed.runtime.error.TransportException;
import io.github.drompincen.labseed.runtime.platform.Container;
import io.github.drompincen.labseed.runtime.platform.RemoteRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates group iterations through the GraphQL {@code iterationCreate} mutation. The REST
 * API can list iterations but not create them.
 */
@Component
public class GraphQlIterationChannel {

    private static final Logger log = LoggerFactory.getLogger(GraphQlIterationChannel.class);

    static final String CREATE_ITERATION = """
            mutation($input: iterationCreateInput!) {
              iterationCreate(input: $input) {
                iteration { id iid title description state startDate dueDate }
                errors
              }
            }
            """;

    private final GitLabTransport transport;

    public GraphQlIterationChannel(GitLabTransport transport) {
        this.transport = transport;
    }

    public RemoteRef create(Container group, Map<String, Object> fields) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("groupPath", group.fullPath());
        input.put("title", fields.get("title"));
        putIfPresent(input, "description", fields.get("description"));
        putIfPresent(input, "startDate", fields.get("start_date"));
        putIfPresent(input, "dueDate", fields.get("due_date"));

        JsonNode result = transport.graphql(CREATE_ITERATION, Map.of("input", input)).path("iterationCreate");
        JsonNode errors = result.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            throw new TransportException(422, "iterationCreate: " + errors.get(0).asText());
        }
        JsonNode iteration = result.path("iteration");
        if (iteration.isMissingNode() || iteration.isNull()) {
            throw new TransportException(422, "iterationCreate returned no iteration for " + group);
        }
        long id = globalIdNumber(iteration.path("id").asText());
        log.debug("Created iteration {} ({}) in {}", iteration.path("title").asText(), id, group);
        return new RemoteRef(EntityKind.ITERATION, id, iteration.path("iid").asLong(),
                iteration.path("title").asText(), EntityKind.GROUP, group.id(),
                iteration.path("state").asText(null), iteration.path("description").asText(null), List.of());
    }

    /** {@code gid://gitlab/Iteration/42} to {@code 42}. */
    static long globalIdNumber(String globalId) {
        int slash = globalId.lastIndexOf('/');
        try {
            return Long.parseLong(globalId.substring(slash + 1));
        } catch (NumberFormatException e) {
            throw new TransportException(422, "Unexpected global id '" + globalId + "'", e);
        }
    }

    private static void putIfPresent(Map<String, Object> input, String key, Object value) {
        if (value != null && !"".equals(value)) {
            input.put(key, value);
        }
    }
}
