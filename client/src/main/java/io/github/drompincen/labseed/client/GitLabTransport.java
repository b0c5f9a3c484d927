package io.github.drompincen.labseed.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import io.github.drompincen.labseed.runtime.error.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Synchronous JSON calls against the GitLab REST and GraphQL endpoints. Every non-2xx
 * response becomes a {@link TransportException} carrying the HTTP status.
 */
@Component
public class GitLabTransport {

    private static final Logger log = LoggerFactory.getLogger(GitLabTransport.class);
    private static final int MAX_ERROR_BODY = 500;

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final GitLabProperties properties;

    public GitLabTransport(HttpClient httpClient, ObjectMapper objectMapper, GitLabProperties properties) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    // -----------------------------------------------------------------------
    // REST
    // -----------------------------------------------------------------------

    public JsonNode get(String path, Map<String, ?> query) {
        return send("GET", restUri(path, query), null, false);
    }

    public JsonNode get(String path) {
        return get(path, Map.of());
    }

    /** GET that maps 404 to empty. */
    public Optional<JsonNode> getOptional(String path) {
        try {
            return Optional.of(get(path));
        } catch (TransportException e) {
            if (e.isNotFound()) {
                return Optional.empty();
            }
            throw e;
        }
    }

    public JsonNode post(String path, Map<String, ?> body) {
        return send("POST", restUri(path, Map.of()), body, false);
    }

    public JsonNode put(String path, Map<String, ?> body) {
        return send("PUT", restUri(path, Map.of()), body, false);
    }

    // -----------------------------------------------------------------------
    // GraphQL
    // -----------------------------------------------------------------------

    /**
     * Runs a GraphQL operation and returns its {@code data} node. Top-level errors fail the
     * call; a permission error is reported as 403 so it can be told apart from other failures.
     */
    public JsonNode graphql(String query, Map<String, ?> variables) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("query", query);
        body.put("variables", variables);
        JsonNode response = send("POST", URI.create(properties.graphqlEndpoint()), body, true);
        JsonNode errors = response.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            String message = errors.get(0).path("message").asText("GraphQL error");
            int status = message.toLowerCase().contains("permission") ? 403 : 400;
            throw new TransportException(status, "GraphQL: " + message);
        }
        return response.path("data");
    }

    // -----------------------------------------------------------------------
    // HTTP
    // -----------------------------------------------------------------------

    private JsonNode send(String method, URI uri, Object body, boolean bearer) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(properties.timeout())
                .header("Accept", "application/json");
        if (bearer) {
            builder.header("Authorization", "Bearer " + properties.token());
        } else {
            builder.header("PRIVATE-TOKEN", properties.token());
        }
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(toJson(body)));
        }

        log.debug("{} {}", method, uri);
        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException(TransportException.NO_RESPONSE,
                    method + " " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException(TransportException.NO_RESPONSE, method + " " + uri + " interrupted", e);
        }

        int status = response.statusCode();
        String text = response.body() == null ? "" : response.body();
        if (status < 200 || status >= 300) {
            throw new TransportException(status, method + " " + uri.getPath() + " returned " + status + ": "
                    + text.substring(0, Math.min(text.length(), MAX_ERROR_BODY)));
        }
        if (text.isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new TransportException(status, method + " " + uri.getPath() + " returned malformed JSON", e);
        }
    }

    private String toJson(Object body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize request body", e);
        }
    }

    URI restUri(String path, Map<String, ?> query) {
        StringBuilder uri = new StringBuilder(properties.restBase()).append(path);
        if (!query.isEmpty()) {
            StringJoiner params = new StringJoiner("&", "?", "");
            query.forEach((key, value) -> params.add(encode(key) + "=" + encode(String.valueOf(value))));
            uri.append(params);
        }
        return URI.create(uri.toString());
    }

    static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
