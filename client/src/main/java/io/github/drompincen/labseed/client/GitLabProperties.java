package io.github.drompincen.labseed.client;

import io.github.drompincen.labseed.runtime.platform.CapabilityDescriptor;
import io.github.drompincen.labseed.runtime.platform.CapabilityDescriptor.Support;

import java.time.Duration;

/**
 * Connection settings for one GitLab instance.
 *
 * @param baseUrl    instance root, e.g. {@code https://gitlab.example.com}
 * @param token      personal or group access token with {@code api} scope
 * @param timeout    per-request timeout
 * @param epics      what groups are assumed to support for epics
 * @param iterations what groups are assumed to support for iterations
 */
public record GitLabProperties(
        String baseUrl,
        String token,
        Duration timeout,
        Support epics,
        Support iterations
) {
    public GitLabProperties {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("GitLab base URL is required");
        }
        if (token == null || token.isBlank()) {
            throw new IllegalArgumentException("GitLab access token is required");
        }
        baseUrl = baseUrl.strip().replaceAll("/+$", "");
        timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        epics = epics == null ? Support.UNKNOWN : epics;
        iterations = iterations == null ? Support.UNKNOWN : iterations;
    }

    public String restBase() {
        return baseUrl + "/api/v4";
    }

    public String graphqlEndpoint() {
        return baseUrl + "/api/graphql";
    }

    public CapabilityDescriptor groupCapabilities() {
        return CapabilityDescriptor.of(epics, iterations);
    }

    /**
     * Parses {@code auto}, {@code enabled} or {@code disabled}.
     */
    public static Support parseSupport(String value) {
        if (value == null || value.isBlank()) {
            return Support.UNKNOWN;
        }
        return switch (value.strip().toLowerCase()) {
            case "auto" -> Support.UNKNOWN;
            case "enabled" -> Support.SUPPORTED;
            case "disabled" -> Support.UNSUPPORTED;
            default -> throw new IllegalArgumentException(
                    "Capability setting must be auto, enabled or disabled, got '" + value + "'");
        };
    }
}
