package io.github.drompincen.labseed.cli;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Command-line arguments, turned into Spring properties before the context starts.
 */
public record SeedArguments(
        String config,
        String token,
        String url,
        String parent,
        boolean verbose,
        boolean debug,
        String onDuplicate,
        String linkMode
) {
    public static final String TOKEN_ENV = "LABSEED_TOKEN";

    public static final String USAGE = """
            Usage: labseed --config <file> --token <token> --url <base-url>
                           [--parent <group/path>] [--verbose|--debug]
                           [--on-duplicate reuse|reject] [--link-mode inline|deferred]

              --config        YAML seed document
              --token         GitLab access token with api scope (default: $LABSEED_TOKEN)
              --url           GitLab base URL, e.g. https://gitlab.example.com
              --parent        existing group that top-level groups are created in
              --verbose       debug logging for labseed
              --debug         debug logging for everything, HTTP client included
              --on-duplicate  reuse an existing entity with the same name (default) or abort
              --link-mode     apply relationships right away (default) or after all entities exist
            """;

    /**
     * @throws IllegalArgumentException when an argument is unknown, lacks its value, or a
     *                                  required argument is missing
     */
    public static SeedArguments parse(String[] args, Map<String, String> env) {
        String config = null;
        String token = env.get(TOKEN_ENV);
        String url = null;
        String parent = null;
        boolean verbose = false;
        boolean debug = false;
        String onDuplicate = null;
        String linkMode = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--config" -> config = value(args, ++i, "--config");
                case "--token" -> token = value(args, ++i, "--token");
                case "--url" -> url = value(args, ++i, "--url");
                case "--parent" -> parent = value(args, ++i, "--parent");
                case "--verbose" -> verbose = true;
                case "--debug" -> debug = true;
                case "--on-duplicate" -> onDuplicate = choice(value(args, ++i, "--on-duplicate"), "--on-duplicate", "reuse", "reject");
                case "--link-mode" -> linkMode = choice(value(args, ++i, "--link-mode"), "--link-mode", "inline", "deferred");
                default -> throw new IllegalArgumentException("Unknown argument: " + args[i]);
            }
        }

        if (isBlank(config)) {
            throw new IllegalArgumentException("Missing --config");
        }
        if (isBlank(url)) {
            throw new IllegalArgumentException("Missing --url");
        }
        if (isBlank(token)) {
            throw new IllegalArgumentException("Missing --token (or " + TOKEN_ENV + ")");
        }
        return new SeedArguments(config, token, url, parent, verbose, debug, onDuplicate, linkMode);
    }

    /** Spring properties for these arguments; options left out keep their configured default. */
    public Map<String, String> toProperties() {
        Map<String, String> properties = new LinkedHashMap<>();
        properties.put("labseed.config", config);
        properties.put("labseed.gitlab.url", url);
        properties.put("labseed.gitlab.token", token);
        if (parent != null) {
            properties.put("labseed.parent", parent);
        }
        if (onDuplicate != null) {
            properties.put("labseed.duplicates", onDuplicate);
        }
        if (linkMode != null) {
            properties.put("labseed.link-mode", linkMode);
        }
        if (verbose || debug) {
            properties.put("logging.level.io.github.drompincen.labseed", "DEBUG");
        }
        if (debug) {
            properties.put("logging.level.root", "DEBUG");
        }
        return properties;
    }

    private static String value(String[] args, int i, String name) {
        if (i >= args.length || args[i].startsWith("--")) {
            throw new IllegalArgumentException(name + " needs a value");
        }
        return args[i];
    }

    private static String choice(String value, String name, String... allowed) {
        String normalized = value.toLowerCase();
        for (String option : allowed) {
            if (option.equals(normalized)) {
                return normalized;
            }
        }
        throw new IllegalArgumentException(name + " must be one of " + String.join(", ", allowed) + ", got " + value);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // token left out
    @Override
    public String toString() {
        return "SeedArguments[config=" + config + ", url=" + url + ", parent=" + parent
                + ", onDuplicate=" + onDuplicate + ", linkMode=" + linkMode + "]";
    }
}
