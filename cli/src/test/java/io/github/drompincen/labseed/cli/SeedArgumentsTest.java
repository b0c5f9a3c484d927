package io.github.drompincen.labseed.cli;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeedArgumentsTest {

    private static final String[] REQUIRED = {
            "--config", "seed.yaml", "--token", "glpat-x", "--url", "https://gitlab.example.com"};

    @Test
    void parsesRequiredArguments() {
        SeedArguments arguments = SeedArguments.parse(REQUIRED, Map.of());

        assertThat(arguments.config()).isEqualTo("seed.yaml");
        assertThat(arguments.token()).isEqualTo("glpat-x");
        assertThat(arguments.url()).isEqualTo("https://gitlab.example.com");
        assertThat(arguments.toProperties()).containsOnly(
                Map.entry("labseed.config", "seed.yaml"),
                Map.entry("labseed.gitlab.url", "https://gitlab.example.com"),
                Map.entry("labseed.gitlab.token", "glpat-x"));
    }

    @Test
    void tokenFallsBackToEnvironment() {
        SeedArguments arguments = SeedArguments.parse(
                new String[]{"--config", "seed.yaml", "--url", "https://gitlab.example.com"},
                Map.of(SeedArguments.TOKEN_ENV, "from-env"));

        assertThat(arguments.token()).isEqualTo("from-env");
    }

    @Test
    void commandLineTokenWinsOverEnvironment() {
        SeedArguments arguments = SeedArguments.parse(REQUIRED, Map.of(SeedArguments.TOKEN_ENV, "from-env"));

        assertThat(arguments.token()).isEqualTo("glpat-x");
    }

    @Test
    void optionalArgumentsBecomeProperties() {
        String[] args = {"--config", "seed.yaml", "--token", "t", "--url", "http://localhost",
                "--parent", "acme/teams", "--verbose", "--on-duplicate", "REJECT", "--link-mode", "deferred"};

        Map<String, String> properties = SeedArguments.parse(args, Map.of()).toProperties();

        assertThat(properties)
                .containsEntry("labseed.parent", "acme/teams")
                .containsEntry("labseed.duplicates", "reject")
                .containsEntry("labseed.link-mode", "deferred")
                .containsEntry("logging.level.io.github.drompincen.labseed", "DEBUG")
                .doesNotContainKey("logging.level.root");
    }

    @Test
    void debugRaisesEveryLogger() {
        String[] args = {"--config", "seed.yaml", "--token", "t", "--url", "http://localhost", "--debug"};

        assertThat(SeedArguments.parse(args, Map.of()).toProperties()).containsEntry("logging.level.root", "DEBUG");
    }

    @Test
    void missingRequiredArgumentIsRejected() {
        assertThatThrownBy(() -> SeedArguments.parse(new String[]{"--config", "seed.yaml", "--token", "t"}, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Missing --url");
        assertThatThrownBy(() -> SeedArguments.parse(new String[]{"--config", "seed.yaml", "--url", "u"}, Map.of()))
                .hasMessageContaining("LABSEED_TOKEN");
    }

    @Test
    void optionWithoutValueIsRejected() {
        assertThatThrownBy(() -> SeedArguments.parse(new String[]{"--config", "--url", "u"}, Map.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("--config needs a value");
    }

    @Test
    void unknownValuesAreRejected() {
        assertThatThrownBy(() -> SeedArguments.parse(new String[]{"--link-mode", "lazy"}, Map.of()))
                .hasMessageContaining("inline, deferred");
        assertThatThrownBy(() -> SeedArguments.parse(new String[]{"--dry-run"}, Map.of()))
                .hasMessage("Unknown argument: --dry-run");
    }

    @Test
    void toStringHidesToken() {
        assertThat(SeedArguments.parse(REQUIRED, Map.of()).toString()).doesNotContain("glpat-x");
    }
}
