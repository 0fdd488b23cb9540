package io.exprtree.standalone.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.exprtree.core.engine.EvalLimits;
import io.exprtree.core.engine.EvaluationMode;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Tests for {@link ConfigLoader} YAML parsing. Exercises loading from
 * classpath fixtures, defaults for missing keys, and the error paths.
 */
@DisplayName("YAML config loader")
class ConfigLoaderTest {

    private static final Map<String, String> NO_ENV = Map.of();

    @TempDir
    Path tempDir;

    private static Path fixture(String name) throws Exception {
        return Path.of(ConfigLoaderTest.class
                .getClassLoader()
                .getResource("config/" + name)
                .toURI());
    }

    private Path write(String yaml) throws IOException {
        Path path = tempDir.resolve("config.yaml");
        Files.writeString(path, yaml);
        return path;
    }

    @Nested
    @DisplayName("Fixtures")
    class Fixtures {

        @Test
        @DisplayName("Minimal config → explicit mode + all other defaults")
        void minimalConfig() throws Exception {
            DemoConfig config = ConfigLoader.load(fixture("minimal-config.yaml"), NO_ENV::get);

            assertThat(config.engineMode()).isEqualTo(EvaluationMode.STRICT);
            assertThat(config.maxDepth()).isEqualTo(EvalLimits.DEFAULT.maxDepth());
            assertThat(config.variableValue()).isEqualTo(10.0);
            assertThat(config.loggingFormat()).isEqualTo("text");
            assertThat(config.loggingLevel()).isEqualTo("INFO");
        }

        @Test
        @DisplayName("Full config → every key mapped")
        void fullConfig() throws Exception {
            DemoConfig config = ConfigLoader.load(fixture("full-config.yaml"), NO_ENV::get);

            assertThat(config)
                    .isEqualTo(DemoConfig.builder()
                            .engineMode(EvaluationMode.STRICT)
                            .maxDepth(64)
                            .variableValue(-2.5)
                            .loggingFormat("json")
                            .loggingLevel("DEBUG")
                            .build());
            assertThat(config.evalLimits()).isEqualTo(new EvalLimits(64));
        }
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        @Test
        void emptyFileYieldsDefaults() throws IOException {
            assertThat(ConfigLoader.load(write(""), NO_ENV::get)).isEqualTo(DemoConfig.DEFAULT);
        }

        @Test
        void defaultsWithoutFileMatchDefaultConfig() {
            assertThat(ConfigLoader.defaults(NO_ENV::get)).isEqualTo(DemoConfig.DEFAULT);
        }

        @Test
        void modeIsCaseInsensitive() throws IOException {
            assertThat(ConfigLoader.load(write("engine:\n  mode: STRICT\n"), NO_ENV::get).engineMode())
                    .isEqualTo(EvaluationMode.STRICT);
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @Test
        void missingFileIsRejected() {
            Path missing = tempDir.resolve("nope.yaml");

            assertThatThrownBy(() -> ConfigLoader.load(missing, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("not found")
                    .hasMessageContaining("nope.yaml");
        }

        @Test
        void malformedYamlIsRejected() throws IOException {
            Path path = write("engine: [unclosed\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("Failed to parse YAML");
        }

        @Test
        void unknownModeIsRejected() throws IOException {
            Path path = write("engine:\n  mode: paranoid\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("engine.mode")
                    .hasMessageContaining("paranoid");
        }

        @Test
        void nonIntegerDepthIsRejected() throws IOException {
            Path path = write("engine:\n  max-depth: deep\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("engine.max-depth");
        }

        @Test
        void nonPositiveDepthIsRejected() throws IOException {
            Path path = write("engine:\n  max-depth: 0\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("must be positive");
        }

        @Test
        void nonNumericVariableValueIsRejected() throws IOException {
            Path path = write("demo:\n  variable-value: ten\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("demo.variable-value");
        }

        @Test
        void unknownLoggingFormatIsRejected() throws IOException {
            Path path = write("logging:\n  format: xml\n");

            assertThatThrownBy(() -> ConfigLoader.load(path, NO_ENV::get))
                    .isInstanceOf(ConfigLoadException.class)
                    .hasMessageContaining("logging.format");
        }
    }

    @Nested
    @DisplayName("CLI path resolution")
    class PathResolution {

        @Test
        void noArgumentsMeansNoFile() {
            assertThat(ConfigLoader.resolveConfigPath(new String[0])).isEmpty();
        }

        @Test
        void configFlagSelectsPath() {
            assertThat(ConfigLoader.resolveConfigPath(new String[] {"--config", "/etc/demo.yaml"}))
                    .contains(Path.of("/etc/demo.yaml"));
        }

        @Test
        void configFlagWithoutValueIsRejected() {
            assertThatThrownBy(() -> ConfigLoader.resolveConfigPath(new String[] {"--config"}))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("--config");
        }
    }
}
