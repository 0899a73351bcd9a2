package io.metarouter.core.spec;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.metarouter.core.error.ConfigParseException;
import io.metarouter.core.error.RouterException;
import io.metarouter.core.error.SchemaValidationException;
import io.metarouter.core.model.ComplexityThreshold;
import io.metarouter.core.model.KeywordMode;
import io.metarouter.core.model.Matcher;
import io.metarouter.core.model.MetaAgentDefinition;
import io.metarouter.core.model.RouterConfig;
import io.metarouter.core.model.RouterSettings;
import io.metarouter.core.model.RoutingLoggerSettings;
import io.metarouter.core.model.RoutingRule;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@DisplayName("ConfigParser")
class ConfigParserTest {

    private final ConfigParser parser = new ConfigParser();

    @TempDir
    Path tempDir;

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    @Nested
    @DisplayName("valid documents")
    class ValidDocuments {

        @Test
        @DisplayName("full configuration maps every field")
        void fullConfiguration() throws IOException {
            Path file = write("router.yaml", """
                    settings:
                      namespace-prefix: acme
                      max-delegation-depth: 5
                      builtin-meta-agents: false
                      routing-logger:
                        enabled: true
                        output: file
                        log-file: logs/routing.jsonl
                        debug-mode: true
                      validation:
                        regex-performance: false
                    meta-agents:
                      triage:
                        base-model: model-x
                        description: Routes incoming work
                        temperature: 0.2
                        prompt-template: "Handle: {input}"
                        delegates-to: [oracle, explore, librarian]
                        routing-rules:
                          - matcher: { type: keyword, keywords: [bug, fix], mode: all }
                            target-agent: explore
                            config-overrides: { model: model-y, temperature: 0.1, prompt: Be terse, variant: fast }
                          - matcher: { type: complexity, threshold: high }
                            target-agent: oracle
                          - matcher: { type: regex, pattern: "docs?", flags: gi }
                            target-agent: librarian
                          - matcher: { type: project_context, has-files: [package.json], has-deps: [vitest] }
                            target-agent: explore
                          - matcher: { type: always }
                            target-agent: oracle
                    """);

            RouterConfig config = parser.parse(file);

            RouterSettings settings = config.settings();
            assertThat(settings.namespacePrefix()).isEqualTo("acme");
            assertThat(settings.maxDelegationDepth()).isEqualTo(5);
            assertThat(settings.builtinMetaAgents()).isFalse();
            assertThat(settings.logger().output()).isEqualTo(RoutingLoggerSettings.Output.FILE);
            assertThat(settings.logger().logFile()).isEqualTo("logs/routing.jsonl");
            assertThat(settings.logger().debugMode()).isTrue();
            assertThat(settings.validation().regexPerformance()).isFalse();
            assertThat(settings.validation().circularDependencies()).isTrue();

            MetaAgentDefinition triage = config.metaAgents().get("triage");
            assertThat(triage.baseModel()).isEqualTo("model-x");
            assertThat(triage.temperature()).isEqualTo(0.2);
            assertThat(triage.promptTemplate()).isEqualTo("Handle: {input}");
            assertThat(triage.description()).isEqualTo("Routes incoming work");
            assertThat(triage.delegatesTo()).containsExactly("oracle", "explore", "librarian");
            assertThat(triage.routingRules())
                    .extracting(r -> r.matcher().kind())
                    .containsExactly("keyword", "complexity", "regex", "project_context", "always");

            RoutingRule first = triage.routingRules().get(0);
            assertThat(first.matcher())
                    .isEqualTo(new Matcher.Keyword(List.of("bug", "fix"), KeywordMode.ALL));
            assertThat(first.overrides().model()).isEqualTo("model-y");
            assertThat(first.overrides().temperature()).isEqualTo(0.1);
            assertThat(first.overrides().prompt()).isEqualTo("Be terse");
            assertThat(first.overrides().variant()).isEqualTo("fast");

            assertThat(triage.routingRules().get(1).matcher())
                    .isEqualTo(new Matcher.Complexity(ComplexityThreshold.HIGH));
            assertThat(triage.routingRules().get(2).matcher()).isEqualTo(new Matcher.Regex("docs?", "gi"));
            assertThat(triage.routingRules().get(3).matcher())
                    .isEqualTo(new Matcher.ProjectContext(
                            List.of("package.json"), List.of("vitest")));
        }

        @Test
        @DisplayName("omitted settings fall back to defaults")
        void defaults() throws IOException {
            Path file = write("minimal.yaml", """
                    meta-agents:
                      triage:
                        base-model: model-x
                        delegates-to: [oracle]
                        routing-rules:
                          - matcher: { type: keyword, keywords: [bug] }
                            target-agent: oracle
                    """);

            RouterConfig config = parser.parse(file);

            assertThat(config.settings()).isEqualTo(RouterSettings.DEFAULT);
            Matcher.Keyword keyword =
                    (Matcher.Keyword) config.metaAgents().get("triage").routingRules().get(0).matcher();
            assertThat(keyword.mode()).isEqualTo(KeywordMode.ANY);
            assertThat(config.metaAgents().get("triage").temperature()).isNull();
        }

        @Test
        @DisplayName("JSON documents are accepted")
        void jsonDocument() {
            RouterConfig config = parser.parseString(
                    "{\"meta-agents\": {\"j\": {\"base-model\": \"m\", \"delegates-to\": [\"oracle\"],"
                            + " \"routing-rules\": [{\"matcher\": {\"type\": \"always\"}, \"target-agent\": \"oracle\"}]}}}",
                    "inline.json");

            assertThat(config.metaAgents()).containsOnlyKeys("j");
        }

        @Test
        @DisplayName("meta-agents keep declaration order")
        void declarationOrder() {
            String rule = "    base-model: m\n    delegates-to: [oracle]\n"
                    + "    routing-rules: [{matcher: {type: always}, target-agent: oracle}]\n";
            RouterConfig config =
                    parser.parseString("meta-agents:\n  zeta:\n" + rule + "  alpha:\n" + rule + "  mid:\n" + rule, "x");

            assertThat(config.metaAgents().keySet()).containsExactly("zeta", "alpha", "mid");
        }

        @Test
        @DisplayName("empty document is an empty configuration")
        void emptyDocument() {
            RouterConfig config = parser.parseString("", "empty.yaml");

            assertThat(config.metaAgents()).isEmpty();
            assertThat(config.settings()).isEqualTo(RouterSettings.DEFAULT);
        }
    }

    @Nested
    @DisplayName("rejected documents")
    class RejectedDocuments {

        @Test
        @DisplayName("malformed YAML is a parse error")
        void malformedYaml() throws IOException {
            Path file = write("broken.yaml", "meta-agents: [unclosed\n");

            assertThatThrownBy(() -> parser.parse(file))
                    .isInstanceOf(ConfigParseException.class)
                    .satisfies(e -> {
                        ConfigParseException ex = (ConfigParseException) e;
                        assertThat(ex.source()).isEqualTo(file.toString());
                        assertThat(ex.phase()).isEqualTo(RouterException.Phase.LOAD);
                    });
        }

        @Test
        @DisplayName("missing file is a parse error")
        void missingFile() {
            assertThatThrownBy(() -> parser.parse(tempDir.resolve("absent.yaml")))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("Failed to read configuration");
        }

        @Test
        @DisplayName("every schema violation is reported")
        void allViolationsReported() {
            String yaml = """
                    meta-agents:
                      triage:
                        delegates-to: [oracle]
                        colour: blue
                        routing-rules:
                          - matcher: { type: keyword }
                            target-agent: oracle
                    """;

            assertThatThrownBy(() -> parser.parseString(yaml, "bad.yaml"))
                    .isInstanceOf(SchemaValidationException.class)
                    .satisfies(e -> {
                        SchemaValidationException ex = (SchemaValidationException) e;
                        assertThat(ex.violations()).hasSizeGreaterThanOrEqualTo(3);
                        assertThat(String.join("\n", ex.violations()))
                                .contains("base-model")
                                .contains("colour")
                                .contains("keywords");
                        assertThat(ex.source()).isEqualTo("bad.yaml");
                    });
        }

        @Test
        @DisplayName("unknown matcher type is rejected by the schema")
        void unknownMatcherType() {
            String yaml = """
                    meta-agents:
                      triage:
                        base-model: m
                        delegates-to: [oracle]
                        routing-rules:
                          - matcher: { type: sentiment }
                            target-agent: oracle
                    """;

            assertThatThrownBy(() -> parser.parseString(yaml, "bad.yaml")).isInstanceOf(SchemaValidationException.class);
        }

        @Test
        @DisplayName("non-positive delegation depth is rejected")
        void zeroDepth() {
            assertThatThrownBy(() -> parser.parseString("settings:\n  max-delegation-depth: 0\n", "bad.yaml"))
                    .isInstanceOf(SchemaValidationException.class);
        }

        @Test
        @DisplayName("a scalar root is a parse error")
        void scalarRoot() {
            assertThatThrownBy(() -> parser.parseString("just text", "bad.yaml"))
                    .isInstanceOf(ConfigParseException.class)
                    .hasMessageContaining("mapping");
        }
    }
}
