package io.metarouter.standalone.cli;

import static org.assertj.core.api.Assertions.assertThat;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.metarouter.core.engine.MatcherEvaluator;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Exercises the picocli command tree directly, capturing stdout and stderr through the
 * command line's writers.
 */
@DisplayName("meta-router CLI")
class RouterCommandTest {

    private static final String CONFIG = """
            settings:
              builtin-meta-agents: false
              routing-logger: { output: disabled }
            meta-agents:
              triage:
                base-model: base-model
                delegates-to: [explore, oracle, planner]
                routing-rules:
                  - matcher: { type: keyword, keywords: [bug, crash] }
                    target-agent: explore
                    config-overrides:
                      model: debug-model
                      temperature: 0.0
                      prompt: Reproduce the failure first.
                  - matcher: { type: project_context, has-deps: [react] }
                    target-agent: oracle
                  - matcher: { type: keyword, keywords: [plan] }
                    target-agent: planner
              planner:
                base-model: plan-model
                delegates-to: [prometheus]
                routing-rules:
                  - matcher: { type: always }
                    target-agent: prometheus
            """;

    private static final String INVALID_REFERENCE = """
            settings:
              builtin-meta-agents: false
            meta-agents:
              triage:
                base-model: base-model
                delegates-to: [oracle]
                routing-rules:
                  - matcher: { type: always }
                    target-agent: ghost
            """;

    private static final String SCHEMA_VIOLATION = """
            meta-agents:
              triage:
                base-model: base-model
                delegates-to: [oracle]
                routing-rules:
                  - matcher: { type: telepathy }
                    target-agent: oracle
            """;

    /** The second rule carries a pattern that fails to compile, which is logged whenever it is evaluated. */
    private static final String BROKEN_SECOND_RULE = """
            settings:
              builtin-meta-agents: false
              routing-logger: { output: disabled }
            meta-agents:
              triage:
                base-model: base-model
                delegates-to: [planner, oracle]
                routing-rules:
                  - matcher: { type: keyword, keywords: [plan] }
                    target-agent: planner
                  - matcher: { type: regex, pattern: "(unclosed" }
                    target-agent: oracle
              planner:
                base-model: plan-model
                delegates-to: [prometheus]
                routing-rules:
                  - matcher: { type: always }
                    target-agent: prometheus
            """;

    @TempDir
    Path tempDir;

    private final Map<String, String> env = new HashMap<>();

    private record CliResult(int exitCode, String out, String err) {}

    private CliResult run(String... args) {
        StringWriter out = new StringWriter();
        StringWriter err = new StringWriter();
        CommandLine cli = new CommandLine(new RouterCommand(env::get));
        cli.setOut(new PrintWriter(out));
        cli.setErr(new PrintWriter(err));
        int exitCode = cli.execute(args);
        return new CliResult(exitCode, out.toString(), err.toString());
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content);
        return file;
    }

    private static ListAppender<ILoggingEvent> captureEvaluatorLog() {
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        ((Logger) LoggerFactory.getLogger(MatcherEvaluator.class)).addAppender(appender);
        return appender;
    }

    private static void release(ListAppender<ILoggingEvent> appender) {
        ((Logger) LoggerFactory.getLogger(MatcherEvaluator.class)).detachAppender(appender);
        appender.stop();
    }

    @Test
    @DisplayName("no subcommand prints usage")
    void noSubcommand_printsUsage() {
        CliResult result = run();

        assertThat(result.exitCode()).isZero();
        assertThat(result.out()).contains("meta-router").contains("validate").contains("route").contains("agents");
    }

    @Nested
    @DisplayName("validate")
    class Validate {

        @Test
        @DisplayName("valid configuration exits 0")
        void valid() throws IOException {
            Path config = write("router.yaml", CONFIG);

            CliResult result = run("validate", "--config", config.toString());

            assertThat(result.exitCode()).isZero();
            assertThat(result.out()).contains("valid (0 errors, 0 warnings)");
        }

        @Test
        @DisplayName("semantic errors exit 1 and are listed with their paths")
        void invalidReference() throws IOException {
            Path config = write("router.yaml", INVALID_REFERENCE);

            CliResult result = run("validate", "-c", config.toString());

            assertThat(result.exitCode()).isEqualTo(1);
            assertThat(result.out())
                    .contains("invalid (1 error")
                    .contains("[ERROR] meta-agents.triage.routing-rules.0.target-agent")
                    .contains("ghost");
        }

        @Test
        @DisplayName("schema violations exit 2")
        void schemaViolation() throws IOException {
            Path config = write("router.yaml", SCHEMA_VIOLATION);

            CliResult result = run("validate", "--config", config.toString());

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.err()).contains("Schema validation failed");
        }

        @Test
        @DisplayName("missing file exits 2")
        void missingFile() {
            CliResult result = run("validate", "--config", tempDir.resolve("absent.yaml").toString());

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.err()).contains("Failed to read configuration");
        }

        @Test
        @DisplayName("unusable environment override exits 2")
        void badEnvironmentOverride() throws IOException {
            Path config = write("router.yaml", CONFIG);
            env.put("ROUTER_MAX_DELEGATION_DEPTH", "many");

            CliResult result = run("validate", "--config", config.toString());

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.err()).contains("ROUTER_MAX_DELEGATION_DEPTH");
        }

        @Test
        @DisplayName("missing --config is a usage error")
        void missingConfigOption() {
            CliResult result = run("validate");

            assertThat(result.exitCode()).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(result.err()).contains("--config");
        }
    }

    @Nested
    @DisplayName("route")
    class Route {

        @Test
        @DisplayName("first matching rule wins and overrides apply")
        void keywordMatch() throws IOException {
            Path config = write("router.yaml", CONFIG);

            CliResult result = run(
                    "route", "--config", config.toString(), "--agent", "triage", "--prompt", "Fix this crash, then plan");

            assertThat(result.exitCode()).isZero();
            assertThat(result.out())
                    .contains("target-agent:    explore")
                    .contains("matcher:         keyword")
                    .contains("model:           debug-model")
                    .contains("temperature:     0.0")
                    .contains("You are triage, a meta-agent coordinator.")
                    .contains("Reproduce the failure first.");
        }

        @Test
        @DisplayName("dependencies come from package.json in the project directory")
        void projectContextFromPackageJson() throws IOException {
            Path config = write("router.yaml", CONFIG);
            Path project = Files.createDirectory(tempDir.resolve("web"));
            Files.writeString(project.resolve("package.json"), "{\"dependencies\": {\"react\": \"18.2.0\"}}");

            CliResult result = run(
                    "route",
                    "--config", config.toString(),
                    "--agent", "triage",
                    "--prompt", "Add a settings page",
                    "--project-dir", project.toString());

            assertThat(result.exitCode()).isZero();
            assertThat(result.out()).contains("target-agent:    oracle").contains("matcher:         project_context");
        }

        @Test
        @DisplayName("--dep supplies dependencies without a project directory")
        void dependencyOption() throws IOException {
            Path config = write("router.yaml", CONFIG);

            CliResult result = run(
                    "route", "-c", config.toString(), "-a", "triage", "-p", "Add a page", "--dep", "react");

            assertThat(result.exitCode()).isZero();
            assertThat(result.out()).contains("target-agent:    oracle");
        }

        @Test
        @DisplayName("no matching rule exits 3")
        void noMatch() throws IOException {
            Path config = write("router.yaml", CONFIG);

            CliResult result = run(
                    "route", "--config", config.toString(), "--agent", "triage", "--prompt", "Write a poem");

            assertThat(result.exitCode()).isEqualTo(3);
            assertThat(result.out()).contains("No routing rule matched for meta-agent \"triage\"");
        }

        @Test
        @DisplayName("--trace lists every evaluated matcher")
        void trace() throws IOException {
            Path config = write("router.yaml", CONFIG);

            CliResult result = run(
                    "route", "--config", config.toString(), "--agent", "triage", "--prompt", "Let's plan", "--trace");

            assertThat(result.exitCode()).isZero();
            assertThat(result.out())
                    .contains("Evaluated 3 matcher(s):")
                    .contains("0. keyword -> no match")
                    .contains("1. project_context -> no match")
                    .contains("2. keyword -> match")
                    .contains("target-agent:    planner");
        }

        @Test
        @DisplayName("without --trace, rules after the winner are not evaluated")
        void stopsAtFirstMatch() throws IOException {
            Path config = write("router.yaml", BROKEN_SECOND_RULE);

            ListAppender<ILoggingEvent> quiet = captureEvaluatorLog();
            CliResult plain;
            try {
                plain = run("route", "--config", config.toString(), "--agent", "triage", "--prompt", "Let's plan");
            } finally {
                release(quiet);
            }

            ListAppender<ILoggingEvent> traced = captureEvaluatorLog();
            CliResult withTrace;
            try {
                withTrace = run(
                        "route", "--config", config.toString(), "--agent", "triage", "--prompt", "Let's plan", "--trace");
            } finally {
                release(traced);
            }

            assertThat(plain.exitCode()).isZero();
            assertThat(plain.out()).contains("target-agent:    planner").doesNotContain("Evaluated");
            assertThat(quiet.list).noneMatch(e -> e.getFormattedMessage().contains("matcher.regex_invalid"));

            assertThat(withTrace.exitCode()).isZero();
            assertThat(withTrace.out()).contains("Evaluated 2 matcher(s):").contains("target-agent:    planner");
            assertThat(traced.list).anyMatch(e -> e.getFormattedMessage().contains("matcher.regex_invalid"));
        }

        @Test
        @DisplayName("unknown meta-agent exits 2")
        void unknownAgent() throws IOException {
            Path config = write("router.yaml", CONFIG);

            CliResult result = run("route", "--config", config.toString(), "--agent", "ghost", "--prompt", "hi");

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.err()).contains("Meta-agent \"ghost\" is not registered");
        }

        @Test
        @DisplayName("invalid configuration is rejected before routing")
        void invalidConfig() throws IOException {
            Path config = write("router.yaml", INVALID_REFERENCE);

            CliResult result = run("route", "--config", config.toString(), "--agent", "triage", "--prompt", "hi");

            assertThat(result.exitCode()).isEqualTo(2);
            assertThat(result.err()).contains("Configuration rejected");
        }
    }

    @Nested
    @DisplayName("agents")
    class Agents {

        @Test
        @DisplayName("lists configured meta-agents with delegates and rules")
        void listsConfigured() throws IOException {
            Path config = write("router.yaml", CONFIG);

            CliResult result = run("agents", "--config", config.toString());

            assertThat(result.exitCode()).isZero();
            assertThat(result.out())
                    .contains("triage")
                    .contains("delegates-to: explore, oracle, planner")
                    .contains("keyword -> explore, project_context -> oracle, keyword -> planner")
                    .contains("planner");
        }

        @Test
        @DisplayName("bundled meta-agents appear under the namespace prefix")
        void includesBundled() throws IOException {
            Path config = write("router.yaml", CONFIG.replace("builtin-meta-agents: false", "builtin-meta-agents: true"));
            env.put("ROUTER_NAMESPACE_PREFIX", "olympus");

            CliResult result = run("agents", "--config", config.toString());

            assertThat(result.exitCode()).isZero();
            assertThat(result.out()).contains("olympus:atenea").contains("olympus:hermes").contains("olympus:hefesto");
        }

        @Test
        @DisplayName("bundled meta-agents route with the host default model")
        void routesBundledAgent() throws IOException {
            Path config = write("router.yaml", CONFIG.replace("builtin-meta-agents: false", "builtin-meta-agents: true"));

            CliResult result = run(
                    "route", "--config", config.toString(), "--agent", "router:hermes", "--prompt", "close the sprint ticket");

            assertThat(result.exitCode()).isZero();
            assertThat(result.out())
                    .contains("target-agent:    sisyphus")
                    .contains("model:           (host default)");
        }
    }
}
