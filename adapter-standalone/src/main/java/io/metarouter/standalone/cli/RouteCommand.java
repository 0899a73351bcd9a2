package io.metarouter.standalone.cli;

import io.metarouter.core.engine.RoutingEngine;
import io.metarouter.core.error.RouterException;
import io.metarouter.core.model.AgentConfig;
import io.metarouter.core.model.MatcherEvaluation;
import io.metarouter.core.model.MetaAgentDefinition;
import io.metarouter.core.model.ResolvedRoute;
import io.metarouter.core.model.RouteResolution;
import io.metarouter.core.model.RoutingContext;
import io.metarouter.standalone.config.EnvOverlayException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * CLI command: {@code meta-router route --config <file> --agent <name> --prompt <text>}.
 *
 * <p>
 * Loads the configuration into a {@link RoutingEngine}, resolves the prompt and prints the
 * chosen agent configuration with its delegation prompt. Exit code 0 on a match, 3 when no rule
 * matched, 2 when the configuration cannot be loaded or the meta-agent is unknown.
 */
@Command(name = "route", mixinStandardHelpOptions = true, description = "Resolve a prompt to a delegate agent")
class RouteCommand extends AbstractConfigCommand {

    @Option(names = {"-a", "--agent"}, required = true, paramLabel = "<name>", description = "Meta-agent to resolve")
    String agent;

    @Option(names = {"-p", "--prompt"}, required = true, paramLabel = "<text>", description = "Task prompt")
    String prompt;

    @Option(
            names = "--project-dir",
            paramLabel = "<dir>",
            description = "Project directory for file probes; its package.json dependencies are read")
    Path projectDir;

    @Option(names = "--dep", paramLabel = "<name>", description = "Additional project dependency (repeatable)")
    List<String> extraDependencies = new ArrayList<>();

    @Option(names = "--trace", description = "Print every evaluated matcher")
    boolean trace;

    @Override
    public Integer call() {
        RoutingEngine engine = new RoutingEngine(parser);
        try {
            engine.load(loadConfig());
        } catch (RouterException | EnvOverlayException e) {
            err().println(e.getMessage());
            return EXIT_ERROR;
        }

        RoutingContext context = new RoutingContext(
                prompt,
                projectDir == null ? null : projectDir.toString(),
                List.of(),
                ProjectInspector.dependencies(projectDir, extraDependencies));

        AgentConfig config;
        try {
            config = trace ? resolveWithTrace(engine, context) : engine.resolve(agent, context);
        } catch (RouterException e) {
            err().println(e.getMessage());
            return EXIT_ERROR;
        }
        if (config == null) {
            out().println("No routing rule matched for meta-agent \"" + agent + "\"");
            return EXIT_NO_MATCH;
        }

        ResolvedRoute route = config.route();
        out().println("meta-agent:      " + agent);
        out().println("target-agent:    " + route.targetAgent());
        out().println("matcher:         " + route.matcherKind());
        out().println("matched-content: " + orDash(route.matchedContent()));
        out().println("model:           " + (config.usesHostDefaultModel() ? "(host default)" : config.model()));
        out().println("temperature:     " + (config.temperature() == null ? "-" : config.temperature()));
        out().println("variant:         " + orDash(config.variant()));
        out().println();
        out().println(config.prompt());
        return EXIT_OK;
    }

    /** Evaluates every rule for the printed trace; the winner is still the first match. */
    private AgentConfig resolveWithTrace(RoutingEngine engine, RoutingContext context) {
        RouteResolution resolution = engine.resolveRoute(agent, context);
        printTrace(resolution.evaluations());
        if (resolution.route() == null) {
            return null;
        }
        MetaAgentDefinition definition = engine.registry().get(agent);
        return RoutingEngine.toAgentConfig(agent, definition, resolution.route(), context);
    }

    private void printTrace(List<MatcherEvaluation> evaluations) {
        out().println("Evaluated " + evaluations.size() + " matcher(s):");
        for (int i = 0; i < evaluations.size(); i++) {
            MatcherEvaluation evaluation = evaluations.get(i);
            out().println("  " + i + ". " + evaluation.matcherKind() + " -> " + (evaluation.matched() ? "match" : "no match"));
        }
    }

    private static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
