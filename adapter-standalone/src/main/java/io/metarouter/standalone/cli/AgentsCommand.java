package io.metarouter.standalone.cli;

import io.metarouter.core.engine.RoutingEngine;
import io.metarouter.core.error.RouterException;
import io.metarouter.core.model.MetaAgentDefinition;
import io.metarouter.core.model.RoutingRule;
import io.metarouter.standalone.config.EnvOverlayException;
import java.util.Map;
import java.util.stream.Collectors;
import picocli.CommandLine.Command;

/**
 * CLI command: {@code meta-router agents --config <file>}. Lists every registered meta-agent,
 * bundled ones included, with its delegates and rule targets.
 */
@Command(name = "agents", mixinStandardHelpOptions = true, description = "List registered meta-agents")
class AgentsCommand extends AbstractConfigCommand {

    @Override
    public Integer call() {
        RoutingEngine engine = new RoutingEngine(parser);
        try {
            engine.load(loadConfig());
        } catch (RouterException | EnvOverlayException e) {
            err().println(e.getMessage());
            return EXIT_ERROR;
        }

        for (Map.Entry<String, MetaAgentDefinition> entry : engine.definitions().entrySet()) {
            MetaAgentDefinition definition = entry.getValue();
            out().println(entry.getKey());
            if (definition.description() != null && !definition.description().isBlank()) {
                out().println("  description:  " + definition.description().strip());
            }
            out().println("  delegates-to: " + String.join(", ", definition.delegatesTo()));
            out().println("  rules:        " + definition.routingRules().stream()
                    .map(AgentsCommand::describe)
                    .collect(Collectors.joining(", ")));
        }
        return EXIT_OK;
    }

    private static String describe(RoutingRule rule) {
        return rule.matcher().kind() + " -> " + rule.targetAgent();
    }
}
