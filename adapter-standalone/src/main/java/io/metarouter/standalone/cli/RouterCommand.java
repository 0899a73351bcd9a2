package io.metarouter.standalone.cli;

import java.util.Objects;
import java.util.function.Function;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

/**
 * Top-level CLI command. Routes to subcommands: validate, route, agents.
 */
@Command(
        name = "meta-router",
        mixinStandardHelpOptions = true,
        version = "meta-router 0.1.0",
        description = "Validates routing configurations and resolves prompts to delegate agents",
        subcommands = {
            ValidateCommand.class,
            RouteCommand.class,
            AgentsCommand.class,
            CommandLine.HelpCommand.class
        })
public class RouterCommand implements Runnable {

    @Spec
    CommandSpec spec;

    private final Function<String, String> envLookup;

    public RouterCommand() {
        this(System::getenv);
    }

    /** @param envLookup source of environment overrides; returning null means unset */
    public RouterCommand(Function<String, String> envLookup) {
        this.envLookup = Objects.requireNonNull(envLookup, "envLookup must not be null");
    }

    Function<String, String> envLookup() {
        return envLookup;
    }

    @Override
    public void run() {
        // no subcommand given
        spec.commandLine().usage(spec.commandLine().getOut());
    }
}
