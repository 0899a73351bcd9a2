package io.metarouter.standalone.cli;

import io.metarouter.core.model.RouterConfig;
import io.metarouter.core.spec.ConfigParser;
import io.metarouter.standalone.config.EnvOverlay;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.function.Function;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

/** Shared {@code --config} handling for subcommands that read a router configuration. */
abstract class AbstractConfigCommand implements Callable<Integer> {

    static final int EXIT_OK = 0;
    static final int EXIT_INVALID = 1;
    static final int EXIT_ERROR = 2;
    static final int EXIT_NO_MATCH = 3;

    @Spec
    CommandSpec spec;

    @Option(
            names = {"-c", "--config"},
            required = true,
            paramLabel = "<file>",
            description = "Router configuration file (YAML or JSON)")
    Path configFile;

    final ConfigParser parser = new ConfigParser();

    /** Parses {@link #configFile} and applies environment overrides. */
    RouterConfig loadConfig() {
        return EnvOverlay.apply(parser.parse(configFile), envLookup());
    }

    Function<String, String> envLookup() {
        RouterCommand root = spec.root().userObject() instanceof RouterCommand r ? r : null;
        return root != null ? root.envLookup() : System::getenv;
    }

    PrintWriter out() {
        return spec.commandLine().getOut();
    }

    PrintWriter err() {
        return spec.commandLine().getErr();
    }
}
