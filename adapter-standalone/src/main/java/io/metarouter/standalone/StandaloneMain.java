package io.metarouter.standalone;

import io.metarouter.standalone.cli.RouterCommand;
import io.metarouter.standalone.config.LogbackConfigurator;
import picocli.CommandLine;

/**
 * Entry point for the standalone command-line adapter.
 *
 * <p>
 * Configures logging from {@code LOG_FORMAT} and {@code LOG_LEVEL}, then hands the arguments to
 * {@link RouterCommand} and exits with its exit code.
 */
public final class StandaloneMain {

    private StandaloneMain() {
        // utility class
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String[] args) {
        LogbackConfigurator.configureFromEnvironment(System::getenv);
        return new CommandLine(new RouterCommand()).execute(args);
    }
}
