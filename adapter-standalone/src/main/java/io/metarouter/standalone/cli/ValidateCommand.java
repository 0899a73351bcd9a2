package io.metarouter.standalone.cli;

import io.metarouter.core.error.RouterLoadException;
import io.metarouter.core.error.SchemaValidationException;
import io.metarouter.core.model.RouterConfig;
import io.metarouter.core.spec.BuiltinMetaAgents;
import io.metarouter.core.validation.ConfigValidator;
import io.metarouter.core.validation.ValidationResult;
import io.metarouter.standalone.config.EnvOverlayException;
import picocli.CommandLine.Command;

/**
 * CLI command: {@code meta-router validate --config <file>}.
 *
 * <p>
 * Prints the validation summary followed by every error and warning. Exit code 0 when the
 * configuration is valid (warnings allowed), 1 when semantic validation fails, 2 when the file
 * cannot be parsed or violates the schema.
 */
@Command(name = "validate", mixinStandardHelpOptions = true, description = "Validate a router configuration")
class ValidateCommand extends AbstractConfigCommand {

    @Override
    public Integer call() {
        RouterConfig config;
        try {
            config = BuiltinMetaAgents.merge(loadConfig(), parser);
        } catch (SchemaValidationException e) {
            err().println("Schema validation failed: " + configFile);
            for (String violation : e.violations()) {
                err().println("  " + violation);
            }
            return EXIT_ERROR;
        } catch (RouterLoadException | EnvOverlayException e) {
            err().println(e.getMessage());
            return EXIT_ERROR;
        }

        ValidationResult result = ConfigValidator.validate(config);
        out().println(configFile + ": " + result.summary());
        result.formatErrors().forEach(out()::println);
        result.formatWarnings().forEach(out()::println);
        return result.valid() ? EXIT_OK : EXIT_INVALID;
    }
}
