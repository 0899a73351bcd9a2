package io.metarouter.standalone.config;

import io.metarouter.core.model.RouterConfig;
import io.metarouter.core.model.RouterSettings;
import io.metarouter.core.model.RoutingLoggerSettings;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Overlays environment variables on the {@code settings} block of a parsed
 * {@link RouterConfig}.
 *
 * <p>
 * Env vars take precedence over YAML values. An env var is considered "set" if and only if it
 * is defined AND its trimmed value is non-empty; empty or whitespace-only values leave the YAML
 * value in place.
 *
 * <table>
 * <caption>Recognised variables</caption>
 * <tr><td>{@code ROUTER_MAX_DELEGATION_DEPTH}</td><td>{@code settings.max-delegation-depth}</td></tr>
 * <tr><td>{@code ROUTER_NAMESPACE_PREFIX}</td><td>{@code settings.namespace-prefix}</td></tr>
 * <tr><td>{@code ROUTER_LOG_OUTPUT}</td><td>{@code settings.logger.output}</td></tr>
 * <tr><td>{@code ROUTER_LOG_FILE}</td><td>{@code settings.logger.log-file}</td></tr>
 * <tr><td>{@code ROUTER_DEBUG_MODE}</td><td>{@code settings.logger.debug-mode}</td></tr>
 * </table>
 */
public final class EnvOverlay {

    static final String MAX_DELEGATION_DEPTH = "ROUTER_MAX_DELEGATION_DEPTH";
    static final String NAMESPACE_PREFIX = "ROUTER_NAMESPACE_PREFIX";
    static final String LOG_OUTPUT = "ROUTER_LOG_OUTPUT";
    static final String LOG_FILE = "ROUTER_LOG_FILE";
    static final String DEBUG_MODE = "ROUTER_DEBUG_MODE";

    private EnvOverlay() {
        // utility class
    }

    /** Applies overrides from {@link System#getenv}. */
    public static RouterConfig apply(RouterConfig config) {
        return apply(config, System::getenv);
    }

    /**
     * Applies overrides from the supplied lookup function. Returning {@code null} from
     * {@code envLookup} means the variable is not defined.
     *
     * @return {@code config} itself when no variable is set, else a copy with new settings
     * @throws EnvOverlayException if a set variable has an unusable value
     */
    public static RouterConfig apply(RouterConfig config, Function<String, String> envLookup) {
        RouterSettings original = config.settings();
        Holder<RouterSettings> settings = new Holder<>(original);
        Holder<RoutingLoggerSettings> logger = new Holder<>(original.logger());

        envString(envLookup, NAMESPACE_PREFIX, v -> settings.update(s -> s.withNamespacePrefix(v)));
        envInt(envLookup, MAX_DELEGATION_DEPTH, v -> settings.update(s -> s.withMaxDelegationDepth(v)));
        envString(envLookup, LOG_OUTPUT, v -> logger.update(l -> l.withOutput(parseOutput(v))));
        envString(envLookup, LOG_FILE, v -> logger.update(l -> l.withLogFile(v)));
        envBool(envLookup, DEBUG_MODE, v -> logger.update(l -> l.withDebugMode(v)));

        RouterSettings overlaid = settings.value.withLogger(logger.value);
        return overlaid.equals(original) ? config : config.withSettings(overlaid);
    }

    // --- env helpers ---

    /** Returns true if the env var is defined and has a non-blank value. */
    private static boolean isSet(Function<String, String> envLookup, String envVar) {
        String value = envLookup.apply(envVar);
        return value != null && !value.isBlank();
    }

    private static void envString(Function<String, String> envLookup, String envVar, Consumer<String> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(envLookup.apply(envVar).trim());
        }
    }

    private static void envInt(Function<String, String> envLookup, String envVar, Consumer<Integer> setter) {
        if (!isSet(envLookup, envVar)) {
            return;
        }
        String raw = envLookup.apply(envVar).trim();
        int value;
        try {
            value = Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new EnvOverlayException(envVar + " must be an integer, got '" + raw + "'", e);
        }
        if (value < 1) {
            throw new EnvOverlayException(envVar + " must be at least 1, got " + value);
        }
        setter.accept(value);
    }

    private static void envBool(Function<String, String> envLookup, String envVar, Consumer<Boolean> setter) {
        if (isSet(envLookup, envVar)) {
            setter.accept(Boolean.parseBoolean(envLookup.apply(envVar).trim()));
        }
    }

    private static RoutingLoggerSettings.Output parseOutput(String value) {
        try {
            return RoutingLoggerSettings.Output.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new EnvOverlayException(LOG_OUTPUT + ": " + e.getMessage(), e);
        }
    }

    private static final class Holder<T> {
        private T value;

        Holder(T value) {
            this.value = value;
        }

        void update(UnaryOperator<T> change) {
            value = change.apply(value);
        }
    }
}
