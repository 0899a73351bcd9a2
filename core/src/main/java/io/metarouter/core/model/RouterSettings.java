package io.metarouter.core.model;

import java.util.Objects;

/**
 * Router-wide settings read from the {@code settings} block of the configuration.
 *
 * @param namespacePrefix    prefix used to register built-in meta-agents ({@code prefix:name})
 * @param maxDelegationDepth depth bound for cycle detection, must be positive
 * @param builtinMetaAgents  whether the bundled default meta-agents are registered
 * @param logger             routing logger settings
 * @param validation         semantic check toggles
 */
public record RouterSettings(
        String namespacePrefix,
        int maxDelegationDepth,
        boolean builtinMetaAgents,
        RoutingLoggerSettings logger,
        ValidationOptions validation) {

    public static final String DEFAULT_NAMESPACE_PREFIX = "router";
    public static final int DEFAULT_MAX_DELEGATION_DEPTH = 3;

    public static final RouterSettings DEFAULT = new RouterSettings(
            DEFAULT_NAMESPACE_PREFIX,
            DEFAULT_MAX_DELEGATION_DEPTH,
            true,
            RoutingLoggerSettings.DEFAULT,
            ValidationOptions.DEFAULT);

    public RouterSettings {
        if (namespacePrefix == null || namespacePrefix.isBlank()) {
            namespacePrefix = DEFAULT_NAMESPACE_PREFIX;
        }
        if (maxDelegationDepth <= 0) {
            throw new IllegalArgumentException("maxDelegationDepth must be positive, got " + maxDelegationDepth);
        }
        Objects.requireNonNull(logger, "logger must not be null");
        Objects.requireNonNull(validation, "validation must not be null");
    }

    public RouterSettings withNamespacePrefix(String prefix) {
        return new RouterSettings(prefix, maxDelegationDepth, builtinMetaAgents, logger, validation);
    }

    public RouterSettings withMaxDelegationDepth(int depth) {
        return new RouterSettings(namespacePrefix, depth, builtinMetaAgents, logger, validation);
    }

    public RouterSettings withBuiltinMetaAgents(boolean enabled) {
        return new RouterSettings(namespacePrefix, maxDelegationDepth, enabled, logger, validation);
    }

    public RouterSettings withLogger(RoutingLoggerSettings newLogger) {
        return new RouterSettings(namespacePrefix, maxDelegationDepth, builtinMetaAgents, newLogger, validation);
    }

    public RouterSettings withValidation(ValidationOptions options) {
        return new RouterSettings(namespacePrefix, maxDelegationDepth, builtinMetaAgents, logger, options);
    }
}
