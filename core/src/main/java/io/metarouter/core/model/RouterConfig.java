package io.metarouter.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A parsed router configuration: meta-agent definitions in declaration order plus settings.
 *
 * <p>
 * Thread-safe: the map is copied into an unmodifiable insertion-ordered map.
 */
public record RouterConfig(Map<String, MetaAgentDefinition> metaAgents, RouterSettings settings) {

    public RouterConfig {
        Objects.requireNonNull(metaAgents, "metaAgents must not be null");
        metaAgents = Collections.unmodifiableMap(new LinkedHashMap<>(metaAgents));
        settings = settings == null ? RouterSettings.DEFAULT : settings;
    }

    /** A configuration with the given meta-agents and default settings. */
    public static RouterConfig of(Map<String, MetaAgentDefinition> metaAgents) {
        return new RouterConfig(metaAgents, RouterSettings.DEFAULT);
    }

    public RouterConfig withSettings(RouterSettings newSettings) {
        return new RouterConfig(metaAgents, newSettings);
    }

    public RouterConfig withMetaAgents(Map<String, MetaAgentDefinition> newMetaAgents) {
        return new RouterConfig(newMetaAgents, settings);
    }
}
