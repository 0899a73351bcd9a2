package io.metarouter.core.engine;

import io.metarouter.core.model.MetaAgentDefinition;
import io.metarouter.core.model.RouterSettings;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of the registered meta-agents and the settings they were loaded with.
 *
 * <p>
 * This is the unit of atomic swap in {@link RoutingEngine}. The engine holds a
 * {@code RouterRegistry} reference via {@link java.util.concurrent.atomic.AtomicReference};
 * {@code load()} builds a new registry and swaps it in. Resolutions that captured the old
 * reference finish with it; new resolutions pick up the new one.
 *
 * <p>
 * Thread-safe: all fields are final and the map is unmodifiable.
 */
public final class RouterRegistry {

    private final Map<String, MetaAgentDefinition> metaAgents;
    private final RouterSettings settings;

    /**
     * Creates a registry. The map is defensively copied and keeps its iteration order.
     *
     * @param metaAgents definitions by registered name
     * @param settings   the settings in effect
     */
    public RouterRegistry(Map<String, MetaAgentDefinition> metaAgents, RouterSettings settings) {
        this.metaAgents = Collections.unmodifiableMap(new LinkedHashMap<>(metaAgents));
        this.settings = settings == null ? RouterSettings.DEFAULT : settings;
    }

    /** An empty registry with default settings. */
    public static RouterRegistry empty() {
        return new RouterRegistry(Map.of(), RouterSettings.DEFAULT);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Looks up a meta-agent by registered name.
     *
     * @return the definition, or null if not registered
     */
    public MetaAgentDefinition get(String name) {
        return metaAgents.get(name);
    }

    /** Unmodifiable view of all registered definitions, in registration order. */
    public Map<String, MetaAgentDefinition> allMetaAgents() {
        return metaAgents;
    }

    public int size() {
        return metaAgents.size();
    }

    public RouterSettings settings() {
        return settings;
    }

    /** Returns a copy of this registry with {@code name} added or replaced. */
    public RouterRegistry with(String name, MetaAgentDefinition definition) {
        Map<String, MetaAgentDefinition> updated = new LinkedHashMap<>(metaAgents);
        updated.put(name, definition);
        return new RouterRegistry(updated, settings);
    }

    /** Builder for constructing a {@link RouterRegistry} incrementally. */
    public static final class Builder {

        private final Map<String, MetaAgentDefinition> metaAgents = new LinkedHashMap<>();
        private RouterSettings settings = RouterSettings.DEFAULT;

        Builder() {}

        public Builder addAll(Map<String, MetaAgentDefinition> definitions) {
            metaAgents.putAll(definitions);
            return this;
        }

        public Builder settings(RouterSettings settings) {
            this.settings = settings;
            return this;
        }

        public RouterRegistry build() {
            return new RouterRegistry(metaAgents, settings);
        }
    }
}
