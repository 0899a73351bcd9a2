package io.metarouter.core.engine;

import io.metarouter.core.error.ConfigValidationException;
import io.metarouter.core.error.UnregisteredAgentException;
import io.metarouter.core.model.AgentConfig;
import io.metarouter.core.model.ConfigOverrides;
import io.metarouter.core.model.MetaAgentDefinition;
import io.metarouter.core.model.ResolvedRoute;
import io.metarouter.core.model.RouteResolution;
import io.metarouter.core.model.RouterConfig;
import io.metarouter.core.model.RoutingContext;
import io.metarouter.core.model.RoutingLoggerSettings;
import io.metarouter.core.spec.BuiltinMetaAgents;
import io.metarouter.core.spec.ConfigParser;
import io.metarouter.core.spi.ProjectFileProbe;
import io.metarouter.core.spi.RoutingDecisionListener;
import io.metarouter.core.spi.RoutingEventSink;
import io.metarouter.core.validation.ConfigValidator;
import io.metarouter.core.validation.ValidationResult;
import io.metarouter.core.validation.ValidationWarning;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for hosts: loads router configuration and resolves meta-agents to agent
 * configurations.
 *
 * <p>
 * A configuration is published only if it passes semantic validation. {@link #load} merges the
 * bundled meta-agents, validates, and throws {@link ConfigValidationException} carrying every
 * error when the result is invalid; the previously published registry then stays in place.
 * Warnings are logged and do not block publication.
 *
 * <p>
 * Thread-safe: uses {@link AtomicReference} to hold an immutable {@link RouterRegistry}
 * snapshot. Each resolution reads the reference once, so a concurrent {@link #load} never
 * exposes a half-built registry.
 */
public final class RoutingEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RoutingEngine.class);
    private static final int PROMPT_PREVIEW_LENGTH = 80;

    private final ConfigParser parser;
    private final MatcherEvaluator evaluator;
    private final Function<RoutingLoggerSettings, RoutingDecisionListener> listenerFactory;
    private final List<RoutingEventSink> eventSinks;
    private final AtomicReference<RouterRegistry> registryRef = new AtomicReference<>(RouterRegistry.empty());

    /**
     * Creates an engine probing the real file system, logging decisions through a
     * {@link RoutingLogger} configured from the loaded settings, with no event sinks.
     */
    public RoutingEngine(ConfigParser parser) {
        this(parser, ProjectFileProbe.fileSystem(), RoutingLogger::new, List.of());
    }

    /**
     * Creates an engine with all collaborators.
     *
     * @param parser          parser used by {@link #load(Path)} and for the bundled meta-agents
     * @param fileProbe       file-existence probe for project-context matchers
     * @param listenerFactory builds the decision listener from the loaded logger settings
     * @param eventSinks      analytics sinks, may be empty
     */
    public RoutingEngine(
            ConfigParser parser,
            ProjectFileProbe fileProbe,
            Function<RoutingLoggerSettings, RoutingDecisionListener> listenerFactory,
            List<RoutingEventSink> eventSinks) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.evaluator = new MatcherEvaluator(Objects.requireNonNull(fileProbe, "fileProbe must not be null"));
        this.listenerFactory = Objects.requireNonNull(listenerFactory, "listenerFactory must not be null");
        this.eventSinks = List.copyOf(eventSinks);
    }

    /**
     * Parses, validates and publishes the configuration file at {@code path}.
     *
     * @return the validation result (valid, possibly with warnings)
     * @throws io.metarouter.core.error.ConfigParseException      if the file cannot be parsed
     * @throws io.metarouter.core.error.SchemaValidationException if the file violates the schema
     * @throws ConfigValidationException                          if semantic validation fails
     */
    public ValidationResult load(Path path) {
        RouterConfig config = parser.parse(path);
        return publish(config, path.toString());
    }

    /** Validates and publishes an already parsed configuration. */
    public ValidationResult load(RouterConfig config) {
        return publish(config, null);
    }

    /**
     * Replaces the published configuration with the one at {@code path}. In-flight resolutions
     * complete with the registry they started with.
     */
    public ValidationResult reload(Path path) {
        ValidationResult result = load(path);
        LOG.info("Registry reloaded from {}: metaAgents={}", path, registryRef.get().size());
        return result;
    }

    /**
     * Adds or replaces one meta-agent. The candidate registry is validated as a whole; on
     * errors nothing changes.
     *
     * @throws ConfigValidationException if the registry with this definition is invalid
     */
    public void register(String name, MetaAgentDefinition definition) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(definition, "definition must not be null");
        while (true) {
            RouterRegistry current = registryRef.get();
            RouterRegistry candidate = current.with(name, definition);
            ValidationResult result = validateOrThrow(
                    new RouterConfig(candidate.allMetaAgents(), candidate.settings()), "register:" + name);
            if (registryRef.compareAndSet(current, candidate)) {
                logWarnings(result);
                LOG.info("meta_agent.registered name={} rules={}", name, definition.routingRules().size());
                return;
            }
        }
    }

    /**
     * Resolves a meta-agent and returns the configuration the host should run.
     *
     * @return the agent configuration, or null when no rule matched
     * @throws UnregisteredAgentException if {@code name} is not registered
     */
    public AgentConfig resolve(String name, RoutingContext context) {
        RouterRegistry snapshot = registryRef.get();
        MetaAgentDefinition definition = lookup(snapshot, name);
        ResolvedRoute route = resolver(snapshot).resolve(name, definition.routingRules(), context);
        emit(name, definition, route, context);
        if (route == null) {
            return null;
        }
        return toAgentConfig(name, definition, route, context);
    }

    /**
     * Resolves a meta-agent and returns the route with its full evaluation trace.
     *
     * @throws UnregisteredAgentException if {@code name} is not registered
     */
    public RouteResolution resolveRoute(String name, RoutingContext context) {
        RouterRegistry snapshot = registryRef.get();
        MetaAgentDefinition definition = lookup(snapshot, name);
        RouteResolution resolution = resolver(snapshot).resolveWithTrace(name, definition.routingRules(), context);
        emit(name, definition, resolution.route(), context);
        return resolution;
    }

    /**
     * Builds the agent configuration for a resolved route: the override model if set, else the
     * base model; the override temperature if set, else the definition's.
     */
    public static AgentConfig toAgentConfig(
            String name, MetaAgentDefinition definition, ResolvedRoute route, RoutingContext context) {
        ConfigOverrides overrides = route.overrides();
        String model = definition.baseModel();
        Double temperature = definition.temperature();
        String variant = null;
        if (overrides != null) {
            if (overrides.model() != null && !overrides.model().isBlank()) {
                model = overrides.model();
            }
            if (overrides.temperature() != null) {
                temperature = overrides.temperature();
            }
            variant = overrides.variant();
        }
        String prompt = DelegationPromptBuilder.build(name, route.targetAgent(), context.prompt(), overrides);
        return new AgentConfig(model, prompt, temperature, variant, route);
    }

    /** All registered definitions, in registration order. */
    public Map<String, MetaAgentDefinition> definitions() {
        return registryRef.get().allMetaAgents();
    }

    /** The currently published registry snapshot. */
    public RouterRegistry registry() {
        return registryRef.get();
    }

    // --- internals ---

    private ValidationResult publish(RouterConfig config, String source) {
        RouterConfig merged = BuiltinMetaAgents.merge(config, parser);
        ValidationResult result = validateOrThrow(merged, source);
        logWarnings(result);
        RouterRegistry registry = RouterRegistry.builder()
                .addAll(merged.metaAgents())
                .settings(merged.settings())
                .build();
        registryRef.set(registry);
        LOG.info(
                "Registry loaded: metaAgents={}, maxDelegationDepth={}, source={}",
                registry.size(),
                registry.settings().maxDelegationDepth(),
                source);
        return result;
    }

    private static ValidationResult validateOrThrow(RouterConfig config, String source) {
        ValidationResult result = ConfigValidator.validate(config);
        if (!result.valid()) {
            LOG.error("Configuration rejected: {} source={}", result.summary(), source);
            for (String line : result.formatErrors()) {
                LOG.error(line);
            }
            throw new ConfigValidationException(result, source);
        }
        return result;
    }

    private static void logWarnings(ValidationResult result) {
        for (ValidationWarning warning : result.warnings()) {
            LOG.warn("validation.warning type={} path={}: {}", warning.type(), warning.dottedPath(), warning.message());
        }
    }

    private static MetaAgentDefinition lookup(RouterRegistry snapshot, String name) {
        MetaAgentDefinition definition = snapshot.get(name);
        if (definition == null) {
            throw new UnregisteredAgentException(name);
        }
        return definition;
    }

    private RoutingResolver resolver(RouterRegistry snapshot) {
        return new RoutingResolver(evaluator, listenerFactory.apply(snapshot.settings().logger()));
    }

    private void emit(String name, MetaAgentDefinition definition, ResolvedRoute route, RoutingContext context) {
        long now = System.currentTimeMillis();
        for (RoutingEventSink sink : eventSinks) {
            try {
                if (route != null) {
                    sink.onRoutingDecision(new RoutingEventSink.RoutingDecisionEvent(
                            name, route.targetAgent(), route.matcherKind(), route.matchedContent(), now));
                } else {
                    sink.onUnmatchedRequest(new RoutingEventSink.UnmatchedRequestEvent(
                            name, preview(context.prompt()), definition.routingRules().size(), now));
                }
            } catch (Exception e) {
                LOG.warn("RoutingEventSink failed for agent={}", name, e);
            }
        }
    }

    private static String preview(String prompt) {
        return prompt.length() <= PROMPT_PREVIEW_LENGTH ? prompt : prompt.substring(0, PROMPT_PREVIEW_LENGTH) + "...";
    }
}
