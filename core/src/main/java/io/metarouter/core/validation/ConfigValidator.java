package io.metarouter.core.validation;

import io.metarouter.core.engine.DelegationGraph;
import io.metarouter.core.engine.RegexFlags;
import io.metarouter.core.model.Matcher;
import io.metarouter.core.model.MetaAgentDefinition;
import io.metarouter.core.model.RouterConfig;
import io.metarouter.core.model.RoutingRule;
import io.metarouter.core.model.ValidationOptions;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Load-time semantic checks over a set of meta-agent definitions.
 *
 * <p>
 * Checks are independent and each can be switched off through {@link ValidationOptions}:
 * <ul>
 * <li>circular delegation within the depth bound (error)</li>
 * <li>references to unknown agents (error)</li>
 * <li>illegal regex flags (error)</li>
 * <li>regex patterns matching a slow-pattern heuristic (warning)</li>
 * <li>meta-agents without routing rules (warning)</li>
 * </ul>
 * Every finding is reported; nothing stops at the first error. The result depends only on
 * the input, so validating twice yields equal results.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class ConfigValidator {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigValidator.class);

    private ConfigValidator() {}

    /** Validates a configuration using its own depth bound and options. */
    public static ValidationResult validate(RouterConfig config) {
        return validate(
                config.metaAgents(),
                config.settings().maxDelegationDepth(),
                config.settings().validation());
    }

    /**
     * Validates meta-agent definitions.
     *
     * @param metaAgents definitions by name, in declaration order
     * @param maxDepth   depth bound for the cycle search
     * @param options    which checks to run
     */
    public static ValidationResult validate(
            Map<String, MetaAgentDefinition> metaAgents, int maxDepth, ValidationOptions options) {
        List<ValidationError> errors = new ArrayList<>();
        List<ValidationWarning> warnings = new ArrayList<>();

        if (options.circularDependencies()) {
            errors.addAll(checkCircularDependencies(metaAgents, maxDepth));
        }
        if (options.agentReferences()) {
            errors.addAll(checkAgentReferences(metaAgents));
        }
        if (options.regexFlags()) {
            errors.addAll(checkRegexFlags(metaAgents));
        }
        if (options.regexPerformance()) {
            warnings.addAll(checkRegexPerformance(metaAgents));
        }
        if (options.emptyRoutingRules()) {
            metaAgents.forEach((name, definition) -> {
                if (definition.routingRules().isEmpty()) {
                    warnings.add(new ValidationWarning.EmptyRoutingRules(agentPath(name, "routing-rules")));
                }
            });
        }

        ValidationResult result = new ValidationResult(errors, warnings);
        LOG.debug(
                "validation.completed agents={} errors={} warnings={}",
                metaAgents.size(),
                errors.size(),
                warnings.size());
        return result;
    }

    static List<ValidationError> checkCircularDependencies(Map<String, MetaAgentDefinition> metaAgents, int maxDepth) {
        DelegationGraph graph = DelegationGraph.fromConfig(metaAgents);
        List<ValidationError> errors = new ArrayList<>();
        metaAgents.forEach((name, definition) -> {
            Set<String> targets = new LinkedHashSet<>(definition.delegatesTo());
            for (RoutingRule rule : definition.routingRules()) {
                targets.add(rule.targetAgent());
            }
            for (String target : targets) {
                Optional<List<String>> back = graph.findCircularPath(target, name, maxDepth);
                if (back.isPresent()) {
                    List<String> cycle = new ArrayList<>();
                    cycle.add(name);
                    cycle.addAll(back.get());
                    Set<String> involved = new LinkedHashSet<>(List.of(name, target));
                    errors.add(new ValidationError.CircularDependency(agentPath(name), cycle, involved));
                }
            }
        });
        return errors;
    }

    static List<ValidationError> checkAgentReferences(Map<String, MetaAgentDefinition> metaAgents) {
        List<ValidationError> errors = new ArrayList<>();
        metaAgents.forEach((name, definition) -> {
            List<String> delegates = definition.delegatesTo();
            for (int i = 0; i < delegates.size(); i++) {
                if (!isKnownAgent(delegates.get(i), metaAgents)) {
                    errors.add(new ValidationError.InvalidReference(
                            agentPath(name, "delegates-to", String.valueOf(i)), delegates.get(i)));
                }
            }
            List<RoutingRule> rules = definition.routingRules();
            for (int i = 0; i < rules.size(); i++) {
                String target = rules.get(i).targetAgent();
                if (!isKnownAgent(target, metaAgents)) {
                    errors.add(new ValidationError.InvalidReference(rulePath(name, i, "target-agent"), target));
                }
            }
        });
        return errors;
    }

    static List<ValidationError> checkRegexFlags(Map<String, MetaAgentDefinition> metaAgents) {
        List<ValidationError> errors = new ArrayList<>();
        metaAgents.forEach((name, definition) -> {
            List<RoutingRule> rules = definition.routingRules();
            for (int i = 0; i < rules.size(); i++) {
                if (rules.get(i).matcher() instanceof Matcher.Regex regex
                        && regex.flags() != null
                        && !RegexFlags.isValid(regex.flags())) {
                    errors.add(new ValidationError.InvalidRegexFlags(rulePath(name, i, "matcher", "flags"), regex.flags()));
                }
            }
        });
        return errors;
    }

    static List<ValidationWarning> checkRegexPerformance(Map<String, MetaAgentDefinition> metaAgents) {
        List<ValidationWarning> warnings = new ArrayList<>();
        metaAgents.forEach((name, definition) -> {
            List<RoutingRule> rules = definition.routingRules();
            for (int i = 0; i < rules.size(); i++) {
                if (rules.get(i).matcher() instanceof Matcher.Regex regex) {
                    List<String> path = rulePath(name, i, "matcher", "pattern");
                    RegexPatternAnalyzer.analyze(regex.pattern())
                            .ifPresent(reason -> warnings.add(
                                    new ValidationWarning.RegexPerformance(path, regex.pattern(), reason)));
                }
            }
        });
        return warnings;
    }

    private static boolean isKnownAgent(String name, Map<String, MetaAgentDefinition> metaAgents) {
        return BuiltinAgents.isBuiltin(name) || metaAgents.containsKey(name);
    }

    /** {@code meta-agents, <name>, <rest...>}; the name stays one segment even if it contains dots. */
    private static List<String> agentPath(String name, String... rest) {
        List<String> path = new ArrayList<>(2 + rest.length);
        path.add("meta-agents");
        path.add(name);
        path.addAll(List.of(rest));
        return path;
    }

    private static List<String> rulePath(String name, int index, String... rest) {
        List<String> path = agentPath(name, "routing-rules", String.valueOf(index));
        path.addAll(List.of(rest));
        return path;
    }
}
