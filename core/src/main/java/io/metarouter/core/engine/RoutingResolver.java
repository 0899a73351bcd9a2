package io.metarouter.core.engine;

import io.metarouter.core.model.MatcherEvaluation;
import io.metarouter.core.model.ResolvedRoute;
import io.metarouter.core.model.RouteResolution;
import io.metarouter.core.model.RoutingContext;
import io.metarouter.core.model.RoutingRule;
import io.metarouter.core.spi.RoutingDecision;
import io.metarouter.core.spi.RoutingDecisionListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the delegate for a meta-agent by evaluating its rules in declared order. The first
 * rule whose matcher is satisfied wins; later rules never override it.
 *
 * <p>
 * When a trace is captured (explicitly via {@link #resolveWithTrace}, or because the decision
 * listener is in debug mode) every rule is evaluated so the trace is complete, but the winner
 * is still the first match.
 *
 * <p>
 * Thread-safe if the listener is.
 */
public final class RoutingResolver {

    private static final Logger LOG = LoggerFactory.getLogger(RoutingResolver.class);

    private final MatcherEvaluator evaluator;
    private final RoutingDecisionListener listener;

    /** Creates a resolver without a decision listener. */
    public RoutingResolver(MatcherEvaluator evaluator) {
        this(evaluator, null);
    }

    /**
     * @param evaluator the matcher evaluator
     * @param listener  optional decision listener, may be null
     */
    public RoutingResolver(MatcherEvaluator evaluator, RoutingDecisionListener listener) {
        this.evaluator = Objects.requireNonNull(evaluator, "evaluator must not be null");
        this.listener = listener; // nullable
    }

    /**
     * Resolves the route for a meta-agent.
     *
     * @param agentName name of the meta-agent (for diagnostics)
     * @param rules     the rules in priority order
     * @param context   the request context
     * @return the winning route, or null when no rule matched
     */
    public ResolvedRoute resolve(String agentName, List<RoutingRule> rules, RoutingContext context) {
        return resolve(agentName, rules, context, listenerWantsTrace()).route();
    }

    /**
     * Resolves the route and returns the full per-rule evaluation trace.
     *
     * @param agentName name of the meta-agent (for diagnostics)
     * @param rules     the rules in priority order
     * @param context   the request context
     * @return the resolution, whose route is null when no rule matched
     */
    public RouteResolution resolveWithTrace(String agentName, List<RoutingRule> rules, RoutingContext context) {
        return resolve(agentName, rules, context, true);
    }

    private RouteResolution resolve(
            String agentName, List<RoutingRule> rules, RoutingContext context, boolean trace) {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(context, "context must not be null");

        List<MatcherEvaluation> evaluations = new ArrayList<>();
        RoutingRule winner = null;
        for (RoutingRule rule : rules) {
            boolean matched = evaluator.evaluate(rule.matcher(), context);
            if (trace) {
                evaluations.add(new MatcherEvaluation(rule.matcher().kind(), rule.matcher(), matched));
            }
            if (matched && winner == null) {
                winner = rule;
                if (!trace) {
                    break;
                }
            }
        }

        if (winner == null) {
            LOG.debug("routing.unmatched agent={} rules={}", agentName, rules.size());
            return new RouteResolution(null, evaluations);
        }

        ResolvedRoute route = new ResolvedRoute(
                winner.targetAgent(),
                winner.matcher().kind(),
                evaluator.describe(winner.matcher(), context),
                winner.overrides());
        LOG.debug(
                "routing.matched agent={} target={} matcher={} content=\"{}\"",
                agentName,
                route.targetAgent(),
                route.matcherKind(),
                route.matchedContent());
        notifyListener(agentName, route, evaluations);
        return new RouteResolution(route, evaluations);
    }

    private boolean listenerWantsTrace() {
        if (listener == null) return false;
        try {
            return listener.isEnabled() && listener.isDebugMode();
        } catch (Exception e) {
            LOG.warn("RoutingDecisionListener.isDebugMode failed", e);
            return false;
        }
    }

    private void notifyListener(String agentName, ResolvedRoute route, List<MatcherEvaluation> evaluations) {
        if (listener == null) return;
        try {
            if (!listener.isEnabled()) return;
            List<MatcherEvaluation> trace = listener.isDebugMode() ? evaluations : List.of();
            listener.onRouteResolved(new RoutingDecision(
                    agentName,
                    route.targetAgent(),
                    route.matcherKind(),
                    route.matchedContent(),
                    route.overrides(),
                    trace));
        } catch (Exception e) {
            LOG.warn("RoutingDecisionListener.onRouteResolved failed", e);
        }
    }
}
