package io.metarouter.core.model;

import java.util.List;

/**
 * A resolution outcome together with the per-rule evaluation trace.
 *
 * @param route       the winning route, or null when no rule matched
 * @param evaluations one entry per evaluated rule, in rule order
 */
public record RouteResolution(ResolvedRoute route, List<MatcherEvaluation> evaluations) {

    public RouteResolution {
        evaluations = evaluations == null ? List.of() : List.copyOf(evaluations);
    }

    /** Returns true when a rule matched. */
    public boolean matched() {
        return route != null;
    }
}
