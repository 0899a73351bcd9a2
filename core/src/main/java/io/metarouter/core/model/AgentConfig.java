package io.metarouter.core.model;

import java.util.Objects;

/**
 * Agent configuration handed to the host runtime to execute a delegation.
 *
 * <p>
 * An empty {@code model} means no model was configured for the meta-agent or the winning rule;
 * the host then runs the delegation with its own default model.
 *
 * @param model       model identifier for the delegated call, or empty for the host default
 * @param prompt      the synthesized delegation instruction
 * @param temperature sampling temperature, or null to use the host default
 * @param variant     model variant hint, or null
 * @param route       the route that produced this configuration
 */
public record AgentConfig(String model, String prompt, Double temperature, String variant, ResolvedRoute route) {

    public AgentConfig {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");
        Objects.requireNonNull(route, "route must not be null");
    }

    /** True when the host should pick its default model. */
    public boolean usesHostDefaultModel() {
        return model.isBlank();
    }
}
