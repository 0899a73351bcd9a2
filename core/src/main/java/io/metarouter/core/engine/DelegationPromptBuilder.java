package io.metarouter.core.engine;

import io.metarouter.core.model.ConfigOverrides;
import java.util.Objects;

/**
 * Builds the instruction handed to the host when a meta-agent delegates. The user's prompt is
 * embedded verbatim.
 */
public final class DelegationPromptBuilder {

    private DelegationPromptBuilder() {}

    /**
     * @param metaAgent   the originating meta-agent
     * @param targetAgent the chosen delegate
     * @param prompt      the user's prompt, verbatim
     * @param overrides   the winning rule's overrides, or null; a non-blank
     *                    {@code overrides.prompt} is appended as delegate instructions
     * @return the delegation instruction
     */
    public static String build(String metaAgent, String targetAgent, String prompt, ConfigOverrides overrides) {
        Objects.requireNonNull(metaAgent, "metaAgent must not be null");
        Objects.requireNonNull(targetAgent, "targetAgent must not be null");
        Objects.requireNonNull(prompt, "prompt must not be null");

        StringBuilder sb = new StringBuilder();
        sb.append("You are ")
                .append(metaAgent)
                .append(", a meta-agent coordinator.\n\n")
                .append("Your role is to analyze the user's request and delegate it to the appropriate ")
                .append("specialized agent.\n\n")
                .append("Based on the user's request, this task should be handled by the \"")
                .append(targetAgent)
                .append("\" agent.\n\n")
                .append("**User Request:**\n")
                .append(prompt)
                .append("\n\n")
                .append("**Your Task:**\n")
                .append("1. Understand the user's request above\n")
                .append("2. Use the `task` tool to delegate this work to the \"")
                .append(targetAgent)
                .append("\" agent\n")
                .append("3. Include the full user request in the task delegation\n")
                .append("4. Return the result from the ")
                .append(targetAgent)
                .append(" agent to the user\n\n");
        if (overrides != null && overrides.prompt() != null && !overrides.prompt().isBlank()) {
            sb.append("**Delegate Instructions:**\n").append(overrides.prompt()).append("\n\n");
        }
        sb.append("The task tool accepts:\n")
                .append("- agent: \"")
                .append(targetAgent)
                .append("\"\n")
                .append("- prompt: The user's request (pass it through as-is)\n\n")
                .append("Delegate this task now using the available task tool.");
        return sb.toString();
    }
}
