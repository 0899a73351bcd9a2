package io.metarouter.core.validation;

import java.util.List;

/** Names of the worker agents provided by the host runtime. Always valid delegation targets. */
public final class BuiltinAgents {

    public static final List<String> NAMES = List.of(
            "sisyphus",
            "hephaestus",
            "oracle",
            "librarian",
            "explore",
            "multimodal-looker",
            "metis",
            "momus",
            "atlas",
            "prometheus");

    private BuiltinAgents() {}

    public static boolean isBuiltin(String name) {
        return NAMES.contains(name);
    }
}
