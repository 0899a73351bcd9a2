package io.metarouter.core.model;

/**
 * Per-rule overrides applied to the delegated agent configuration when the rule wins. Every
 * field is optional (null when unset).
 *
 * @param model       model identifier replacing the meta-agent's base model
 * @param temperature sampling temperature replacing the meta-agent's temperature
 * @param prompt      extra instructions passed to the delegate
 * @param variant     model variant hint
 */
public record ConfigOverrides(String model, Double temperature, String prompt, String variant) {

    /** Returns true when no field is set. */
    public boolean isEmpty() {
        return model == null && temperature == null && prompt == null && variant == null;
    }
}
