package io.metarouter.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import io.metarouter.core.validation.ValidationError;
import io.metarouter.core.validation.ValidationResult;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Exception hierarchy")
class ExceptionHierarchyTest {

    @Test
    @DisplayName("load exceptions carry source and LOAD phase")
    void loadExceptions() {
        var parse = new ConfigParseException("bad yaml", "triage", "router.yaml");
        var schema = new SchemaValidationException("bad", List.of("a", "b"), "router.yaml");

        assertThat(parse).isInstanceOf(RouterLoadException.class);
        assertThat(parse.phase()).isEqualTo(RouterException.Phase.LOAD);
        assertThat(parse.source()).isEqualTo("router.yaml");
        assertThat(parse.agentName()).isEqualTo("triage");
        assertThat(parse.detail()).isEqualTo("bad yaml");
        assertThat(schema.violations()).containsExactly("a", "b");
        assertThat(schema.phase()).isEqualTo(RouterException.Phase.LOAD);
    }

    @Test
    @DisplayName("validation exception lists every error in its message")
    void validationException() {
        var result = new ValidationResult(
                List.of(
                        new ValidationError.InvalidRegexFlags(
                                List.of("meta-agents", "a", "routing-rules", "0", "matcher", "flags"), "x"),
                        new ValidationError.InvalidReference(List.of("meta-agents", "a", "delegates-to", "0"), "ghost")),
                List.of());

        var exception = new ConfigValidationException(result, "router.yaml");

        assertThat(exception.result()).isSameAs(result);
        assertThat(exception.getMessage())
                .startsWith("Configuration rejected: invalid (2 errors, 0 warnings)")
                .contains("[ERROR] meta-agents.a.routing-rules.0.matcher.flags")
                .contains("[ERROR] meta-agents.a.delegates-to.0");
    }

    @Test
    @DisplayName("evaluation exceptions use EVALUATION phase")
    void evaluationExceptions() {
        var exception = new UnregisteredAgentException("ghost");

        assertThat(exception).isInstanceOf(RouterEvalException.class);
        assertThat(exception.phase()).isEqualTo(RouterException.Phase.EVALUATION);
        assertThat(exception.agentName()).isEqualTo("ghost");
    }
}
