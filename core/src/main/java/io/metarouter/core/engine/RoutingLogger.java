package io.metarouter.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.metarouter.core.model.ConfigOverrides;
import io.metarouter.core.model.MatcherEvaluation;
import io.metarouter.core.model.RoutingLoggerSettings;
import io.metarouter.core.spi.RoutingDecision;
import io.metarouter.core.spi.RoutingDecisionListener;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link RoutingDecisionListener} that records every routing decision as one JSON object.
 *
 * <p>
 * With {@link RoutingLoggerSettings.Output#CONSOLE} entries go to SLF4J at INFO as
 * {@code routing.decision {json}}; with {@link RoutingLoggerSettings.Output#FILE} they are
 * appended as JSON lines to the configured file, creating parent directories on demand. I/O
 * failures are logged at WARN and never reach the caller.
 */
public final class RoutingLogger implements RoutingDecisionListener {

    private static final Logger LOG = LoggerFactory.getLogger(RoutingLogger.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private final RoutingLoggerSettings settings;
    private final Clock clock;

    public RoutingLogger(RoutingLoggerSettings settings) {
        this(settings, Clock.systemUTC());
    }

    public RoutingLogger(RoutingLoggerSettings settings, Clock clock) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean isEnabled() {
        return settings.enabled() && settings.output() != RoutingLoggerSettings.Output.DISABLED;
    }

    @Override
    public boolean isDebugMode() {
        return settings.debugMode();
    }

    @Override
    public void onRouteResolved(RoutingDecision decision) {
        if (!isEnabled()) {
            return;
        }
        String entry;
        try {
            entry = formatEntry(decision);
        } catch (JsonProcessingException e) {
            LOG.warn("routing.log_format_failed agent={}", decision.metaAgent(), e);
            return;
        }
        if (settings.output() == RoutingLoggerSettings.Output.FILE) {
            appendToFile(entry);
        } else {
            LOG.info("routing.decision {}", entry);
        }
    }

    /** Serializes a decision to its single-line JSON form. */
    String formatEntry(RoutingDecision decision) throws JsonProcessingException {
        ObjectNode entry = JSON.createObjectNode();
        entry.put("timestamp", clock.instant().toString());
        entry.put("meta_agent", decision.metaAgent());
        entry.put("target_agent", decision.targetAgent());
        entry.put("matcher_type", decision.matcherKind());
        entry.put("matched_content", decision.matchedContent());
        ConfigOverrides overrides = decision.overrides();
        if (overrides != null && !overrides.isEmpty()) {
            ObjectNode node = entry.putObject("config_overrides");
            if (overrides.model() != null) node.put("model", overrides.model());
            if (overrides.temperature() != null) node.put("temperature", overrides.temperature());
            if (overrides.prompt() != null) node.put("prompt", overrides.prompt());
            if (overrides.variant() != null) node.put("variant", overrides.variant());
        }
        if (settings.debugMode()) {
            ObjectNode debug = entry.putObject("debug_info");
            ArrayNode all = debug.putArray("all_evaluated");
            for (MatcherEvaluation evaluation : decision.evaluations()) {
                all.addObject().put("matcher_type", evaluation.matcherKind()).put("matched", evaluation.matched());
            }
            debug.put("total_evaluated", decision.evaluations().size());
        }
        return JSON.writeValueAsString(entry);
    }

    private void appendToFile(String entry) {
        Path file = Path.of(settings.logFile());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(
                    file,
                    entry + System.lineSeparator(),
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND);
        } catch (IOException | RuntimeException e) {
            LOG.warn("routing.log_write_failed file={}", file, e);
        }
    }
}
