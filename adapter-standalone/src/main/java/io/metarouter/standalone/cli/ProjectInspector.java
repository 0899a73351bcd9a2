package io.metarouter.standalone.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects dependency names declared by a project directory. Reads {@code dependencies} and
 * {@code devDependencies} from {@code package.json}; a missing or unreadable manifest yields
 * no dependencies.
 */
final class ProjectInspector {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectInspector.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    static final String PACKAGE_JSON = "package.json";

    private ProjectInspector() {
        // utility class
    }

    /**
     * Returns the declared dependencies of {@code projectDir} followed by {@code extra}, without
     * duplicates, in first-seen order.
     */
    static List<String> dependencies(Path projectDir, List<String> extra) {
        Set<String> names = new LinkedHashSet<>();
        if (projectDir != null) {
            names.addAll(readPackageJson(projectDir.resolve(PACKAGE_JSON)));
        }
        if (extra != null) {
            names.addAll(extra);
        }
        return new ArrayList<>(names);
    }

    private static List<String> readPackageJson(Path manifest) {
        if (!Files.isRegularFile(manifest)) {
            return List.of();
        }
        JsonNode root;
        try {
            root = JSON_MAPPER.readTree(manifest.toFile());
        } catch (IOException e) {
            LOG.warn("project.manifest_unreadable file={}: {}", manifest, e.getMessage());
            return List.of();
        }
        List<String> names = new ArrayList<>();
        collectKeys(root.path("dependencies"), names);
        collectKeys(root.path("devDependencies"), names);
        LOG.debug("project.manifest_read file={} dependencies={}", manifest, names.size());
        return names;
    }

    private static void collectKeys(JsonNode section, List<String> into) {
        if (!section.isObject()) {
            return;
        }
        Iterator<String> fields = section.fieldNames();
        while (fields.hasNext()) {
            into.add(fields.next());
        }
    }
}
