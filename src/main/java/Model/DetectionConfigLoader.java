package Model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * Reads the {@code duplicate_detection} section of a YAML settings file.
 * Keys that are absent keep their value from {@link DetectionConfig#defaults()}.
 */
public final class DetectionConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(DetectionConfigLoader.class);

    static final String SECTION = "duplicate_detection";

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public DetectionConfig load(Path settingsFile) throws IOException {
        try (InputStream in = Files.newInputStream(settingsFile)) {
            DetectionConfig config = load(in);
            log.info("Loaded duplicate detection settings from {}: {}", settingsFile, config);
            return config;
        }
    }

    public DetectionConfig load(InputStream in) throws IOException {
        JsonNode root = mapper.readTree(in);
        ObjectNode merged = mapper.valueToTree(DetectionConfig.defaults());

        JsonNode section = root == null ? null : root.get(SECTION);
        if (section == null || section.isNull()) {
            log.warn("No '{}' section in settings, using defaults", SECTION);
            return DetectionConfig.defaults();
        }
        if (!section.isObject()) {
            throw new IOException("'" + SECTION + "' must be a mapping");
        }

        merge(merged, (ObjectNode) section);
        try {
            return mapper.treeToValue(merged, DetectionConfig.class);
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid '" + SECTION + "' settings: " + e.getMessage(), e);
        }
    }

    private static void merge(ObjectNode target, ObjectNode overrides) {
        Iterator<Map.Entry<String, JsonNode>> it = overrides.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            JsonNode current = target.get(e.getKey());
            if (current instanceof ObjectNode && e.getValue() instanceof ObjectNode) {
                merge((ObjectNode) current, (ObjectNode) e.getValue());
            } else {
                target.set(e.getKey(), e.getValue());
            }
        }
    }
}
