package io.fieldcheck.standalone.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.fieldcheck.core.engine.BuiltinValidators;
import io.fieldcheck.core.spi.Validator;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads a {@link RuleSet} from a YAML file:
 *
 * <pre>{@code
 * id: customer
 * rules:
 *   name: "nonzero,max=40"
 *   email: "regexp=^[^@]+@[^@]+$"
 *   address.zip: "len=5"
 * }</pre>
 *
 * <p>
 * {@code id} is optional and defaults to the file name without its
 * extension. Every rule expression is parsed at load time, so a rule set that
 * loads has no syntax errors left.
 */
public final class RuleSetLoader {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSetLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final Map<String, Validator> registry;

    /** A loader resolving rule names against the built-in catalog. */
    public RuleSetLoader() {
        this(BuiltinValidators.asMap());
    }

    /** A loader resolving rule names against {@code registry}. */
    public RuleSetLoader(Map<String, Validator> registry) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
    }

    /**
     * Loads and parses a rule-set file.
     *
     * @param path the YAML file
     * @return the rule set
     * @throws RuleSetLoadException if the file is missing or unreadable, is not
     *                              valid YAML, lacks a {@code rules} mapping, or
     *                              holds a malformed rule expression
     */
    public RuleSet load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new RuleSetLoadException("Rule set file not found: " + path, path, null);
        }

        JsonNode root;
        try (InputStream in = Files.newInputStream(path)) {
            root = YAML_MAPPER.readTree(in);
        } catch (IOException e) {
            throw new RuleSetLoadException("Failed to parse rule set YAML: " + path, path, null, e);
        }

        if (root == null || !root.isObject()) {
            throw new RuleSetLoadException("Rule set root must be a mapping: " + path, path, null);
        }
        JsonNode rules = root.get("rules");
        if (rules == null || !rules.isObject()) {
            throw new RuleSetLoadException("Rule set has no 'rules' mapping: " + path, path, null);
        }

        String id = root.hasNonNull("id") ? root.get("id").asText() : defaultId(path);
        Map<String, RuleChain> fields = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = rules.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String field = entry.getKey();
            JsonNode expression = entry.getValue();
            if (!expression.isTextual()) {
                throw new RuleSetLoadException(
                        "Rule expression for field '" + field + "' must be a string: " + path, path, field);
            }
            try {
                fields.put(field, RuleChain.parse(expression.textValue(), registry));
            } catch (RuleSyntaxException e) {
                throw new RuleSetLoadException(
                        "Invalid rules for field '" + field + "' in " + path + ": " + e.getMessage(), path, field, e);
            }
        }

        LOG.info("Loaded rule set '{}' with {} field(s) from {}", id, fields.size(), path);
        return new RuleSet(id, fields);
    }

    private static String defaultId(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
