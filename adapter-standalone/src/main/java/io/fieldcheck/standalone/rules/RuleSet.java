package io.fieldcheck.standalone.rules;

import com.fasterxml.jackson.databind.JsonNode;
import io.fieldcheck.core.error.ValidationError;
import io.fieldcheck.core.model.Value;
import io.fieldcheck.core.model.Values;
import io.fieldcheck.standalone.report.ValidationReport;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A named set of field rules applied to a JSON or YAML document.
 *
 * <p>
 * Field paths are dotted: {@code address.zip} looks up {@code address} in the
 * document root, then {@code zip} in that object. A segment that is missing,
 * or whose parent is not an object, resolves to an absent value, so a
 * {@code nonzero} rule on it fails with {@code zero-value}.
 *
 * <p>
 * Immutable and thread-safe.
 */
public final class RuleSet {

    private static final Logger LOG = LoggerFactory.getLogger(RuleSet.class);
    private static final Pattern PATH_SEPARATOR = Pattern.compile("\\.");

    private final String id;
    private final Map<String, RuleChain> fields;

    public RuleSet(String id, Map<String, RuleChain> fields) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String id() {
        return id;
    }

    /** Field path to rule chain, in declaration order. */
    public Map<String, RuleChain> fields() {
        return fields;
    }

    /** Validates {@code document}, collecting every error of every field. */
    public ValidationReport validate(JsonNode document) {
        return validate(document, false);
    }

    /**
     * Validates {@code document} field by field.
     *
     * @param document the parsed document; {@code null} treats every field as absent
     * @param failFast stop each field's chain at its first error
     * @return the report listing failing fields
     */
    public ValidationReport validate(JsonNode document, boolean failFast) {
        ValidationReport.Builder report = ValidationReport.builder(id);
        for (Map.Entry<String, RuleChain> entry : fields.entrySet()) {
            String field = entry.getKey();
            Value value = Values.of(resolve(document, field));
            List<ValidationError> errors = entry.getValue().validate(value, failFast);
            for (ValidationError error : errors) {
                LOG.debug("Field '{}' failed in rule set '{}': {} ({})", field, id, error.message(), error.code());
            }
            report.field(field, errors);
        }
        return report.build();
    }

    /** Returns the node at {@code path}, or {@code null} if any segment is missing. */
    static JsonNode resolve(JsonNode document, String path) {
        JsonNode current = document;
        for (String segment : PATH_SEPARATOR.split(path, -1)) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        return current;
    }

    @Override
    public String toString() {
        return "RuleSet[" + id + ", fields=" + fields.keySet() + "]";
    }
}
