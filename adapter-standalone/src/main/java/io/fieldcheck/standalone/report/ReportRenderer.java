package io.fieldcheck.standalone.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.fieldcheck.core.error.ValidationError;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link ValidationReport} as an RFC 9457 Problem Details document
 * or as plain text.
 *
 * <p>
 * JSON shape:
 * <pre>{@code
 * {
 * "type": "urn:fieldcheck:report:validation-failed",
 * "title": "Validation Failed",
 * "status": 422,
 * "detail": "1 field(s) failed validation",
 * "ruleSet": "customer",
 * "errors": {
 *   "name": [ { "code": "zero-value-empty", "type": "urn:fieldcheck:error:zero-value-empty",
 *               "category": "VALUE", "message": "empty value" } ]
 * }
 * }
 * }</pre>
 *
 * <p>
 * Thread-safe: all methods are stateless.
 */
public final class ReportRenderer {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String URN_VALID = "urn:fieldcheck:report:valid";
    static final String URN_VALIDATION_FAILED = "urn:fieldcheck:report:validation-failed";

    private ReportRenderer() {
        // utility class
    }

    /**
     * Builds the problem document for {@code report}.
     *
     * @param report the validation report
     * @return a fresh {@link ObjectNode}
     */
    public static ObjectNode toJson(ValidationReport report) {
        ObjectNode node = report.isValid()
                ? build(URN_VALID, "Validation Passed", 200, "All fields passed validation")
                : build(
                        URN_VALIDATION_FAILED,
                        "Validation Failed",
                        422,
                        report.failedFieldCount() + " field(s) failed validation");
        node.put("ruleSet", report.ruleSetId());

        ObjectNode errors = node.putObject("errors");
        for (Map.Entry<String, List<ValidationError>> entry : report.failures().entrySet()) {
            ArrayNode fieldErrors = errors.putArray(entry.getKey());
            for (ValidationError error : entry.getValue()) {
                ObjectNode item = fieldErrors.addObject();
                item.put("code", error.code());
                item.put("type", error.urn());
                item.put("category", error.category().name());
                item.put("message", error.message());
            }
        }
        return node;
    }

    /** The problem document serialized with indentation. */
    public static String toJsonString(ValidationReport report) {
        return toJson(report).toPrettyString();
    }

    /**
     * One {@code field: message} line per error, or a single summary line when
     * the report is valid.
     */
    public static String toText(ValidationReport report) {
        if (report.isValid()) {
            return "rule set '" + report.ruleSetId() + "': all fields passed validation" + System.lineSeparator();
        }
        StringBuilder out = new StringBuilder();
        for (Map.Entry<String, List<ValidationError>> entry : report.failures().entrySet()) {
            for (ValidationError error : entry.getValue()) {
                out.append(entry.getKey()).append(": ").append(error.message()).append(System.lineSeparator());
            }
        }
        return out.toString();
    }

    static ObjectNode build(String type, String title, int status, String detail) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", type);
        node.put("title", title);
        node.put("status", status);
        node.put("detail", detail);
        return node;
    }
}
