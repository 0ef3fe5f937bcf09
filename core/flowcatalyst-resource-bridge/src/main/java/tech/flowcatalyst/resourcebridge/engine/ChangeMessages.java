package tech.flowcatalyst.resourcebridge.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Change messages written to audit entries.
 */
public final class ChangeMessages {

    private static final Logger LOG = Logger.getLogger(ChangeMessages.class);

    public static final String DELETED = "Deleted via MCP";
    public static final String BULK_CREATED = "Bulk created via MCP";
    public static final String BULK_DELETED = "Bulk deleted via MCP";
    public static final String UPDATED = "Updated via MCP";

    static final String TRUNCATION_MARKER = "... (truncated)";

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private ChangeMessages() {
    }

    public static String created(Map<String, Object> data) {
        return "Created via MCP: " + toJson(data);
    }

    /**
     * "Changed via MCP: {...}" and "Updated inlines: [...]" joined by " | ",
     * or "Updated via MCP" when there is neither.
     */
    public static String changed(Map<String, Object> data, Collection<String> inlineNames) {
        List<String> parts = new ArrayList<>();
        if (data != null && !data.isEmpty()) {
            parts.add("Changed via MCP: " + toJson(data));
        }
        if (inlineNames != null && !inlineNames.isEmpty()) {
            parts.add("Updated inlines: " + new ArrayList<>(inlineNames));
        }
        return parts.isEmpty() ? UPDATED : String.join(" | ", parts);
    }

    public static String bulkUpdated(Map<String, Object> data, int maxLength) {
        String json = toJson(data);
        if (json.length() > maxLength) {
            json = json.substring(0, maxLength) + TRUNCATION_MARKER;
        }
        return "Bulk updated via MCP: " + json;
    }

    static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            LOG.debugf("Falling back to toString for change message: %s", e.getMessage());
            return String.valueOf(value);
        }
    }
}
