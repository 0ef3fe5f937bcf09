package tech.flowcatalyst.resourcebridge.engine.operations.runaction;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Result of a successful action.
 *
 * @param result textual result of a custom action, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionExecuted(
    boolean success,
    String action,
    @JsonProperty("affected_count") int affectedCount,
    String message,
    String result
) {}
