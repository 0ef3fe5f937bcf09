package tech.flowcatalyst.resourcebridge.engine.operations.updaterecord;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Result of a successful update.
 *
 * @param success always true
 * @param object  the record as serialized after the update
 * @param inlines child outcomes, or null when no child was touched
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RecordUpdated(
    boolean success,
    Map<String, Object> object,
    InlineResults inlines
) {}
