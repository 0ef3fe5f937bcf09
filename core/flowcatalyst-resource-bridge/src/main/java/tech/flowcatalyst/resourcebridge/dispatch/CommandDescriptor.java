package tech.flowcatalyst.resourcebridge.dispatch;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One callable command as advertised to the transport.
 *
 * @param name        command identifier, e.g. "list_author"
 * @param description human-readable summary
 * @param inputSchema JSON Schema of the argument object
 */
public record CommandDescriptor(
    String name,
    String description,
    @JsonProperty("inputSchema") ObjectNode inputSchema
) {}
